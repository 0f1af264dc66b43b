package com.fppast.ast;

/**
 * Member of a telemetry packet. Packet members carry no annotations.
 */
public sealed interface TlmPacketMember permits TlmChannelIdentifier {
}
