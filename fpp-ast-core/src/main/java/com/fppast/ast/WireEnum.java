package com.fppast.ast;

/**
 * An enumeration whose constants are written by fpp-to-json as single-key tag objects,
 * for example {@code {"Active": {}}}.
 */
public interface WireEnum {

    /**
     * The tag that names this constant on the wire.
     */
    String tag();
}
