package com.fppast.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fppast.TranslationSession;
import com.fppast.ast.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.fppast.jackson.AstJson.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Every optional field decodes to present exactly when it is written as {@code {"Some": v}},
 * whichever way absence is spelled.
 */
public class OptionalFieldTest {

    enum Encoding {
        SOME, NONE_TAG, JSON_NULL, ABSENT;

        void add(List<String> fields, String name, String value) {
            switch (this) {
                case SOME -> fields.addAll(List.of(name, some(value)));
                case NONE_TAG -> fields.addAll(List.of(name, AstJson.NONE));
                case JSON_NULL -> fields.addAll(List.of(name, "null"));
                case ABSENT -> {
                }
            }
        }
    }

    private final ObjectMapper mapper = FppAstJackson.createObjectMapper();
    private final FppAstTranslator translator = new FppAstTranslator(TranslationSession.create());

    private static List<String> fields(String... pairs) {
        return new ArrayList<>(List.of(pairs));
    }

    private static String obj(List<String> fields) {
        return AstJson.obj(fields.toArray(String[]::new));
    }

    private ModuleMember.Node moduleMember(String tag, String node) throws Exception {
        return translator.moduleMembers(mapper.readTree(array(member(tag, node)))).get(0).node().value().data();
    }

    private ComponentMember.Node componentMember(String tag, String node) throws Exception {
        return translator.componentMembers(mapper.readTree(array(member(tag, node)))).get(0).node().value().data();
    }

    private static <T> void assertPresence(Encoding encoding, Optional<AstNode<T>> value, int expectedId) {
        if (encoding == Encoding.SOME) {
            assertEquals(expectedId, value.orElseThrow().id());
        } else {
            assertTrue(value.isEmpty());
        }
    }

    @ParameterizedTest
    @EnumSource(Encoding.class)
    void testArrayOptionals(Encoding encoding) throws Exception {
        List<String> fields = fields("name", quote("A"), "size", intLit(2, "3"), "eltType", u32(3));
        encoding.add(fields, "default", intLit(4, "0"));
        encoding.add(fields, "format", node(5, quote("{}")));

        DefArray def = (DefArray) moduleMember("DefArray", node(1, obj(fields)));

        assertPresence(encoding, def.defaultValue(), 4);
        assertPresence(encoding, def.format(), 5);
    }

    @ParameterizedTest
    @EnumSource(Encoding.class)
    void testComponentInstanceOptionals(Encoding encoding) throws Exception {
        List<String> fields = fields("name", quote("c"), "component", unqualified(2, "C"), "baseId", intLit(3, "0"));
        encoding.add(fields, "implType", node(4, quote("Impl")));
        encoding.add(fields, "file", node(5, quote("C.hpp")));
        encoding.add(fields, "queueSize", intLit(6, "10"));
        encoding.add(fields, "stackSize", intLit(7, "4096"));
        encoding.add(fields, "priority", intLit(8, "1"));
        encoding.add(fields, "cpu", intLit(9, "0"));
        fields.addAll(List.of("initSpecs", array()));

        DefComponentInstance instance = (DefComponentInstance) moduleMember("DefComponentInstance", node(1, obj(fields)));

        assertPresence(encoding, instance.implType(), 4);
        assertPresence(encoding, instance.file(), 5);
        assertPresence(encoding, instance.queueSize(), 6);
        assertPresence(encoding, instance.stackSize(), 7);
        assertPresence(encoding, instance.priority(), 8);
        assertPresence(encoding, instance.cpu(), 9);
    }

    @ParameterizedTest
    @EnumSource(Encoding.class)
    void testParamOptionals(Encoding encoding) throws Exception {
        List<String> fields = fields("name", quote("P"), "typeName", u32(2), "isExternal", "false");
        encoding.add(fields, "default", intLit(3, "1"));
        encoding.add(fields, "id", intLit(4, "0x10"));
        encoding.add(fields, "setOpcode", intLit(5, "0x20"));
        encoding.add(fields, "saveOpcode", intLit(6, "0x21"));

        SpecParam param = (SpecParam) componentMember("SpecParam", node(1, obj(fields)));

        assertPresence(encoding, param.defaultValue(), 3);
        assertPresence(encoding, param.id(), 4);
        assertPresence(encoding, param.setOpcode(), 5);
        assertPresence(encoding, param.saveOpcode(), 6);
    }

    @ParameterizedTest
    @EnumSource(Encoding.class)
    void testTelemetryChannelOptionals(Encoding encoding) throws Exception {
        List<String> fields = fields("name", quote("T"), "typeName", u32(2), "low", array(), "high", array());
        encoding.add(fields, "id", intLit(3, "0"));
        encoding.add(fields, "update", tagged("Always"));
        encoding.add(fields, "format", node(4, quote("{}")));

        SpecTlmChannel channel = (SpecTlmChannel) componentMember("SpecTlmChannel", node(1, obj(fields)));

        assertPresence(encoding, channel.id(), 3);
        assertEquals(encoding == Encoding.SOME ? Optional.of(SpecTlmChannel.Update.ALWAYS) : Optional.empty(),
            channel.update());
        assertPresence(encoding, channel.format(), 4);
    }

    @ParameterizedTest
    @EnumSource(Encoding.class)
    void testConnectionOptionals(Encoding encoding) throws Exception {
        List<String> connection = fields(
            "isUnmatched", "true",
            "fromPort", node(2, AstJson.obj("componentInstance", unqualified(3, "a"), "portName", ident(4, "out"))),
            "toPort", node(5, AstJson.obj("componentInstance", unqualified(6, "b"), "portName", ident(7, "in"))));
        encoding.add(connection, "fromIndex", intLit(8, "0"));
        encoding.add(connection, "toIndex", intLit(9, "1"));
        String graph = node(1, tagged("Direct", "name", quote("G"), "connections", array(obj(connection))));

        List<TopologyMember> members = translator.topologyMembers(mapper.readTree(array(member("SpecConnectionGraph", graph))));

        Connection c = ((SpecConnectionGraph.Direct) members.get(0).node().value().data()).connections().get(0);
        assertTrue(c.isUnmatched());
        assertPresence(encoding, c.fromIndex(), 8);
        assertPresence(encoding, c.toIndex(), 9);
    }
}
