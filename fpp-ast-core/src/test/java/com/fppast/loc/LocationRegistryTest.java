package com.fppast.loc;

import com.fppast.InternalAstError;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LocationRegistryTest {

    private static final Location A = new Location(Path.of("a.fpp"), "1:1", Optional.empty());
    private static final Location B = new Location(Path.of("b.fpp"), "3.7", Optional.of("top.fpp: 2.1"));

    @Test
    void testGetReturnsStoredLocation() {
        LocationRegistry registry = new LocationRegistry();
        registry.put(5, A);

        assertEquals(A, registry.get(5));
        assertEquals(Optional.of(A), registry.getOptional(5));
    }

    @Test
    void testPutOverwrites() {
        LocationRegistry registry = new LocationRegistry();
        registry.put(5, A);
        registry.put(5, B);

        assertEquals(B, registry.get(5));
        assertEquals(1, registry.size());
    }

    @Test
    void testGetUnknownIdIsInternalError() {
        LocationRegistry registry = new LocationRegistry();

        InternalAstError e = assertThrows(InternalAstError.class, () -> registry.get(42));
        assertEquals("unknown location for AST node 42", e.getMessage());
    }

    @Test
    void testGetOptionalUnknownIdIsEmpty() {
        assertTrue(new LocationRegistry().getOptional(42).isEmpty());
    }

    @Test
    void testAsMapIsSnapshot() {
        LocationRegistry registry = new LocationRegistry();
        registry.put(1, A);
        Map<Integer, Location> snapshot = registry.asMap();
        registry.put(2, B);

        assertEquals(Map.of(1, A), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put(3, A));
    }

    @Test
    void testMaxId() {
        LocationRegistry registry = new LocationRegistry();
        assertTrue(registry.maxId().isEmpty());

        registry.put(7, A);
        registry.put(30, B);
        registry.put(12, A);
        assertEquals(Optional.of(30), registry.maxId());
    }

    @Test
    void testLocationToStringMentionsInclude() {
        assertEquals("a.fpp: 1:1", A.toString());
        assertTrue(B.toString().contains("included at top.fpp: 2.1"));
    }
}
