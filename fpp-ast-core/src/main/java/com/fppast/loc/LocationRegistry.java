package com.fppast.loc;

import com.fppast.InternalAstError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps AST node ids to source locations.
 *
 * <p>The registry is filled in one pass before translation and only read afterwards.
 * Reads need no external synchronization.</p>
 */
public final class LocationRegistry {

    private static final Logger log = LoggerFactory.getLogger(LocationRegistry.class);

    private final Map<Integer, Location> locations = new ConcurrentHashMap<>();

    /**
     * Puts a location into the registry, replacing any location already stored for the id.
     */
    public void put(int id, Location location) {
        Location previous = locations.put(id, location);
        if (previous != null && !previous.equals(location)) {
            log.debug("Replaced location of AST node {}: {} -> {}", id, previous, location);
        }
    }

    /**
     * Gets the location of a node.
     *
     * @throws InternalAstError if the id has no location
     */
    public Location get(int id) {
        Location location = locations.get(id);
        if (location == null) {
            throw new InternalAstError("unknown location for AST node " + id);
        }
        return location;
    }

    public Optional<Location> getOptional(int id) {
        return Optional.ofNullable(locations.get(id));
    }

    /**
     * Returns an immutable snapshot of the registry.
     */
    public Map<Integer, Location> asMap() {
        return Map.copyOf(locations);
    }

    public Optional<Integer> maxId() {
        return locations.keySet().stream().max(Integer::compare);
    }

    public int size() {
        return locations.size();
    }
}
