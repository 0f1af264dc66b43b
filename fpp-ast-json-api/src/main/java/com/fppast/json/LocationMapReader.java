package com.fppast.json;

import com.fppast.loc.LocationRegistry;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for loading the location map written next to the AST by fpp-to-json.
 */
public interface LocationMapReader {

    /**
     * Loads every entry of the map into the registry. A map with any rejected entry adds
     * nothing to the registry.
     *
     * @param json an object keyed by node id, each value holding {@code file}, {@code pos}
     *             and an optional {@code includingLoc}
     * @param registry the registry to fill
     * @return the number of entries loaded
     * @throws com.fppast.MissingLocationFieldException if an entry lacks {@code file} or {@code pos}
     */
    int load(String json, LocationRegistry registry);

    /**
     * Loads a location map file into the registry.
     *
     * @throws IOException if the file cannot be read
     * @throws AstJsonException if the file is not valid JSON
     */
    int load(Path file, LocationRegistry registry) throws IOException;
}
