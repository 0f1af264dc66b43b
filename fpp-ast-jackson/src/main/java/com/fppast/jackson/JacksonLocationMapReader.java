package com.fppast.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fppast.InternalAstError;
import com.fppast.MissingLocationFieldException;
import com.fppast.json.AstJsonException;
import com.fppast.json.LocationMapReader;
import com.fppast.loc.Location;
import com.fppast.loc.LocationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads an fpp-to-json location map into a {@link LocationRegistry}.
 */
public class JacksonLocationMapReader implements LocationMapReader {

    private static final Logger log = LoggerFactory.getLogger(JacksonLocationMapReader.class);

    private final ObjectMapper mapper;

    public JacksonLocationMapReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public int load(String json, LocationRegistry registry) {
        return load(readTree(json), registry);
    }

    @Override
    public int load(Path file, LocationRegistry registry) throws IOException {
        int count = load(readTree(Files.readString(file)), registry);
        log.info("Loaded {} location(s) from {}", count, file);
        return count;
    }

    /**
     * Decodes every entry before touching the registry, so a rejected map leaves it unchanged.
     */
    int load(JsonNode root, LocationRegistry registry) {
        if (root == null || !root.isObject()) {
            throw new InternalAstError("location map must be a JSON object");
        }
        Map<Integer, Location> staged = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            staged.put(parseId(entry.getKey()), location(entry.getKey(), entry.getValue()));
        }
        staged.forEach(registry::put);
        log.debug("Location registry holds {} entries", registry.size());
        return staged.size();
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to read location map", e);
        }
    }

    private static int parseId(String key) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            throw new InternalAstError("location map key '" + key + "' is not an AST node id", e);
        }
    }

    private static Location location(String id, JsonNode descriptor) {
        if (descriptor == null || !descriptor.isObject()) {
            throw new InternalAstError("location map entry " + id + " is not an object");
        }
        String file = requiredText(id, descriptor, "file");
        String pos = requiredText(id, descriptor, "pos");
        JsonNode including = descriptor.get("includingLoc");
        Optional<String> includingLoc = including == null || including.isNull()
            ? Optional.empty()
            : Optional.of(text(id, "includingLoc", including));
        return new Location(Paths.get(file), pos, includingLoc);
    }

    private static String requiredText(String id, JsonNode descriptor, String field) {
        JsonNode value = descriptor.get(field);
        if (value == null || value.isNull()) {
            throw new MissingLocationFieldException(id, field);
        }
        return text(id, field, value);
    }

    private static String text(String id, String field, JsonNode value) {
        if (!value.isTextual()) {
            throw new InternalAstError("location map entry " + id + " has a non-string '" + field
                + "': " + value.getNodeType());
        }
        return value.textValue();
    }
}
