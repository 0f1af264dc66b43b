package com.fppast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fppast.InvalidFppToJsonFieldException;
import com.fppast.NotSupportedInFppToJsonException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * The closed set of variants accepted at one point of the tree, keyed by wire tag.
 *
 * <p>A tag outside the set is invalid; a tag marked unsupported belongs to the FPP grammar
 * but is rejected on purpose.</p>
 */
final class VariantTable<R> {

    private final String family;
    private final Map<String, Function<JsonNode, ? extends R>> decoders = new LinkedHashMap<>();
    private final Set<String> unsupported = new HashSet<>();

    VariantTable(String family) {
        this.family = family;
    }

    VariantTable<R> on(String tag, Function<JsonNode, ? extends R> decoder) {
        decoders.put(tag, decoder);
        return this;
    }

    VariantTable<R> unsupported(String tag) {
        unsupported.add(tag);
        return this;
    }

    R decode(JsonNode tagged) {
        Map.Entry<String, JsonNode> variant = JsonFields.variant(tagged, family);
        String tag = variant.getKey();
        if (unsupported.contains(tag)) {
            throw new NotSupportedInFppToJsonException(tag);
        }
        Function<JsonNode, ? extends R> decoder = decoders.get(tag);
        if (decoder == null) {
            throw new InvalidFppToJsonFieldException(tag);
        }
        return decoder.apply(variant.getValue());
    }
}
