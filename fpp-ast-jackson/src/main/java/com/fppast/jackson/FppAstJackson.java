package com.fppast.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for the FPP AST.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = FppAstJackson.createObjectMapper();
 * JsonNode root = mapper.readTree(json);
 * List&lt;TransUnit&gt; units = new FppAstTranslator(session).translateTransUnits(root);
 * </pre>
 */
public final class FppAstJackson {

    private FppAstJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for the FPP AST.
     *
     * The returned mapper:
     * - Reads fpp-to-json documents into trees, keeping integer ids exact
     * - Writes Optional fields only when present
     * - Writes closed-family variants wrapped in their type name
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.registerModule(new Jdk8Module());

        // Absent optionals are left out rather than written as null
        mapper.setSerializationInclusion(JsonInclude.Include.NON_ABSENT);

        // TypeNameBool has no components
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
