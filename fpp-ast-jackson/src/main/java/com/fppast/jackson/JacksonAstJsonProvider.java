package com.fppast.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fppast.TranslationSession;
import com.fppast.ast.TransUnit;
import com.fppast.json.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;
    private final LocationMapReader locationMapReader;

    public JacksonAstJsonProvider() {
        this(FppAstJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
        this.locationMapReader = new JacksonLocationMapReader(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public LocationMapReader getLocationMapReader() {
        return locationMapReader;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Object value) throws AstJsonException {
            try {
                return mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST value", e);
            }
        }

        @Override
        public String serializePretty(Object value) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST value", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public List<TransUnit> deserializeTransUnits(String json, TranslationSession session) {
            JsonNode root;
            try {
                root = mapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to read AST document", e);
            }
            return new FppAstTranslator(session).translateTransUnits(root);
        }

        @Override
        public List<TransUnit> deserializeTransUnits(Path file, TranslationSession session) throws IOException {
            return deserializeTransUnits(Files.readString(file), session);
        }
    }
}
