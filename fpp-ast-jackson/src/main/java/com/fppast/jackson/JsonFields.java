package com.fppast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fppast.InternalAstError;
import com.fppast.InvalidFppToJsonFieldException;
import com.fppast.ast.Annotated;
import com.fppast.ast.AstNode;
import com.fppast.ast.WireEnum;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Field-level decoding combinators over fpp-to-json trees.
 *
 * <p>Wire conventions:</p>
 * <ul>
 *   <li>node: {@code {"AstNode": {"id": 7, "data": ...}}}</li>
 *   <li>optional: {@code {"Some": value}} when present; {@code "None"}, {@code null} or a missing
 *       field when absent</li>
 *   <li>annotated element: {@code [[pre...], value, [post...]]}, possibly wrapped as
 *       {@code {"node": [...]}}</li>
 *   <li>variant: an object holding exactly one key, the tag</li>
 * </ul>
 */
final class JsonFields {

    private static final String AST_NODE = "AstNode";
    private static final String SOME = "Some";
    private static final String NONE = "None";
    private static final String NODE = "node";

    private JsonFields() {
    }

    static JsonNode required(JsonNode obj, String field) {
        requireObject(obj, field);
        JsonNode value = obj.get(field);
        if (value == null || value.isNull()) {
            throw new InternalAstError("missing required field '" + field + "'");
        }
        return value;
    }

    static String string(JsonNode obj, String field) {
        return text(required(obj, field), field);
    }

    static String text(JsonNode value, String what) {
        if (!value.isTextual()) {
            throw new InternalAstError("expected a string for '" + what + "' but found " + value.getNodeType());
        }
        return value.textValue();
    }

    static boolean bool(JsonNode obj, String field) {
        JsonNode value = required(obj, field);
        if (!value.isBoolean()) {
            throw new InternalAstError("expected a boolean for '" + field + "' but found " + value.getNodeType());
        }
        return value.booleanValue();
    }

    /**
     * Decodes an optional field. Absence never reaches the decoder.
     */
    static <T> Optional<T> optional(JsonNode obj, String field, Function<JsonNode, T> decoder) {
        requireObject(obj, field);
        return optional(obj.get(field), decoder);
    }

    static <T> Optional<T> optional(JsonNode value, Function<JsonNode, T> decoder) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        if (value.isTextual() && NONE.equals(value.textValue())) {
            return Optional.empty();
        }
        if (value.isObject() && value.size() == 1 && value.has(SOME)) {
            return Optional.of(decoder.apply(value.get(SOME)));
        }
        throw new InternalAstError("invalid optional value: " + value);
    }

    static <T> List<T> list(JsonNode array, Function<JsonNode, T> decoder) {
        return list(array, decoder, false);
    }

    /**
     * Decodes every element of an array, keeping input order. With {@code parallel} set the
     * elements are decoded on the common pool; the first failure is rethrown.
     */
    static <T> List<T> list(JsonNode array, Function<JsonNode, T> decoder, boolean parallel) {
        requireArray(array);
        if (parallel && array.size() > 1) {
            return IntStream.range(0, array.size())
                .parallel()
                .mapToObj(i -> decoder.apply(array.get(i)))
                .collect(Collectors.toUnmodifiableList());
        }
        List<T> result = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            result.add(decoder.apply(element));
        }
        return List.copyOf(result);
    }

    static <T> List<Annotated<T>> annotatedList(JsonNode array, Function<JsonNode, T> decoder) {
        return annotatedList(array, decoder, false);
    }

    static <T> List<Annotated<T>> annotatedList(JsonNode array, Function<JsonNode, T> decoder, boolean parallel) {
        return list(array, element -> annotated(element, decoder), parallel);
    }

    static <T> Annotated<T> annotated(JsonNode element, Function<JsonNode, T> decoder) {
        JsonNode triple = element;
        if (triple.isObject() && triple.size() == 1 && triple.has(NODE) && triple.get(NODE).isArray()) {
            triple = triple.get(NODE);
        }
        if (!triple.isArray() || triple.size() != 3) {
            throw new InternalAstError("expected an annotated [pre, value, post] element but found " + element);
        }
        return new Annotated<>(strings(triple.get(0)), decoder.apply(triple.get(1)), strings(triple.get(2)));
    }

    static List<String> strings(JsonNode array) {
        return list(array, value -> text(value, "annotation"));
    }

    /**
     * Decodes {@code {"AstNode": {"id": ..., "data": ...}}}, keeping the input id.
     */
    static <T> AstNode<T> node(JsonNode wrapper, Function<JsonNode, ? extends T> decoder) {
        JsonNode astNode = required(wrapper, AST_NODE);
        int id = id(astNode);
        T data = decoder.apply(required(astNode, "data"));
        return AstNode.createWithId(data, id);
    }

    static int id(JsonNode astNode) {
        JsonNode id = required(astNode, "id");
        if (!id.canConvertToInt() || !id.isIntegralNumber()) {
            throw new InternalAstError("AST node id is not an integer: " + id);
        }
        return id.intValue();
    }

    /**
     * Returns the single populated key of a variant object and its payload. A bare string is
     * read as a tag with no payload.
     */
    static Map.Entry<String, JsonNode> variant(JsonNode tagged, String family) {
        if (tagged != null && tagged.isTextual()) {
            return Map.entry(tagged.textValue(), MissingNode.getInstance());
        }
        if (tagged == null || !tagged.isObject()) {
            throw new InternalAstError("expected a tagged " + family + " object but found "
                + (tagged == null ? "nothing" : tagged.getNodeType()));
        }
        if (tagged.size() != 1) {
            List<String> keys = new ArrayList<>();
            tagged.fieldNames().forEachRemaining(keys::add);
            throw new InternalAstError("expected exactly one variant key for " + family + " but found " + keys);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = tagged.fields();
        return fields.next();
    }

    static <E extends Enum<E> & WireEnum> E enumTag(JsonNode tagged, Class<E> type) {
        String tag = variant(tagged, type.getSimpleName()).getKey();
        for (E constant : type.getEnumConstants()) {
            if (constant.tag().equals(tag)) {
                return constant;
            }
        }
        throw new InvalidFppToJsonFieldException(tag);
    }

    private static void requireObject(JsonNode obj, String field) {
        if (obj == null || !obj.isObject()) {
            throw new InternalAstError("expected an object holding '" + field + "' but found "
                + (obj == null ? "nothing" : obj.getNodeType()));
        }
    }

    private static void requireArray(JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new InternalAstError("expected an array but found "
                + (array == null ? "nothing" : array.getNodeType()));
        }
    }
}
