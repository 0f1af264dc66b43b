package com.fppast.json;

/**
 * Interface for writing typed FPP AST values as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST value (a node, a member, a translation unit or a list of them).
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Object value) throws AstJsonException;

    /**
     * Serializes an AST value as pretty-printed JSON.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Object value) throws AstJsonException;
}
