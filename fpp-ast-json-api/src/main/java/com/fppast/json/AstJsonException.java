package com.fppast.json;

/**
 * Exception thrown when JSON input cannot be read or AST nodes cannot be written as JSON.
 *
 * <p>Structural problems inside well-formed JSON are reported through
 * {@link com.fppast.FppAstException} subclasses instead.</p>
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
