package com.fppast;

/**
 * Thrown when a variant tag is not part of the closed set expected at that point of the tree.
 */
public class InvalidFppToJsonFieldException extends FppAstException {

    private final String field;

    public InvalidFppToJsonFieldException(String field) {
        super("The " + field + " field is not valid");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
