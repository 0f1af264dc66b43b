package com.fppast;

/**
 * Thrown when a location map entry lacks one of its required descriptor fields.
 */
public class MissingLocationFieldException extends FppAstException {

    private final String id;
    private final String field;

    public MissingLocationFieldException(String id, String field) {
        super("Location map for ID " + id + " is missing required field " + field);
        this.id = id;
        this.field = field;
    }

    public String getId() {
        return id;
    }

    public String getField() {
        return field;
    }
}
