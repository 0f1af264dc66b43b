package com.fppast;

/**
 * Thrown for constructs the FPP grammar knows but this translator deliberately leaves out,
 * such as include directives and location specifiers.
 */
public class NotSupportedInFppToJsonException extends FppAstException {

    private final String field;

    public NotSupportedInFppToJsonException(String field) {
        super("The " + field + " field is not supported in fpp-to-json");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
