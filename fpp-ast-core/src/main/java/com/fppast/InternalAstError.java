package com.fppast;

/**
 * A broken translator invariant: an empty identifier list, a node id with no location,
 * or a payload whose shape cannot come from a well-formed producer.
 */
public class InternalAstError extends FppAstException {

    public InternalAstError(String message) {
        super(message);
    }

    public InternalAstError(String message, Throwable cause) {
        super(message, cause);
    }
}
