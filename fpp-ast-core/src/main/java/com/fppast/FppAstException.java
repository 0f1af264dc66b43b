package com.fppast;

/**
 * Base class for failures raised while rebuilding an FPP AST from fpp-to-json output.
 *
 * <p>Every failure aborts the current translation; no partial AST is ever returned.</p>
 */
public abstract class FppAstException extends RuntimeException {

    protected FppAstException(String message) {
        super(message);
    }

    protected FppAstException(String message, Throwable cause) {
        super(message, cause);
    }
}
