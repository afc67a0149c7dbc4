package com.eainde.dialog.exception;

/**
 * Base of all failures the router reports to its callers.
 */
public class DialogRouterException extends RuntimeException {

    public DialogRouterException(String message) {
        super(message);
    }

    public DialogRouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
