package com.eainde.dialog.exception;

/**
 * Any other failure while a session turn was running.
 */
public class SessionExecutionException extends DialogRouterException {

    public SessionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
