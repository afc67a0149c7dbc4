package com.eainde.dialog.exception;

import java.time.Duration;

public class ExternalCallTimeoutException extends DialogRouterException {

    public ExternalCallTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(operation + " did not complete within " + timeout.toMillis() + "ms", cause);
    }
}
