package com.pipedesk.drive.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;

/**
 * The folder store could not be reached or answered with an error. No local state was changed
 * because of the failed call.
 */
@EqualsAndHashCode(callSuper = false)
public class StoreUnavailableException extends PipedeskDriveException {

    public StoreUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
