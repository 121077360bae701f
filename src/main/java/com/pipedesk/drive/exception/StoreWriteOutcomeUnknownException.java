package com.pipedesk.drive.exception;

import lombok.EqualsAndHashCode;

/**
 * A write to the folder store timed out or lost its connection. The item may or may not have been
 * created, so the call is never repeated automatically.
 */
@EqualsAndHashCode(callSuper = false)
public class StoreWriteOutcomeUnknownException extends StoreUnavailableException {

    public StoreWriteOutcomeUnknownException(String message) {
        super(message);
    }

    public StoreWriteOutcomeUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
