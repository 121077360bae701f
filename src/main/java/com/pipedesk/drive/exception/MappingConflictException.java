package com.pipedesk.drive.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


// another writer already holds the live mapping for the same (entityType, entityId)
@EqualsAndHashCode(callSuper = false)
public class MappingConflictException extends PipedeskDriveException {

    public MappingConflictException(String message) {
        super(HttpStatus.CONFLICT, message);
    }

    public MappingConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, message, cause);
    }
}
