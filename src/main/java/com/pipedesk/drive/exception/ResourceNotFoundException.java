package com.pipedesk.drive.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


// the referenced entity does not exist in the system of record
@EqualsAndHashCode(callSuper = false)
public class ResourceNotFoundException extends PipedeskDriveException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(HttpStatus.NOT_FOUND, message, cause);
    }
}
