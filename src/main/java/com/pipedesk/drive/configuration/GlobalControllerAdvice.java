package com.pipedesk.drive.configuration;

import com.baomidou.mybatisplus.core.exceptions.MybatisPlusException;
import com.pipedesk.drive.exception.*;
import com.pipedesk.drive.model.api.global.DriveHttpResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<DriveHttpResponse<Void>> handleResourceNotFoundException(ResourceNotFoundException e) {
        log.warn("controller failed. resource not found. ", e);
        return toResponse(DriveHttpResponse.fail(e));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<DriveHttpResponse<Void>> handleValidationException(ValidationException e) {
        log.warn("controller failed. validation failed. ", e);
        return toResponse(DriveHttpResponse.fail(e));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<DriveHttpResponse<Void>> handleStoreUnavailableException(StoreUnavailableException e) {
        log.warn("controller failed. folder store unavailable. ", e);
        return toResponse(DriveHttpResponse.fail(e));
    }

    @ExceptionHandler(MappingConflictException.class)
    public ResponseEntity<DriveHttpResponse<Void>> handleMappingConflictException(MappingConflictException e) {
        log.warn("controller failed. mapping conflict. ", e);
        return toResponse(DriveHttpResponse.fail(e));
    }

    @ExceptionHandler(JsonException.class)
    public ResponseEntity<DriveHttpResponse<Void>> handleJsonException(JsonException e) {
        log.warn("controller failed. json process failed. ", e);
        return toResponse(DriveHttpResponse.fail(e));
    }

    @ExceptionHandler(MybatisPlusException.class)
    public ResponseEntity<DriveHttpResponse<Void>> handleDBException(MybatisPlusException e) {
        log.warn("controller failed. db error happen.", e);
        return toResponse(DriveHttpResponse.fail(new DbException("db error.", e)));
    }

    @ExceptionHandler(PipedeskDriveException.class)
    public ResponseEntity<DriveHttpResponse<Void>> handlePipedeskDriveException(PipedeskDriveException e) {
        log.warn("controller failed. PipedeskDriveException happen", e);
        return toResponse(DriveHttpResponse.fail(e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<DriveHttpResponse<Void>> handleGlobalException(Exception e) {
        log.warn("controller failed.", e);
        return toResponse(DriveHttpResponse.fail(
                new PipedeskDriveException(HttpStatus.INTERNAL_SERVER_ERROR, e.toString())));
    }

    private static ResponseEntity<DriveHttpResponse<Void>> toResponse(DriveHttpResponse<Void> response) {
        return ResponseEntity.status(response.getStatusCode()).body(response);
    }
}
