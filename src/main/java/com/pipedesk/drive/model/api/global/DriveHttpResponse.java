package com.pipedesk.drive.model.api.global;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.pipedesk.drive.exception.PipedeskDriveException;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;


@Data
public class DriveHttpResponse<T> {

    private int statusCode;

    private String message;

    // true when repeating the call later may succeed
    private boolean retryable;

    private T data;

    @JsonSerialize(using = ToStringSerializer.class)
    private final long timestamp = System.currentTimeMillis();

    private DriveHttpResponse() {}

    public static <T> DriveHttpResponse<T> success(T data, String message) {
        DriveHttpResponse<T> result = new DriveHttpResponse<>();
        result.statusCode = HttpStatus.OK.value();
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> DriveHttpResponse<T> success(T data) {
        return success(data, "success");
    }

    public static DriveHttpResponse<Void> success() {
        return success(null);
    }

    public static DriveHttpResponse<Void> fail(PipedeskDriveException e) {
        DriveHttpResponse<Void> result = new DriveHttpResponse<>();
        result.statusCode = ObjectUtils.isEmpty(e.getStatus()) ?
                HttpStatus.INTERNAL_SERVER_ERROR.value() :
                e.getStatus().value();
        result.message = e.getChainedMessage();
        result.retryable = e.isRetryable();
        return result;
    }
}
