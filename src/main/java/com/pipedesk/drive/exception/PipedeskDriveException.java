package com.pipedesk.drive.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


@Data
@EqualsAndHashCode(callSuper = false)
public class PipedeskDriveException extends RuntimeException {

    private HttpStatus status;

    public PipedeskDriveException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public PipedeskDriveException(HttpStatus status, Throwable cause) {
        super(cause);
        this.status = status;
    }

    public PipedeskDriveException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public PipedeskDriveException(String message) {
        super(message);
    }

    public PipedeskDriveException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may repeat the failed call later and expect a different outcome.
     */
    public boolean isRetryable() {
        return false;
    }

    public String getChainedMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // <exception name> : <exception message> -> <next>
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        sb.append("%s : %s -> ".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof PipedeskDriveException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getChainedMessage();
    }
}
