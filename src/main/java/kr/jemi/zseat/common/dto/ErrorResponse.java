package kr.jemi.zseat.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import kr.jemi.zseat.common.exception.ErrorCode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int status, String code, String message, Long lockExpiresIn) {

    public static ErrorResponse from(ErrorCode errorCode) {
        return of(errorCode, errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(
                errorCode.getStatus().value(),
                errorCode.name(),
                message,
                null
        );
    }

    public ErrorResponse withLockExpiresIn(long seconds) {
        return new ErrorResponse(status, code, message, seconds);
    }
}
