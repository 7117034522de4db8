package kr.jemi.zseat.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    SEAT_NOT_FOUND(404, "존재하지 않는 좌석입니다"),
    SEAT_ALREADY_BOOKED(409, "이미 예매가 확정된 좌석입니다"),
    SEAT_LOCKED_BY_OTHER(409, "다른 사용자가 선점한 좌석입니다"),
    NOT_LOCK_HOLDER(403, "좌석을 선점한 사용자만 처리할 수 있습니다"),
    SEAT_LOCK_REQUIRED(400, "예매 확정 전에 좌석을 먼저 선점해야 합니다"),
    SEAT_NOT_LOCKED(400, "선점된 좌석이 아닙니다"),
    INVALID_ACTOR(400, "userId는 필수입니다"),
    INVALID_REQUEST(400, "잘못된 요청입니다"),
    INVALID_SEAT_STATUS(400, "유효하지 않은 좌석 상태입니다"),
    ROUTE_NOT_FOUND(404, "존재하지 않는 경로입니다"),
    METHOD_NOT_ALLOWED(405, "지원하지 않는 HTTP 메서드입니다"),
    UNSUPPORTED_MEDIA_TYPE(415, "지원하지 않는 Content-Type입니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
