package kr.jemi.zseat.seat.infrastructure.in.web;

import kr.jemi.zseat.common.dto.ErrorResponse;
import kr.jemi.zseat.seat.domain.SeatLockedException;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 선점 충돌 응답에 남은 선점 시간을 싣는다. 나머지 예외는 GlobalExceptionHandler가 처리한다.
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice(basePackages = "kr.jemi.zseat.seat")
public class SeatExceptionHandler {

    @ExceptionHandler(SeatLockedException.class)
    public ResponseEntity<ErrorResponse> handleSeatLocked(SeatLockedException e) {
        ErrorResponse response = ErrorResponse.of(e.getErrorCode(), e.getMessage())
                .withLockExpiresIn(e.getLockExpiresInSeconds());
        return ResponseEntity.status(e.getErrorCode().getStatus()).body(response);
    }
}
