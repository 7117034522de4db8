package kr.jemi.zseat.seat.domain;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;

/**
 * 다른 사용자가 선점 중인 좌석에 대한 선점 시도. 남은 선점 시간(초)을 함께 전달한다.
 */
public class SeatLockedException extends BusinessException {

    private final long lockExpiresInSeconds;

    public SeatLockedException(String seatId, long lockExpiresInSeconds) {
        super(ErrorCode.SEAT_LOCKED_BY_OTHER,
                "좌석 " + seatId + "은(는) 다른 사용자가 선점 중입니다");
        this.lockExpiresInSeconds = lockExpiresInSeconds;
    }

    public long getLockExpiresInSeconds() {
        return lockExpiresInSeconds;
    }
}
