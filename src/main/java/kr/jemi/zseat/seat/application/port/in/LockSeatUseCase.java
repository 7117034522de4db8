package kr.jemi.zseat.seat.application.port.in;

import kr.jemi.zseat.seat.domain.LockResult;

public interface LockSeatUseCase {

    /**
     * 좌석을 선점한다. 이미 같은 유저가 선점한 경우 만료 시각만 연장한다.
     */
    LockResult lock(String seatId, String userId);
}
