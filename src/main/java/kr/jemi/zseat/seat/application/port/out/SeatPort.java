package kr.jemi.zseat.seat.application.port.out;

import kr.jemi.zseat.seat.domain.Seats;

import java.util.function.Function;

public interface SeatPort {

    /**
     * 좌석 격자에 대한 작업을 다른 모든 작업과 직렬화하여 실행한다.
     * action 안에서 일어난 조회/변경은 하나의 원자적 단계로 보인다.
     */
    <T> T atomically(Function<Seats, T> action);
}
