package kr.jemi.zseat.seat.application.port.in;

import kr.jemi.zseat.seat.domain.SeatListing;
import kr.jemi.zseat.seat.domain.SeatSnapshot;
import kr.jemi.zseat.seat.domain.SeatStatus;

public interface GetSeatsUseCase {

    SeatSnapshot getSeat(String seatId);

    /**
     * @param status null이면 상태 필터 없음
     * @param userId null이면 사용자 필터 없음. 선점자이거나 예매자인 좌석을 고른다.
     */
    SeatListing getSeats(SeatStatus status, String userId);
}
