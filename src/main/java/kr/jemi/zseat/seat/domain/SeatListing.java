package kr.jemi.zseat.seat.domain;

import java.util.List;

/**
 * 필터가 적용된 좌석 목록과 전체 좌석 기준 통계.
 */
public record SeatListing(SeatStatistics statistics, List<SeatSnapshot> seats) {

    public SeatListing {
        seats = List.copyOf(seats);
    }
}
