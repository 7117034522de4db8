package kr.jemi.zseat.seat.infrastructure.in.web.dto;

import kr.jemi.zseat.seat.domain.SeatStatistics;

public record SeatStatsResponse(int total, int available, int locked, int booked) {

    public static SeatStatsResponse from(SeatStatistics statistics) {
        return new SeatStatsResponse(
                statistics.total(),
                statistics.available(),
                statistics.locked(),
                statistics.booked()
        );
    }
}
