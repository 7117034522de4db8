package kr.jemi.zseat.seat.infrastructure.in.web.dto;

import kr.jemi.zseat.seat.domain.SeatSnapshot;
import kr.jemi.zseat.seat.domain.SeatStatus;

import java.time.Instant;

public record SeatResponse(
        String id,
        int row,
        int number,
        String status,
        String lockedBy,
        Instant lockedAt,
        Long lockExpiresIn,
        String bookedBy,
        Instant bookedAt
) {

    public static SeatResponse from(SeatSnapshot seat) {
        boolean locked = seat.status() == SeatStatus.LOCKED;
        boolean booked = seat.status() == SeatStatus.BOOKED;
        return new SeatResponse(
                seat.id(),
                seat.row(),
                seat.number(),
                seat.status().value(),
                locked ? seat.holder() : null,
                locked ? seat.lockAcquiredAt() : null,
                seat.lockExpiresInSeconds(),
                booked ? seat.holder() : null,
                booked ? seat.bookedAt() : null
        );
    }
}
