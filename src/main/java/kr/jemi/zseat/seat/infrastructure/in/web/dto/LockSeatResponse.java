package kr.jemi.zseat.seat.infrastructure.in.web.dto;

import kr.jemi.zseat.seat.domain.LockResult;
import kr.jemi.zseat.seat.domain.SeatSnapshot;

import java.time.Instant;

public record LockSeatResponse(
        String seatId,
        String status,
        String lockedBy,
        Instant lockedAt,
        long lockExpiresIn,
        boolean extended
) {

    public static LockSeatResponse from(LockResult result) {
        SeatSnapshot seat = result.seat();
        return new LockSeatResponse(
                seat.id(),
                seat.status().value(),
                seat.holder(),
                seat.lockAcquiredAt(),
                result.ttl().toSeconds(),
                result.extended()
        );
    }
}
