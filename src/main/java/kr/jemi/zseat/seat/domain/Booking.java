package kr.jemi.zseat.seat.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.time.Instant;

public record Booking(@NotBlank String seatId, @NotBlank String userId, @NotNull Instant bookedAt)
        implements SelfValidating {

    public Booking(String seatId, String userId, Instant bookedAt) {
        this.seatId = seatId;
        this.userId = userId;
        this.bookedAt = bookedAt;
        validateSelf();
    }
}
