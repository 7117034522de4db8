package kr.jemi.zseat.seat.domain;

import java.time.Duration;

public record LockResult(SeatSnapshot seat, LockOutcome outcome, Duration ttl) {

    public boolean extended() {
        return outcome == LockOutcome.EXTENDED;
    }
}
