package kr.jemi.zseat.seat.domain;

public enum LockOutcome {
    ACQUIRED,
    EXTENDED
}
