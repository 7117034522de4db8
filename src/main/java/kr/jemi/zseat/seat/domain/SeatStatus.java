package kr.jemi.zseat.seat.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum SeatStatus {
    AVAILABLE,  // 누구나 선점 가능
    LOCKED,     // 임시 선점, TTL 만료 시 AVAILABLE 복귀
    BOOKED;     // 예매 확정 (reset 전까지 유지)

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SeatStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.value().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
