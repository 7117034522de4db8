package kr.jemi.zseat.seat.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import kr.jemi.zseat.common.validation.SelfValidating;

import java.time.Instant;

/**
 * 특정 시점의 좌석 상태 사본. 잠금 밖으로 내보낼 때 사용한다.
 * lockExpiresInSeconds는 LOCKED일 때만 값이 있다.
 */
public record SeatSnapshot(
        @NotBlank String id,
        int row,
        int number,
        @NotNull SeatStatus status,
        String holder,
        Instant lockAcquiredAt,
        Instant lockExpiresAt,
        Long lockExpiresInSeconds,
        Instant bookedAt
) implements SelfValidating {

    public SeatSnapshot(String id, int row, int number, SeatStatus status, String holder,
                        Instant lockAcquiredAt, Instant lockExpiresAt, Long lockExpiresInSeconds,
                        Instant bookedAt) {
        this.id = id;
        this.row = row;
        this.number = number;
        this.status = status;
        this.holder = holder;
        this.lockAcquiredAt = lockAcquiredAt;
        this.lockExpiresAt = lockExpiresAt;
        this.lockExpiresInSeconds = lockExpiresInSeconds;
        this.bookedAt = bookedAt;
        validate();
    }

    private void validate() {
        validateSelf();
        switch (status) {
            case AVAILABLE -> {
                if (holder != null || lockExpiresAt != null || bookedAt != null) {
                    throw new IllegalArgumentException("AVAILABLE 좌석은 소유자와 시각 정보가 없어야 합니다");
                }
            }
            case LOCKED -> {
                if (holder == null || lockAcquiredAt == null || lockExpiresAt == null || bookedAt != null) {
                    throw new IllegalArgumentException("LOCKED 좌석은 선점자와 선점 시각이 있어야 합니다");
                }
            }
            case BOOKED -> {
                if (holder == null || bookedAt == null || lockExpiresAt != null) {
                    throw new IllegalArgumentException("BOOKED 좌석은 예매자와 예매 시각이 있어야 합니다");
                }
            }
        }
    }

    public boolean isOwnedBy(String actor) {
        return holder != null && holder.equals(actor);
    }

    public Booking toBooking() {
        if (status != SeatStatus.BOOKED) {
            throw new IllegalStateException("BOOKED 좌석만 예매 내역으로 변환할 수 있습니다. 현재: " + status);
        }
        return new Booking(id, holder, bookedAt);
    }
}
