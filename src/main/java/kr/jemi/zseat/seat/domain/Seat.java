package kr.jemi.zseat.seat.domain;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 좌석 한 개의 상태 머신.
 *
 * <pre>
 * AVAILABLE --lock--> LOCKED --confirm--> BOOKED
 *     ^                 |
 *     +--release/expire-+
 * </pre>
 *
 * 스레드 안전하지 않다. 호출자는 {@link Seats} 단위로 직렬화해야 한다.
 */
public class Seat {

    private final SeatId id;
    private SeatStatus status;
    private String holder;
    private Instant lockAcquiredAt;
    private Instant lockExpiresAt;
    private Instant bookedAt;

    public Seat(SeatId id) {
        this.id = Objects.requireNonNull(id, "id");
        clear();
    }

    public LockOutcome lock(String actor, Instant now, Duration ttl) {
        switch (status) {
            case BOOKED -> throw new BusinessException(ErrorCode.SEAT_ALREADY_BOOKED,
                    "좌석 " + id + "은(는) 이미 예매되었습니다");
            case LOCKED -> {
                if (!holder.equals(actor)) {
                    throw new SeatLockedException(id.value(), remainingSeconds(now));
                }
                // 최초 선점 시각은 유지하고 만료 시각만 연장
                lockExpiresAt = now.plus(ttl);
                return LockOutcome.EXTENDED;
            }
            case AVAILABLE -> {
                status = SeatStatus.LOCKED;
                holder = actor;
                lockAcquiredAt = now;
                lockExpiresAt = now.plus(ttl);
                return LockOutcome.ACQUIRED;
            }
        }
        throw new IllegalStateException("알 수 없는 좌석 상태: " + status);
    }

    public void confirm(String actor, Instant now) {
        if (status == SeatStatus.BOOKED) {
            throw new BusinessException(ErrorCode.SEAT_ALREADY_BOOKED,
                    "좌석 " + id + "은(는) 이미 예매되었습니다");
        }
        if (status == SeatStatus.AVAILABLE) {
            throw new BusinessException(ErrorCode.SEAT_LOCK_REQUIRED,
                    "좌석 " + id + "을(를) 먼저 선점해야 예매를 확정할 수 있습니다");
        }
        if (!holder.equals(actor)) {
            throw new BusinessException(ErrorCode.NOT_LOCK_HOLDER,
                    "좌석 " + id + "을(를) 선점한 사용자만 예매를 확정할 수 있습니다");
        }
        status = SeatStatus.BOOKED;
        bookedAt = now;
        lockAcquiredAt = null;
        lockExpiresAt = null;
    }

    public void release(String actor) {
        if (status != SeatStatus.LOCKED) {
            throw new BusinessException(ErrorCode.SEAT_NOT_LOCKED,
                    "좌석 " + id + "은(는) 선점 상태가 아닙니다");
        }
        if (!holder.equals(actor)) {
            throw new BusinessException(ErrorCode.NOT_LOCK_HOLDER,
                    "본인이 선점한 좌석만 해제할 수 있습니다");
        }
        clear();
    }

    /**
     * 선점이 만료됐으면 AVAILABLE로 되돌린다.
     *
     * @return 회수했으면 true
     */
    public boolean expireIfDue(Instant now) {
        if (status != SeatStatus.LOCKED || now.isBefore(lockExpiresAt)) {
            return false;
        }
        clear();
        return true;
    }

    public void reset() {
        clear();
    }

    public boolean isOwnedBy(String actor) {
        return holder != null && holder.equals(actor);
    }

    public long remainingSeconds(Instant now) {
        if (status != SeatStatus.LOCKED) {
            return 0;
        }
        long millis = Duration.between(now, lockExpiresAt).toMillis();
        return Math.max(0, (millis + 999) / 1000);
    }

    public SeatSnapshot snapshot(Instant now) {
        return new SeatSnapshot(
                id.value(),
                id.row(),
                id.number(),
                status,
                holder,
                lockAcquiredAt,
                lockExpiresAt,
                status == SeatStatus.LOCKED ? remainingSeconds(now) : null,
                bookedAt
        );
    }

    private void clear() {
        status = SeatStatus.AVAILABLE;
        holder = null;
        lockAcquiredAt = null;
        lockExpiresAt = null;
        bookedAt = null;
    }

    public SeatId getId() {
        return id;
    }

    public SeatStatus getStatus() {
        return status;
    }

    public String getHolder() {
        return holder;
    }

    public Instant getLockAcquiredAt() {
        return lockAcquiredAt;
    }

    public Instant getLockExpiresAt() {
        return lockExpiresAt;
    }

    public Instant getBookedAt() {
        return bookedAt;
    }
}
