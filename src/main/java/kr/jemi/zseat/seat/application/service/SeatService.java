package kr.jemi.zseat.seat.application.service;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.seat.application.port.in.ConfirmSeatUseCase;
import kr.jemi.zseat.seat.application.port.in.GetBookingsUseCase;
import kr.jemi.zseat.seat.application.port.in.GetSeatsUseCase;
import kr.jemi.zseat.seat.application.port.in.LockSeatUseCase;
import kr.jemi.zseat.seat.application.port.in.ReleaseSeatUseCase;
import kr.jemi.zseat.seat.application.port.in.ResetSeatsUseCase;
import kr.jemi.zseat.seat.application.port.in.SweepExpiredLocksUseCase;
import kr.jemi.zseat.seat.application.port.out.SeatPort;
import kr.jemi.zseat.seat.domain.Booking;
import kr.jemi.zseat.seat.domain.LockOutcome;
import kr.jemi.zseat.seat.domain.LockResult;
import kr.jemi.zseat.seat.domain.Seat;
import kr.jemi.zseat.seat.domain.SeatListing;
import kr.jemi.zseat.seat.domain.SeatSnapshot;
import kr.jemi.zseat.seat.domain.SeatStatus;
import kr.jemi.zseat.seat.domain.Seats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.BiFunction;

/**
 * 좌석 상태의 유일한 관리 주체.
 * 모든 작업은 "만료 회수 → 조회/전이"를 하나의 원자적 단계로 실행한다.
 */
@Service
public class SeatService implements LockSeatUseCase, ConfirmSeatUseCase, ReleaseSeatUseCase,
        GetSeatsUseCase, GetBookingsUseCase, ResetSeatsUseCase, SweepExpiredLocksUseCase {

    private static final Logger log = LoggerFactory.getLogger(SeatService.class);

    private final SeatPort seatPort;
    private final SeatExpirySweeper expirySweeper;
    private final Clock clock;
    private final Duration lockTtl;

    public SeatService(SeatPort seatPort,
                       SeatExpirySweeper expirySweeper,
                       Clock clock,
                       @Value("${zseat.seat.lock-ttl-seconds}") long lockTtlSeconds) {
        if (lockTtlSeconds < 1) {
            throw new IllegalArgumentException("선점 TTL은 1초 이상이어야 합니다: " + lockTtlSeconds);
        }
        this.seatPort = seatPort;
        this.expirySweeper = expirySweeper;
        this.clock = clock;
        this.lockTtl = Duration.ofSeconds(lockTtlSeconds);
        log.info("좌석 선점 TTL: {}초", lockTtlSeconds);
    }

    @Override
    public LockResult lock(String seatId, String userId) {
        requireActor(userId);
        return withFreshSeats((seats, now) -> {
            Seat seat = seats.of(seatId);
            LockOutcome outcome = seat.lock(userId, now, lockTtl);
            log.debug("좌석 선점: seat={}, user={}, outcome={}", seatId, userId, outcome);
            return new LockResult(seat.snapshot(now), outcome, lockTtl);
        });
    }

    @Override
    public Booking confirm(String seatId, String userId) {
        requireActor(userId);
        return withFreshSeats((seats, now) -> {
            Seat seat = seats.of(seatId);
            seat.confirm(userId, now);
            log.debug("좌석 예매 확정: seat={}, user={}", seatId, userId);
            return seat.snapshot(now).toBooking();
        });
    }

    @Override
    public void release(String seatId, String userId) {
        requireActor(userId);
        withFreshSeats((seats, now) -> {
            seats.of(seatId).release(userId);
            log.debug("좌석 선점 해제: seat={}, user={}", seatId, userId);
            return null;
        });
    }

    @Override
    public SeatSnapshot getSeat(String seatId) {
        return withFreshSeats((seats, now) -> seats.of(seatId).snapshot(now));
    }

    @Override
    public SeatListing getSeats(SeatStatus status, String userId) {
        String actor = blankToNull(userId);
        return withFreshSeats((seats, now) -> {
            List<SeatSnapshot> matched = seats.all().stream()
                    .filter(seat -> status == null || seat.getStatus() == status)
                    .filter(seat -> actor == null || seat.isOwnedBy(actor))
                    .map(seat -> seat.snapshot(now))
                    .toList();
            return new SeatListing(seats.statistics(), matched);
        });
    }

    @Override
    public List<Booking> getBookings(String userId) {
        String actor = blankToNull(userId);
        return withFreshSeats((seats, now) -> seats.all().stream()
                .filter(seat -> seat.getStatus() == SeatStatus.BOOKED)
                .filter(seat -> actor == null || seat.isOwnedBy(actor))
                .map(seat -> seat.snapshot(now).toBooking())
                .toList());
    }

    @Override
    public void resetAll() {
        seatPort.atomically(seats -> {
            seats.resetAll();
            return null;
        });
        log.info("전체 좌석 초기화 완료");
    }

    @Override
    public int sweepExpired() {
        return seatPort.atomically(seats -> expirySweeper.sweep(seats, clock.instant()).size());
    }

    private <T> T withFreshSeats(BiFunction<Seats, Instant, T> action) {
        return seatPort.atomically(seats -> {
            Instant now = clock.instant();
            List<String> reclaimed = expirySweeper.sweep(seats, now);
            if (!reclaimed.isEmpty()) {
                log.info("만료된 선점 {} 건 회수: {}", reclaimed.size(), reclaimed);
            }
            return action.apply(seats, now);
        });
    }

    private static void requireActor(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_ACTOR);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
