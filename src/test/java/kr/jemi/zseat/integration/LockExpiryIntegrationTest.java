package kr.jemi.zseat.integration;

import kr.jemi.zseat.seat.application.port.in.LockSeatUseCase;
import kr.jemi.zseat.seat.application.port.out.SeatPort;
import kr.jemi.zseat.seat.domain.SeatStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@TestPropertySource(properties = {
        "zseat.seat.lock-ttl-seconds=1",
        "zseat.sweep.enabled=true",
        "zseat.sweep.interval-ms=100"
})
class LockExpiryIntegrationTest extends IntegrationTestBase {

    @Autowired
    LockSeatUseCase lockSeatUseCase;

    @Autowired
    SeatPort seatPort;

    private SeatStatus rawStatus(String seatId) {
        // 조회 유스케이스를 거치면 지연 회수가 먼저 돌기 때문에 저장소를 직접 본다
        return seatPort.atomically(seats -> seats.of(seatId).getStatus());
    }

    @Test
    @DisplayName("선점 TTL(1초) 만료: 요청이 없어도 스케줄러가 좌석을 available로 되돌린다")
    void scheduler_reclaims_expired_lock() {
        lockSeatUseCase.lock("A1", "u1");
        assertThat(rawStatus("A1")).as("선점 직후").isEqualTo(SeatStatus.LOCKED);

        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() ->
                        assertThat(rawStatus("A1")).as("만료 후 회수").isEqualTo(SeatStatus.AVAILABLE)
                );

        String holder = seatPort.atomically(seats -> seats.of("A1").getHolder());
        assertThat(holder).as("선점자 정보 제거").isNull();
    }

    @Test
    @DisplayName("TTL 만료 후 재선점: 다른 유저가 같은 좌석 선점 성공")
    void relock_after_expiry() {
        lockSeatUseCase.lock("B1", "u1");

        await().atMost(5, TimeUnit.SECONDS)
                .untilAsserted(() ->
                        assertThat(rawStatus("B1")).isEqualTo(SeatStatus.AVAILABLE)
                );

        assertThat(lockSeatUseCase.lock("B1", "u2").seat().holder())
                .as("만료 후 재선점 성공").isEqualTo("u2");
    }
}
