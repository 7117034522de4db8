package kr.jemi.zseat.seat.infrastructure.in.scheduler;

import kr.jemi.zseat.seat.application.port.in.SweepExpiredLocksUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "zseat.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class SeatExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(SeatExpiryScheduler.class);

    private final SweepExpiredLocksUseCase sweepExpiredLocksUseCase;

    public SeatExpiryScheduler(SweepExpiredLocksUseCase sweepExpiredLocksUseCase) {
        this.sweepExpiredLocksUseCase = sweepExpiredLocksUseCase;
    }

    @Scheduled(fixedDelayString = "${zseat.sweep.interval-ms}")
    public void sweep() {
        try {
            int reclaimed = sweepExpiredLocksUseCase.sweepExpired();
            if (reclaimed > 0) {
                log.info("만료 선점 좌석 {} 석 회수", reclaimed);
            }
        } catch (Exception e) {
            log.error("만료 선점 회수 스케줄러 실패", e);
        }
    }
}
