package kr.jemi.zseat.seat.application.service;

import kr.jemi.zseat.seat.domain.Seat;
import kr.jemi.zseat.seat.domain.SeatStatus;
import kr.jemi.zseat.seat.domain.Seats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 만료된 선점을 회수한다. 반드시 {@link kr.jemi.zseat.seat.application.port.out.SeatPort#atomically}
 * 안에서 호출해야 한다.
 */
@Component
public class SeatExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(SeatExpirySweeper.class);

    public List<String> sweep(Seats seats, Instant now) {
        List<String> reclaimed = new ArrayList<>();
        for (Seat seat : seats.all()) {
            if (seat.getStatus() != SeatStatus.LOCKED) {
                continue;
            }
            String holder = seat.getHolder();
            if (seat.expireIfDue(now)) {
                reclaimed.add(seat.getId().value());
                log.debug("선점 만료 회수: seat={}, holder={}", seat.getId(), holder);
            }
        }
        return reclaimed;
    }
}
