package kr.jemi.zseat.seat.infrastructure.out.memory;

import kr.jemi.zseat.seat.application.port.out.SeatPort;
import kr.jemi.zseat.seat.domain.Seats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 프로세스 메모리에 좌석 격자를 보관한다. 좌석 수가 작고 고정이라 전역 락 하나로 직렬화한다.
 */
@Component
public class InMemorySeatAdapter implements SeatPort {

    private static final Logger log = LoggerFactory.getLogger(InMemorySeatAdapter.class);

    private final Seats seats;
    private final ReentrantLock lock = new ReentrantLock();

    public InMemorySeatAdapter(@Value("${zseat.seat.rows}") int rows,
                               @Value("${zseat.seat.seats-per-row}") int seatsPerRow) {
        this.seats = Seats.grid(rows, seatsPerRow);
        log.info("좌석 격자 초기화: {}행 x {}석 = {}석", rows, seatsPerRow, seats.size());
    }

    @Override
    public <T> T atomically(Function<Seats, T> action) {
        lock.lock();
        try {
            return action.apply(seats);
        } finally {
            lock.unlock();
        }
    }
}
