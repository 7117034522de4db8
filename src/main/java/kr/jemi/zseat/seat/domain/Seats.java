package kr.jemi.zseat.seat.domain;

import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 고정된 좌석 격자. 생성 이후 좌석의 추가/삭제는 없고 각 좌석의 상태만 바뀐다.
 * 순회 순서는 A1, A2, ..., B1 ... 격자 순서다.
 */
public class Seats {

    private final Map<String, Seat> seats;
    private final int rows;
    private final int seatsPerRow;

    private Seats(Map<String, Seat> seats, int rows, int seatsPerRow) {
        this.seats = Collections.unmodifiableMap(seats);
        this.rows = rows;
        this.seatsPerRow = seatsPerRow;
    }

    public static Seats grid(int rows, int seatsPerRow) {
        if (rows < 1 || rows > SeatId.MAX_ROWS) {
            throw new IllegalArgumentException("행 수는 1~" + SeatId.MAX_ROWS + " 사이여야 합니다: " + rows);
        }
        if (seatsPerRow < 1) {
            throw new IllegalArgumentException("행당 좌석 수는 1 이상이어야 합니다: " + seatsPerRow);
        }
        Map<String, Seat> seats = new LinkedHashMap<>();
        for (int row = 1; row <= rows; row++) {
            for (int number = 1; number <= seatsPerRow; number++) {
                SeatId id = SeatId.of(row, number);
                seats.put(id.value(), new Seat(id));
            }
        }
        return new Seats(seats, rows, seatsPerRow);
    }

    public Seat of(String seatId) {
        Seat seat = seatId == null ? null : seats.get(seatId);
        if (seat == null) {
            throw new BusinessException(ErrorCode.SEAT_NOT_FOUND, "좌석 " + seatId + "을(를) 찾을 수 없습니다");
        }
        return seat;
    }

    public List<Seat> all() {
        return new ArrayList<>(seats.values());
    }

    public SeatStatistics statistics() {
        int available = 0;
        int locked = 0;
        int booked = 0;
        for (Seat seat : seats.values()) {
            switch (seat.getStatus()) {
                case AVAILABLE -> available++;
                case LOCKED -> locked++;
                case BOOKED -> booked++;
            }
        }
        return new SeatStatistics(seats.size(), available, locked, booked);
    }

    public void resetAll() {
        seats.values().forEach(Seat::reset);
    }

    public int size() {
        return seats.size();
    }

    public int rows() {
        return rows;
    }

    public int seatsPerRow() {
        return seatsPerRow;
    }
}
