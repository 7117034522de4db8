package kr.jemi.zseat.seat.domain;

public record SeatStatistics(int total, int available, int locked, int booked) {

    public SeatStatistics {
        if (available + locked + booked != total) {
            throw new IllegalArgumentException(
                    "좌석 통계 합계 불일치: total=" + total
                            + ", available=" + available + ", locked=" + locked + ", booked=" + booked);
        }
    }
}
