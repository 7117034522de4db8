package kr.jemi.zseat.seat.domain;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import kr.jemi.zseat.common.validation.SelfValidating;

/**
 * 행 문자 + 좌석 번호로 만들어지는 좌석 식별자. 1행은 A, 26행은 Z.
 */
public record SeatId(@Min(1) @Max(26) int row, @Min(1) int number) implements SelfValidating {

    public static final int MAX_ROWS = 26;

    public SeatId(int row, int number) {
        this.row = row;
        this.number = number;
        validateSelf();
    }

    public static SeatId of(int row, int number) {
        return new SeatId(row, number);
    }

    public String value() {
        return String.valueOf((char) ('A' + row - 1)) + number;
    }

    @Override
    public String toString() {
        return value();
    }
}
