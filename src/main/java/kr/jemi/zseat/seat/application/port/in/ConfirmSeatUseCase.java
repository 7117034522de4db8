package kr.jemi.zseat.seat.application.port.in;

import kr.jemi.zseat.seat.domain.Booking;

public interface ConfirmSeatUseCase {

    Booking confirm(String seatId, String userId);
}
