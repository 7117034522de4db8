package kr.jemi.zseat.seat.application.port.in;

import kr.jemi.zseat.seat.domain.Booking;

import java.util.List;

public interface GetBookingsUseCase {

    List<Booking> getBookings(String userId);
}
