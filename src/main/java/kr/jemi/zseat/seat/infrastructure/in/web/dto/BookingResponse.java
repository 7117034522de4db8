package kr.jemi.zseat.seat.infrastructure.in.web.dto;

import kr.jemi.zseat.seat.domain.Booking;

import java.time.Instant;

public record BookingResponse(String seatId, String userId, Instant bookedAt) {

    public static BookingResponse from(Booking booking) {
        return new BookingResponse(booking.seatId(), booking.userId(), booking.bookedAt());
    }
}
