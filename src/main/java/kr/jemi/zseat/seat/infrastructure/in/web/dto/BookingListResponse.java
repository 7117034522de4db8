package kr.jemi.zseat.seat.infrastructure.in.web.dto;

import kr.jemi.zseat.seat.domain.Booking;

import java.util.List;

public record BookingListResponse(int count, List<BookingResponse> bookings) {

    public static BookingListResponse from(List<Booking> bookings) {
        return new BookingListResponse(
                bookings.size(),
                bookings.stream().map(BookingResponse::from).toList()
        );
    }
}
