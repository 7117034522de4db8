package kr.jemi.zseat.seat.infrastructure.in.web.dto;

import kr.jemi.zseat.seat.domain.SeatListing;

import java.util.List;

public record SeatListResponse(SeatStatsResponse stats, List<SeatResponse> seats) {

    public static SeatListResponse from(SeatListing listing) {
        return new SeatListResponse(
                SeatStatsResponse.from(listing.statistics()),
                listing.seats().stream().map(SeatResponse::from).toList()
        );
    }
}
