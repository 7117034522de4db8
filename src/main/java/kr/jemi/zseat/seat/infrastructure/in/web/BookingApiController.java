package kr.jemi.zseat.seat.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zseat.seat.application.port.in.GetBookingsUseCase;
import kr.jemi.zseat.seat.infrastructure.in.web.dto.BookingListResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Booking", description = "예매 내역 조회")
@RestController
public class BookingApiController {

    private final GetBookingsUseCase getBookingsUseCase;

    public BookingApiController(GetBookingsUseCase getBookingsUseCase) {
        this.getBookingsUseCase = getBookingsUseCase;
    }

    @Operation(summary = "예매 내역 조회", description = "확정된 예매를 좌석 순서대로 반환합니다.")
    @GetMapping("/api/bookings")
    public ResponseEntity<BookingListResponse> getBookings(
            @Parameter(description = "예매자") @RequestParam(required = false) String userId) {
        return ResponseEntity.ok(BookingListResponse.from(getBookingsUseCase.getBookings(userId)));
    }
}
