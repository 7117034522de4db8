package kr.jemi.zseat.seat.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zseat.common.exception.BusinessException;
import kr.jemi.zseat.common.exception.ErrorCode;
import kr.jemi.zseat.seat.application.port.in.ConfirmSeatUseCase;
import kr.jemi.zseat.seat.application.port.in.GetSeatsUseCase;
import kr.jemi.zseat.seat.application.port.in.LockSeatUseCase;
import kr.jemi.zseat.seat.application.port.in.ReleaseSeatUseCase;
import kr.jemi.zseat.seat.domain.LockResult;
import kr.jemi.zseat.seat.domain.SeatStatus;
import kr.jemi.zseat.seat.infrastructure.in.web.dto.BookingResponse;
import kr.jemi.zseat.seat.infrastructure.in.web.dto.LockSeatResponse;
import kr.jemi.zseat.seat.infrastructure.in.web.dto.SeatActorRequest;
import kr.jemi.zseat.seat.infrastructure.in.web.dto.SeatListResponse;
import kr.jemi.zseat.seat.infrastructure.in.web.dto.SeatResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Seat", description = "좌석 조회/선점/확정/해제")
@RestController
public class SeatApiController {

    private final GetSeatsUseCase getSeatsUseCase;
    private final LockSeatUseCase lockSeatUseCase;
    private final ConfirmSeatUseCase confirmSeatUseCase;
    private final ReleaseSeatUseCase releaseSeatUseCase;

    public SeatApiController(GetSeatsUseCase getSeatsUseCase,
                             LockSeatUseCase lockSeatUseCase,
                             ConfirmSeatUseCase confirmSeatUseCase,
                             ReleaseSeatUseCase releaseSeatUseCase) {
        this.getSeatsUseCase = getSeatsUseCase;
        this.lockSeatUseCase = lockSeatUseCase;
        this.confirmSeatUseCase = confirmSeatUseCase;
        this.releaseSeatUseCase = releaseSeatUseCase;
    }

    @Operation(summary = "좌석 목록 조회", description = "상태/사용자로 필터링한 좌석 목록과 전체 좌석 통계를 반환합니다.")
    @GetMapping("/api/seats")
    public ResponseEntity<SeatListResponse> getSeats(
            @Parameter(description = "available | locked | booked") @RequestParam(required = false) String status,
            @Parameter(description = "선점자 또는 예매자") @RequestParam(required = false) String userId) {
        SeatStatus statusFilter = parseStatus(status);
        return ResponseEntity.ok(SeatListResponse.from(getSeatsUseCase.getSeats(statusFilter, userId)));
    }

    @Operation(summary = "좌석 상세 조회", description = "선점 중이면 남은 선점 시간(초)을 포함합니다.")
    @GetMapping("/api/seats/{seatId}")
    public ResponseEntity<SeatResponse> getSeat(@PathVariable String seatId) {
        return ResponseEntity.ok(SeatResponse.from(getSeatsUseCase.getSeat(seatId)));
    }

    @Operation(summary = "좌석 선점", description = "새로 선점하면 201, 본인 선점을 연장하면 200을 반환합니다.")
    @PostMapping("/api/seats/{seatId}/lock")
    public ResponseEntity<LockSeatResponse> lock(@PathVariable String seatId,
                                                 @Valid @RequestBody SeatActorRequest request) {
        LockResult result = lockSeatUseCase.lock(seatId, request.userId());
        HttpStatus status = result.extended() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(LockSeatResponse.from(result));
    }

    @Operation(summary = "예매 확정", description = "본인이 선점한 좌석만 확정할 수 있습니다.")
    @PostMapping("/api/seats/{seatId}/confirm")
    public ResponseEntity<BookingResponse> confirm(@PathVariable String seatId,
                                                   @Valid @RequestBody SeatActorRequest request) {
        return ResponseEntity.ok(BookingResponse.from(confirmSeatUseCase.confirm(seatId, request.userId())));
    }

    @Operation(summary = "선점 해제", description = "본인이 선점한 좌석만 해제할 수 있습니다.")
    @DeleteMapping("/api/seats/{seatId}/lock")
    public ResponseEntity<Void> release(@PathVariable String seatId,
                                        @Valid @RequestBody SeatActorRequest request) {
        releaseSeatUseCase.release(seatId, request.userId());
        return ResponseEntity.noContent().build();
    }

    private static SeatStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        return SeatStatus.fromValue(status)
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_SEAT_STATUS,
                        "유효하지 않은 좌석 상태입니다: " + status));
    }
}
