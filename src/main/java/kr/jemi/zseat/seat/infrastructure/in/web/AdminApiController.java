package kr.jemi.zseat.seat.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zseat.seat.application.port.in.ResetSeatsUseCase;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Admin", description = "테스트/운영 점검용")
@RestController
public class AdminApiController {

    private final ResetSeatsUseCase resetSeatsUseCase;

    public AdminApiController(ResetSeatsUseCase resetSeatsUseCase) {
        this.resetSeatsUseCase = resetSeatsUseCase;
    }

    @Operation(summary = "전체 좌석 초기화", description = "예매 확정 좌석을 포함해 모든 좌석을 available로 되돌립니다. 되돌릴 수 없습니다.")
    @DeleteMapping("/api/reset")
    public ResponseEntity<Void> reset() {
        resetSeatsUseCase.resetAll();
        return ResponseEntity.noContent().build();
    }
}
