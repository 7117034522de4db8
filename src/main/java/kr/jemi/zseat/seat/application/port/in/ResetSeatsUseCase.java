package kr.jemi.zseat.seat.application.port.in;

public interface ResetSeatsUseCase {

    /**
     * 예매 확정 좌석을 포함한 모든 좌석을 AVAILABLE로 되돌린다. 테스트/운영 점검용.
     */
    void resetAll();
}
