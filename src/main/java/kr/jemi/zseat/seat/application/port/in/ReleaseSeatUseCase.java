package kr.jemi.zseat.seat.application.port.in;

public interface ReleaseSeatUseCase {

    void release(String seatId, String userId);
}
