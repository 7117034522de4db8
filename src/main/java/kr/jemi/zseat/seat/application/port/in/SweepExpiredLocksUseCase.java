package kr.jemi.zseat.seat.application.port.in;

public interface SweepExpiredLocksUseCase {

    int sweepExpired();
}
