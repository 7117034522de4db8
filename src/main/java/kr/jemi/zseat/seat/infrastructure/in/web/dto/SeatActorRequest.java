package kr.jemi.zseat.seat.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record SeatActorRequest(@NotBlank(message = "userId는 필수입니다") String userId) {
}
