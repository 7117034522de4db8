package kr.jemi.zseat.integration;

import kr.jemi.zseat.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
@Import(SeatReservationIntegrationTest.ClockTestConfig.class)
class SeatReservationIntegrationTest extends IntegrationTestBase {

    @TestConfiguration
    static class ClockTestConfig {

        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        }
    }

    @Autowired
    MockMvc mockMvc;

    @Autowired
    MutableClock clock;

    private static String user(String userId) {
        return "{\"userId\": \"" + userId + "\"}";
    }

    @Test
    @DisplayName("A1: 선점 → 타인 선점 409(59초) → 확정 → 타인 선점 409(예매)")
    void lock_conflict_confirm_conflict() throws Exception {
        mockMvc.perform(post("/api/seats/A1/lock").contentType(MediaType.APPLICATION_JSON).content(user("u1")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("locked"));

        clock.advanceSeconds(1);
        mockMvc.perform(post("/api/seats/A1/lock").contentType(MediaType.APPLICATION_JSON).content(user("u2")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SEAT_LOCKED_BY_OTHER"))
                .andExpect(jsonPath("$.lockExpiresIn").value(59));

        clock.advanceSeconds(1);
        mockMvc.perform(post("/api/seats/A1/confirm").contentType(MediaType.APPLICATION_JSON).content(user("u1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("u1"));

        clock.advanceSeconds(1);
        mockMvc.perform(post("/api/seats/A1/lock").contentType(MediaType.APPLICATION_JSON).content(user("u2")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SEAT_ALREADY_BOOKED"));

        mockMvc.perform(get("/api/bookings").param("userId", "u1"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.bookings[0].seatId").value("A1"));
    }

    @Test
    @DisplayName("B2: 선점 후 61초 동안 아무 요청이 없어도 조회 시 available")
    void expired_lock_reads_available() throws Exception {
        mockMvc.perform(post("/api/seats/B2/lock").contentType(MediaType.APPLICATION_JSON).content(user("u1")))
                .andExpect(status().isCreated());

        clock.advanceSeconds(61);

        mockMvc.perform(get("/api/seats/B2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("available"))
                .andExpect(jsonPath("$.lockedBy").doesNotExist());
    }

    @Test
    @DisplayName("같은 사용자의 재선점은 200으로 연장된다")
    void relock_extends() throws Exception {
        mockMvc.perform(post("/api/seats/A2/lock").contentType(MediaType.APPLICATION_JSON).content(user("u1")))
                .andExpect(status().isCreated());
        clock.advanceSeconds(30);

        mockMvc.perform(post("/api/seats/A2/lock").contentType(MediaType.APPLICATION_JSON).content(user("u1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extended").value(true));

        clock.advanceSeconds(45);
        mockMvc.perform(get("/api/seats/A2"))
                .andExpect(jsonPath("$.status").value("locked"))
                .andExpect(jsonPath("$.lockExpiresIn").value(15));
    }

    @Test
    @DisplayName("해제는 본인만 가능하고, 해제 후 다른 사용자가 선점할 수 있다")
    void release_is_self_only() throws Exception {
        mockMvc.perform(post("/api/seats/C4/lock").contentType(MediaType.APPLICATION_JSON).content(user("u1")))
                .andExpect(status().isCreated());

        mockMvc.perform(delete("/api/seats/C4/lock").contentType(MediaType.APPLICATION_JSON).content(user("u2")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_LOCK_HOLDER"));

        mockMvc.perform(delete("/api/seats/C4/lock").contentType(MediaType.APPLICATION_JSON).content(user("u1")))
                .andExpect(status().isNoContent());

        mockMvc.perform(post("/api/seats/C4/lock").contentType(MediaType.APPLICATION_JSON).content(user("u2")))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("reset 후 모든 좌석이 available이다")
    void reset_is_total() throws Exception {
        mockMvc.perform(post("/api/seats/A1/lock").contentType(MediaType.APPLICATION_JSON).content(user("u1")));
        mockMvc.perform(post("/api/seats/A1/confirm").contentType(MediaType.APPLICATION_JSON).content(user("u1")));
        mockMvc.perform(post("/api/seats/A3/lock").contentType(MediaType.APPLICATION_JSON).content(user("u2")));

        mockMvc.perform(delete("/api/reset"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/seats"))
                .andExpect(jsonPath("$.stats.total").value(12))
                .andExpect(jsonPath("$.stats.available").value(12))
                .andExpect(jsonPath("$.stats.locked").value(0))
                .andExpect(jsonPath("$.stats.booked").value(0));
        mockMvc.perform(get("/api/bookings"))
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    @DisplayName("격자 밖 좌석은 404")
    void seat_outside_grid() throws Exception {
        mockMvc.perform(get("/api/seats/D1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SEAT_NOT_FOUND"));
    }
}
