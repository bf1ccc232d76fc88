package com.altivion.api.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.altivion.api.liveness.LivenessTracker;
import com.altivion.api.model.DashboardStatsResponse;
import com.altivion.api.service.DashboardStatsService;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = NodeController.class)
class NodeControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private LivenessTracker livenessTracker;
  @MockBean private DashboardStatsService dashboardStatsService;

  @Test
  void health_returnsOk() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
  }

  @Test
  void heartbeat_returnsRecordedTime() throws Exception {
    when(livenessTracker.heartbeat("n1")).thenReturn(Instant.parse("2026-03-01T10:00:00Z"));

    mockMvc.perform(post("/node_heartbeat").param("node_id", "n1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.node_id").value("n1"))
        .andExpect(jsonPath("$.last_seen").value("2026-03-01T10:00:00Z"));
  }

  @Test
  void heartbeat_missingNodeIdReturns400() throws Exception {
    when(livenessTracker.heartbeat(null)).thenThrow(new BadRequestException("Missing node_id"));

    mockMvc.perform(post("/node_heartbeat"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Missing node_id"));
  }

  @Test
  void data_usesDefaultOnlineWindow() throws Exception {
    when(dashboardStatsService.stats(2)).thenReturn(
        new DashboardStatsResponse(120L, 4L, 2L, 1, 3, "2026-03-01T10:00:00Z"));

    mockMvc.perform(get("/data"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.today_unique_uasids").value(4))
        .andExpect(jsonPath("$.nodes_active").value(1))
        .andExpect(jsonPath("$.nodes_total").value(3));
  }

  @Test
  void data_rejectsInvalidWindow() throws Exception {
    mockMvc.perform(get("/data").param("minutes_online_window", "abc"))
        .andExpect(status().isBadRequest());
  }
}
