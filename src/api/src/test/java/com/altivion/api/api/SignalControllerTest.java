package com.altivion.api.api;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.altivion.api.config.AppConfig;
import com.altivion.api.model.Bbox;
import com.altivion.api.model.IngestResponse;
import com.altivion.api.model.LatestPosition;
import com.altivion.api.model.SensorTrack;
import com.altivion.api.model.TrackPoint;
import com.altivion.api.service.ApiKeyVerifier;
import com.altivion.api.service.IngestionService;
import com.altivion.api.service.SignalPayloadParser;
import com.altivion.api.service.SignalQueryService;
import com.altivion.api.store.StoreException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@WebMvcTest(controllers = SignalController.class, properties = "altivion.api-key=test-key")
@Import({ApiKeyVerifier.class, SignalPayloadParser.class, SignalControllerTest.DirectExecutorConfig.class})
class SignalControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private IngestionService ingestionService;
  @MockBean private SignalQueryService signalQueryService;

  @Test
  void ingest_returnsInsertedCount() throws Exception {
    when(ingestionService.ingest(anyList())).thenReturn(new IngestResponse(2));

    MvcResult result = mockMvc.perform(post("/ingest")
            .header("X-API-Key", "test-key")
            .contentType(MediaType.APPLICATION_JSON)
            .content("[{\"SN\":\"D1\",\"Latitude\":51.0,\"Longitude\":-114.0},{\"SN\":\"D2\"}]"))
        .andExpect(request().asyncStarted())
        .andReturn();

    mockMvc.perform(asyncDispatch(result))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.inserted").value(2));
  }

  @Test
  void ingest_wrongKeyReturns401BeforeTouchingService() throws Exception {
    mockMvc.perform(post("/ingest")
            .header("X-API-Key", "nope")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"SN\":\"D1\"}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("unauthorized"));

    mockMvc.perform(post("/ingest").contentType(MediaType.APPLICATION_JSON).content("{\"SN\":\"D1\"}"))
        .andExpect(status().isUnauthorized());

    verifyNoInteractions(ingestionService);
  }

  @Test
  void ingest_emptyArrayReturns400() throws Exception {
    mockMvc.perform(post("/ingest")
            .header("X-API-Key", "test-key")
            .contentType(MediaType.APPLICATION_JSON)
            .content("[]"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"))
        .andExpect(jsonPath("$.message").value("Empty payload."));

    verifyNoInteractions(ingestionService);
  }

  @Test
  void ingest_malformedJsonReturns400() throws Exception {
    mockMvc.perform(post("/ingest")
            .header("X-API-Key", "test-key")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"SN\":"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void ingest_storeFailureReturns502() throws Exception {
    when(ingestionService.ingest(anyList()))
        .thenThrow(new StoreException("insert failed", new IllegalStateException("down")));

    MvcResult result = mockMvc.perform(post("/ingest")
            .header("X-API-Key", "test-key")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"SN\":\"D1\"}"))
        .andExpect(request().asyncStarted())
        .andReturn();

    mockMvc.perform(asyncDispatch(result))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("backend_unavailable"));
  }

  @Test
  void latest_usesDefaultWindow() throws Exception {
    when(signalQueryService.latest(10)).thenReturn(List.of(new LatestPosition(
        "D1", Instant.parse("2026-03-01T10:00:00Z"), 51.0, -114.0, 50.0, null, null)));

    mockMvc.perform(get("/latest"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].sn").value("D1"))
        .andExpect(jsonPath("$[0].height_m").value(50.0))
        .andExpect(jsonPath("$[0].ts").value("2026-03-01T10:00:00Z"));
  }

  @Test
  void latest_rejectsNonPositiveMinutes() throws Exception {
    mockMvc.perform(get("/latest").param("minutes", "0"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void latestInView_normalizesSwappedCorners() throws Exception {
    mockMvc.perform(get("/latest_in_view")
            .param("swLat", "52")
            .param("swLng", "-113")
            .param("neLat", "50")
            .param("neLng", "-115"))
        .andExpect(status().isOk());

    verify(signalQueryService).latestInView(new Bbox(-115.0, 50.0, -113.0, 52.0), 10);
  }

  @Test
  void latestInView_missingCornerReturns400() throws Exception {
    mockMvc.perform(get("/latest_in_view").param("swLat", "50").param("swLng", "-115").param("neLat", "52"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("neLng is required"));
  }

  @Test
  void tracks_clampsMaxPoints() throws Exception {
    when(signalQueryService.tracks(60, 50_000)).thenReturn(List.of(new SensorTrack(
        "D1", List.of(new TrackPoint(Instant.parse("2026-03-01T10:00:00Z"), 51.0, -114.0)))));

    mockMvc.perform(get("/tracks").param("max_points", "900000"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].sn").value("D1"))
        .andExpect(jsonPath("$[0].points[0].lat").value(51.0));
  }

  @Test
  void tracksWindow_passesBoundsAndSensorFilter() throws Exception {
    mockMvc.perform(get("/tracks_window")
            .param("from", "2026-03-01T10:00:00")
            .param("to", "2026-03-01T11:00:00Z")
            .param("sn", "D1"))
        .andExpect(status().isOk());

    verify(signalQueryService).tracksWindow(
        eq(Instant.parse("2026-03-01T10:00:00Z")),
        eq(Instant.parse("2026-03-01T11:00:00Z")),
        eq("D1"),
        eq(20_000));
  }

  @Test
  void tracksWindow_requiresBothBounds() throws Exception {
    mockMvc.perform(get("/tracks_window").param("from", "2026-03-01T10:00:00Z"))
        .andExpect(status().isBadRequest());
    mockMvc.perform(get("/tracks_window")
            .param("from", "2026-03-01T11:00:00Z")
            .param("to", "2026-03-01T10:00:00Z"))
        .andExpect(status().isBadRequest());
  }

  @TestConfiguration
  static class DirectExecutorConfig {
    @Bean(name = AppConfig.INGEST_EXECUTOR)
    Executor ingestExecutor() {
      return Runnable::run;
    }
  }
}
