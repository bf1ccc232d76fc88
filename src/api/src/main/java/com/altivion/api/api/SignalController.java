package com.altivion.api.api;

import com.altivion.api.config.AltivionProperties;
import com.altivion.api.config.AppConfig;
import com.altivion.api.model.Bbox;
import com.altivion.api.model.IngestResponse;
import com.altivion.api.model.LatestPosition;
import com.altivion.api.model.SensorTrack;
import com.altivion.api.model.Signal;
import com.altivion.api.service.ApiKeyVerifier;
import com.altivion.api.service.IngestionService;
import com.altivion.api.service.QueryParser;
import com.altivion.api.service.SignalPayloadParser;
import com.altivion.api.service.SignalQueryService;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for signal ingestion and the map read endpoints.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code POST /ingest}: authenticated write of one signal or a batch</li>
 *   <li>{@code GET /latest}: latest position per sensor</li>
 *   <li>{@code GET /latest_in_view}: latest position per sensor inside a viewport</li>
 *   <li>{@code GET /tracks}: recent tracks grouped by sensor</li>
 *   <li>{@code GET /tracks_window}: replay tracks between two instants</li>
 * </ul>
 */
@RestController
public class SignalController {
  private static final String API_KEY_HEADER = "X-API-Key";

  private final ApiKeyVerifier apiKeyVerifier;
  private final SignalPayloadParser payloadParser;
  private final IngestionService ingestionService;
  private final SignalQueryService signalQueryService;
  private final AltivionProperties properties;
  private final Executor ingestExecutor;

  /**
   * Creates the controller.
   *
   * @param apiKeyVerifier shared-secret check for writes
   * @param payloadParser body-to-signal conversion
   * @param ingestionService write-then-broadcast orchestration
   * @param signalQueryService read projections
   * @param properties typed configuration
   * @param ingestExecutor pool running store writes off the servlet threads
   */
  public SignalController(
      ApiKeyVerifier apiKeyVerifier,
      SignalPayloadParser payloadParser,
      IngestionService ingestionService,
      SignalQueryService signalQueryService,
      AltivionProperties properties,
      @Qualifier(AppConfig.INGEST_EXECUTOR) Executor ingestExecutor) {
    this.apiKeyVerifier = apiKeyVerifier;
    this.payloadParser = payloadParser;
    this.ingestionService = ingestionService;
    this.signalQueryService = signalQueryService;
    this.properties = properties;
    this.ingestExecutor = ingestExecutor;
  }

  /**
   * Stores one signal or a batch and pushes every row to live viewers.
   *
   * @param apiKey shared-secret header
   * @param body signal object or array of signal objects
   * @return inserted row count, completed once the write and broadcast are done
   */
  @PostMapping("/ingest")
  public CompletableFuture<IngestResponse> ingest(
      @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey,
      @RequestBody(required = false) JsonNode body) {
    apiKeyVerifier.verify(apiKey);
    List<Signal> rows = payloadParser.parse(body);
    return CompletableFuture.supplyAsync(() -> ingestionService.ingest(rows), ingestExecutor);
  }

  /**
   * Returns the latest positioned report per sensor.
   *
   * @param minutes optional trailing window (default 10)
   * @return latest positions
   */
  @GetMapping("/latest")
  public List<LatestPosition> latest(
      @RequestParam(value = "minutes", required = false) String minutes) {
    return signalQueryService.latest(minutes(minutes, 10));
  }

  /**
   * Returns the latest positioned report per sensor inside a viewport.
   *
   * @param swLat south-west latitude
   * @param swLng south-west longitude
   * @param neLat north-east latitude
   * @param neLng north-east longitude
   * @param minutes optional trailing window (default 10)
   * @return latest positions inside the viewport
   */
  @GetMapping("/latest_in_view")
  public List<LatestPosition> latestInView(
      @RequestParam(value = "swLat", required = false) String swLat,
      @RequestParam(value = "swLng", required = false) String swLng,
      @RequestParam(value = "neLat", required = false) String neLat,
      @RequestParam(value = "neLng", required = false) String neLng,
      @RequestParam(value = "minutes", required = false) String minutes) {
    Bbox bbox = Bbox.fromCorners(
        QueryParser.parseCoordinate("swLat", swLat),
        QueryParser.parseCoordinate("swLng", swLng),
        QueryParser.parseCoordinate("neLat", neLat),
        QueryParser.parseCoordinate("neLng", neLng));
    return signalQueryService.latestInView(bbox, minutes(minutes, 10));
  }

  /**
   * Returns recent tracks grouped by sensor.
   *
   * @param minutes optional trailing window (default 60)
   * @param maxPoints optional total point cap (default 1000)
   * @return tracks in ascending time order
   */
  @GetMapping("/tracks")
  public List<SensorTrack> tracks(
      @RequestParam(value = "minutes", required = false) String minutes,
      @RequestParam(value = "max_points", required = false) String maxPoints) {
    return signalQueryService.tracks(minutes(minutes, 60), maxPoints(maxPoints, 1000));
  }

  /**
   * Returns tracks between two instants, optionally for one sensor.
   *
   * @param from inclusive ISO-8601 lower bound
   * @param to inclusive ISO-8601 upper bound
   * @param sn optional sensor filter
   * @param maxPoints optional total point cap (default 20000)
   * @return tracks in ascending time order
   */
  @GetMapping("/tracks_window")
  public List<SensorTrack> tracksWindow(
      @RequestParam(value = "from", required = false) String from,
      @RequestParam(value = "to", required = false) String to,
      @RequestParam(value = "sn", required = false) String sn,
      @RequestParam(value = "max_points", required = false) String maxPoints) {
    Instant lower = QueryParser.parseTimestamp("from", from);
    Instant upper = QueryParser.parseTimestamp("to", to);
    if (upper.isBefore(lower)) {
      throw new BadRequestException("to must not be before from");
    }
    return signalQueryService.tracksWindow(
        lower, upper, QueryParser.optionalText(sn), maxPoints(maxPoints, 20_000));
  }

  private int minutes(String raw, int defaultMinutes) {
    return QueryParser.parseMinutes("minutes", raw, defaultMinutes, properties.getApi().getMaxWindowMinutes());
  }

  private int maxPoints(String raw, int defaultMaxPoints) {
    return QueryParser.parseMaxPoints(raw, defaultMaxPoints, properties.getApi().getMaxPointsCap());
  }
}
