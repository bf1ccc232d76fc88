package com.altivion.api.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.altivion.api.api.BadRequestException;
import com.altivion.api.model.Signal;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SignalPayloadParserTest {

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final SignalPayloadParser parser = new SignalPayloadParser(objectMapper);

  @Test
  void parse_acceptsSingleObjectWithSensorAliases() throws Exception {
    List<Signal> rows = parser.parse(objectMapper.readTree(
        "{\"SN\":\"D1\",\"UASID\":\"U-1\",\"DroneType\":\"quad\",\"Direction\":270,"
            + "\"SpeedHorizontal\":12.5,\"SpeedVertical\":-1.5,\"Latitude\":51.0,"
            + "\"Longitude\":-114.0,\"Height\":50,\"OperatorLatitude\":51.01,"
            + "\"OperatorLongitude\":-114.01,\"Extra\":\"ignored\"}"));

    assertEquals(1, rows.size());
    Signal signal = rows.get(0);
    assertEquals("D1", signal.sn());
    assertEquals("U-1", signal.uasid());
    assertEquals(270, signal.directionDeg());
    assertEquals(-1.5, signal.speedVMps());
    assertEquals(50.0, signal.heightM());
    assertEquals(-114.01, signal.operatorLon());
    assertNull(signal.ts());
  }

  @Test
  void parse_acceptsArrayAndStorageNames() throws Exception {
    List<Signal> rows = parser.parse(objectMapper.readTree(
        "[{\"sn\":\"D1\",\"lat\":1.0,\"lon\":2.0,\"ts\":\"2026-03-01T10:00:00Z\"},"
            + "{\"SN\":\"D2\"}]"));

    assertEquals(2, rows.size());
    assertEquals(Instant.parse("2026-03-01T10:00:00Z"), rows.get(0).ts());
    assertEquals(1.0, rows.get(0).lat());
    assertEquals("D2", rows.get(1).sn());
    assertNull(rows.get(1).lat());
  }

  @Test
  void parse_readsTimestampWithoutOffsetAsUtcAndEpochSeconds() throws Exception {
    List<Signal> rows = parser.parse(objectMapper.readTree(
        "[{\"SN\":\"D1\",\"ts\":\"2026-03-01T10:00:00\"},"
            + "{\"SN\":\"D2\",\"ts\":1772359200},"
            + "{\"SN\":\"D3\",\"ts\":\"2026-03-01T12:00:00+02:00\"}]"));

    Instant expected = Instant.parse("2026-03-01T10:00:00Z");
    assertEquals(expected, rows.get(0).ts());
    assertEquals(expected, rows.get(1).ts());
    assertEquals(expected, rows.get(2).ts());
  }

  @Test
  void parse_rejectsUnreadableTimestamp() throws Exception {
    BadRequestException ex = assertThrows(
        BadRequestException.class,
        () -> parser.parse(objectMapper.readTree("{\"SN\":\"D1\",\"ts\":\"yesterday\"}")));

    assertTrue(ex.getMessage().startsWith("item 0"));
  }

  @Test
  void parse_rejectsEmptyInputs() throws Exception {
    assertThrows(BadRequestException.class, () -> parser.parse(null));
    assertThrows(BadRequestException.class, () -> parser.parse(objectMapper.readTree("[]")));
    assertThrows(BadRequestException.class, () -> parser.parse(objectMapper.readTree("null")));
  }

  @Test
  void parse_rejectsMissingSerialNumber() throws Exception {
    BadRequestException ex = assertThrows(
        BadRequestException.class,
        () -> parser.parse(objectMapper.readTree("[{\"SN\":\"D1\"},{\"Latitude\":1.0}]")));

    assertTrue(ex.getMessage().contains("item 1"));
  }

  @Test
  void parse_rejectsWrongTypes() throws Exception {
    assertThrows(BadRequestException.class, () -> parser.parse(objectMapper.readTree("\"D1\"")));
    assertThrows(BadRequestException.class, () -> parser.parse(objectMapper.readTree("[1, 2]")));
    assertThrows(
        BadRequestException.class,
        () -> parser.parse(objectMapper.readTree("{\"SN\":\"D1\",\"Latitude\":\"north\"}")));
  }
}
