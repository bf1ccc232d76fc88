package com.altivion.api.service;

import com.altivion.api.api.BadRequestException;
import com.altivion.api.model.Signal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns an {@code /ingest} body (one signal object or an array of them) into signals.
 */
@Component
public class SignalPayloadParser {
  private final ObjectMapper objectMapper;

  public SignalPayloadParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses and validates the request body.
   *
   * @param body raw JSON body
   * @return signals in request order, never empty
   */
  public List<Signal> parse(JsonNode body) {
    if (body == null || body.isNull() || body.isMissingNode()) {
      throw new BadRequestException("Empty payload.");
    }
    if (body.isObject()) {
      return List.of(toSignal(body, 0));
    }
    if (!body.isArray()) {
      throw new BadRequestException("payload must be a signal object or an array of signal objects");
    }
    if (body.isEmpty()) {
      throw new BadRequestException("Empty payload.");
    }

    List<Signal> rows = new ArrayList<>(body.size());
    for (int i = 0; i < body.size(); i++) {
      rows.add(toSignal(body.get(i), i));
    }
    return rows;
  }

  private Signal toSignal(JsonNode node, int index) {
    if (!node.isObject()) {
      throw new BadRequestException("item " + index + " must be a JSON object");
    }
    Signal signal;
    try {
      signal = objectMapper.treeToValue(node, Signal.class);
    } catch (JsonProcessingException ex) {
      throw new BadRequestException("item " + index + " is not a valid signal: " + ex.getOriginalMessage());
    }
    if (signal.sn() == null || signal.sn().isBlank()) {
      throw new BadRequestException("item " + index + " is missing SN");
    }
    return signal;
  }
}
