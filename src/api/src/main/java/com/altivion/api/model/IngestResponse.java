package com.altivion.api.model;

/**
 * Response of {@code POST /ingest}.
 *
 * @param inserted number of rows written, taken from the request size
 */
public record IngestResponse(int inserted) {}
