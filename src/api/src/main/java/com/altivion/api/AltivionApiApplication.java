package com.altivion.api;

import com.altivion.api.config.AltivionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Main Spring Boot entrypoint for the Altivion ingest API.
 *
 * <p>The application accepts sensor signals, persists them to PostgreSQL, pushes them to
 * WebSocket viewers and serves the read endpoints used by the map and KPI cards.
 */
@SpringBootApplication
@EnableConfigurationProperties(AltivionProperties.class)
public class AltivionApiApplication {
  /**
   * Starts the ingest API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(AltivionApiApplication.class, args);
  }
}
