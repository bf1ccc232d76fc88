package com.altivion.api.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for the map frontend.
 *
 * <p>This class configures CORS for every API route.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
  private final AltivionProperties properties;

  /**
   * Creates Web MVC config with typed application properties.
   *
   * @param properties ingest API configuration tree
   */
  public WebConfig(AltivionProperties properties) {
    this.properties = properties;
  }

  /**
   * Registers CORS mappings when an allowlist is configured.
   *
   * @param registry Spring CORS registry
   */
  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> allowedOrigins = allowedOrigins(properties);
    if (allowedOrigins.isEmpty()) {
      return;
    }

    registry
        .addMapping("/**")
        .allowedMethods("*")
        .allowedHeaders("*")
        .allowCredentials(true)
        .allowedOrigins(allowedOrigins.toArray(String[]::new))
        .maxAge(600);
  }

  static List<String> allowedOrigins(AltivionProperties properties) {
    return properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .map(String::trim)
        .toList();
  }
}
