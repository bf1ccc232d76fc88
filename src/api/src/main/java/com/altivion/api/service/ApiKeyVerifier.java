package com.altivion.api.service;

import com.altivion.api.api.UnauthorizedException;
import com.altivion.api.config.AltivionProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.springframework.stereotype.Component;

/**
 * Checks the {@code X-API-Key} header of write endpoints against {@code altivion.api-key}.
 *
 * <p>When no key is configured every request is rejected.
 */
@Component
public class ApiKeyVerifier {
  private final AltivionProperties properties;

  public ApiKeyVerifier(AltivionProperties properties) {
    this.properties = properties;
  }

  /**
   * Rejects the request unless {@code presented} matches the configured key.
   *
   * @param presented header value, possibly {@code null}
   */
  public void verify(String presented) {
    String expected = properties.getApiKey();
    if (expected == null || expected.isEmpty() || presented == null) {
      throw new UnauthorizedException("Invalid or missing API key.");
    }
    boolean matches = MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        presented.getBytes(StandardCharsets.UTF_8));
    if (!matches) {
      throw new UnauthorizedException("Invalid or missing API key.");
    }
  }
}
