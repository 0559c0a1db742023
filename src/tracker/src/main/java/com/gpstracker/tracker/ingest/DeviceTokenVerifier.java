package com.gpstracker.tracker.ingest;

import com.gpstracker.tracker.config.TrackerProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Shared-secret check applied at the HTTP ingestion boundary.
 *
 * <p>Every device presents the same configured token, either in the {@code X-Device-Token}
 * header or in the {@code token} query parameter. The header wins when both are present.
 */
@Component
public class DeviceTokenVerifier {
  private static final Logger log = LoggerFactory.getLogger(DeviceTokenVerifier.class);

  private final byte[] expected;

  public DeviceTokenVerifier(TrackerProperties properties) {
    String token = properties.getDeviceToken();
    if (token == null || token.isEmpty()) {
      throw new IllegalStateException("tracker.device-token must not be empty");
    }
    this.expected = token.getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Verifies the presented token.
   *
   * @param headerToken value of {@code X-Device-Token}, may be {@code null}
   * @param queryToken value of the {@code token} query parameter, may be {@code null}
   * @throws InvalidDeviceTokenException when the token is missing or does not match
   */
  public void verify(String headerToken, String queryToken) {
    String presented = headerToken != null ? headerToken : queryToken;
    if (presented == null
        || !MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8))) {
      log.debug("Rejected submission with {} device token", presented == null ? "missing" : "invalid");
      throw new InvalidDeviceTokenException();
    }
  }
}
