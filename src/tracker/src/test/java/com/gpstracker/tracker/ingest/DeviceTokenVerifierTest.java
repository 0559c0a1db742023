package com.gpstracker.tracker.ingest;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gpstracker.tracker.config.TrackerProperties;
import org.junit.jupiter.api.Test;

class DeviceTokenVerifierTest {

  private DeviceTokenVerifier verifier(String token) {
    TrackerProperties properties = new TrackerProperties();
    properties.setDeviceToken(token);
    return new DeviceTokenVerifier(properties);
  }

  @Test
  void acceptsMatchingHeaderOrQueryToken() {
    DeviceTokenVerifier verifier = verifier("s3cret");

    assertThatCode(() -> verifier.verify("s3cret", null)).doesNotThrowAnyException();
    assertThatCode(() -> verifier.verify(null, "s3cret")).doesNotThrowAnyException();
  }

  @Test
  void rejectsMissingOrWrongToken() {
    DeviceTokenVerifier verifier = verifier("s3cret");

    assertThatThrownBy(() -> verifier.verify(null, null))
        .isInstanceOf(InvalidDeviceTokenException.class)
        .hasMessage("Invalid device token");
    assertThatThrownBy(() -> verifier.verify("S3CRET", null))
        .isInstanceOf(InvalidDeviceTokenException.class);
    assertThatThrownBy(() -> verifier.verify("s3cret ", null))
        .isInstanceOf(InvalidDeviceTokenException.class);
  }

  @Test
  void headerTokenTakesPrecedenceOverQueryToken() {
    DeviceTokenVerifier verifier = verifier("s3cret");

    assertThatThrownBy(() -> verifier.verify("wrong", "s3cret"))
        .isInstanceOf(InvalidDeviceTokenException.class);
  }

  @Test
  void refusesToStartWithoutToken() {
    assertThatThrownBy(() -> verifier(""))
        .isInstanceOf(IllegalStateException.class);
  }
}
