package com.gpstracker.tracker.config;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.gpstracker.tracker.api.TrackingController;
import com.gpstracker.tracker.ingest.DeviceTokenVerifier;
import com.gpstracker.tracker.service.TrackingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = TrackingController.class,
    properties = "tracker.api.cors.allowed-origins=https://map.example.org")
@Import(DeviceTokenVerifier.class)
class WebConfigTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private TrackingService trackingService;

  @Test
  void preflightFromAllowedOrigin_isAccepted() throws Exception {
    mockMvc.perform(options("/api/track")
            .header(HttpHeaders.ORIGIN, "https://map.example.org")
            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://map.example.org"))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));
  }

  @Test
  void preflightFromUnknownOrigin_isRejected() throws Exception {
    mockMvc.perform(options("/api/track")
            .header(HttpHeaders.ORIGIN, "https://evil.example.com")
            .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
        .andExpect(status().isForbidden());
  }
}
