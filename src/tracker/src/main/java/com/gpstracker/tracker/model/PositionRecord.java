package com.gpstracker.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Canonical position report for one device.
 *
 * <p>Instances are only produced by the normalizer (or read back from the history store) and
 * are never mutated afterwards. JSON field names match what devices and viewers exchange.
 *
 * @param deviceId non-empty device identifier
 * @param lat latitude in degrees
 * @param lng longitude in degrees
 * @param speed speed in km/h
 * @param heading heading in degrees, 0-359
 * @param sats number of satellites in view
 * @param timestamp position time in epoch milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PositionRecord(
    @JsonProperty("device_id") String deviceId,
    @JsonProperty("lat") double lat,
    @JsonProperty("lng") double lng,
    @JsonProperty("speed") double speed,
    @JsonProperty("heading") int heading,
    @JsonProperty("sats") int sats,
    @JsonProperty("timestamp") long timestamp) {}
