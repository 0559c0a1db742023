package com.gpstracker.tracker.ingest;

import com.gpstracker.tracker.model.PositionRecord;
import java.time.Clock;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns an untyped device payload into a {@link PositionRecord}.
 *
 * <p>{@code device_id}, {@code lat} and {@code lng} are mandatory. Optional numeric fields are
 * parsed leniently: numbers are taken as-is, strings are read up to the first non-numeric
 * character ({@code "12.5kmh"} gives {@code 12.5}), anything else falls back to the default.
 * A malformed optional field never rejects a payload.
 */
@Component
public class PositionNormalizer {
  static final String MISSING_FIELDS = "Missing required fields: device_id, lat, lng";

  private static final Pattern DECIMAL_PREFIX =
      Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern INTEGER_PREFIX = Pattern.compile("^[+-]?\\d+");

  private final Clock clock;

  public PositionNormalizer(Clock clock) {
    this.clock = clock;
  }

  /**
   * Validates and coerces a raw payload.
   *
   * @param raw decoded JSON object from an adapter
   * @return canonical record
   * @throws ValidationException when a mandatory field is missing, non-numeric or out of range
   */
  public PositionRecord normalize(Map<String, ?> raw) {
    if (raw == null) {
      throw new ValidationException(MISSING_FIELDS);
    }
    String deviceId = deviceId(raw.get("device_id"));
    Double lat = decimal(raw.get("lat"));
    Double lng = decimal(raw.get("lng"));
    if (deviceId == null || lat == null || lng == null) {
      throw new ValidationException(MISSING_FIELDS);
    }
    if (lat < -90.0 || lat > 90.0) {
      throw new ValidationException("Invalid coordinates: lat must be within [-90, 90]");
    }
    if (lng < -180.0 || lng > 180.0) {
      throw new ValidationException("Invalid coordinates: lng must be within [-180, 180]");
    }

    Double speed = decimal(raw.get("speed"));
    Long heading = integer(raw.get("heading"));
    Long sats = integer(raw.get("sats"));
    Long timestamp = integer(raw.get("ts"));
    if (timestamp == null || timestamp <= 0) {
      timestamp = integer(raw.get("timestamp"));
    }

    return new PositionRecord(
        deviceId,
        lat,
        lng,
        speed == null ? 0.0 : speed,
        heading == null ? 0 : (int) Math.floorMod(heading, 360L),
        sats == null || sats < 0 ? 0 : (int) Math.min(sats, Integer.MAX_VALUE),
        timestamp == null || timestamp <= 0 ? clock.millis() : timestamp);
  }

  private static String deviceId(Object value) {
    if (!(value instanceof String) && !(value instanceof Number)) {
      return null;
    }
    String id = value.toString().trim();
    return id.isEmpty() ? null : id;
  }

  static Double decimal(Object value) {
    if (value instanceof Number number) {
      double parsed = number.doubleValue();
      return Double.isFinite(parsed) ? parsed : null;
    }
    if (value instanceof String text) {
      Matcher matcher = DECIMAL_PREFIX.matcher(text.trim());
      if (matcher.find()) {
        double parsed = Double.parseDouble(matcher.group());
        return Double.isFinite(parsed) ? parsed : null;
      }
    }
    return null;
  }

  static Long integer(Object value) {
    if (value instanceof Number number) {
      double parsed = number.doubleValue();
      return Double.isFinite(parsed) ? number.longValue() : null;
    }
    if (value instanceof String text) {
      Matcher matcher = INTEGER_PREFIX.matcher(text.trim());
      if (matcher.find()) {
        try {
          return Long.parseLong(matcher.group());
        } catch (NumberFormatException ex) {
          return null;
        }
      }
    }
    return null;
  }
}
