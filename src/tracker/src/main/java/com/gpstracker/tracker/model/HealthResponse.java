package com.gpstracker.tracker.model;

/**
 * Liveness payload for {@code GET /api/health}.
 *
 * @param status always {@code healthy} while the process serves requests
 * @param timestamp current time in epoch milliseconds
 * @param uptime process uptime in milliseconds
 * @param version service version string
 */
public record HealthResponse(String status, long timestamp, long uptime, String version) {}
