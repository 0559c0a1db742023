package com.gpstracker.tracker.model;

/**
 * Response contract for {@code POST /api/track}.
 *
 * @param success always {@code true} for accepted submissions
 * @param message human readable confirmation
 */
public record TrackResponse(boolean success, String message) {}
