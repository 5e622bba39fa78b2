package com.vp.client;

/**
 * Geocoding answer.
 * matchType: EXACT when the full address resolved, PARTIAL when only the city/state fallback did
 * (components.street is null then).
 */
public record GeoResult(
    double lat,
    double lon,
    String displayName,
    MatchType matchType,
    Components components
) {

  public enum MatchType { EXACT, PARTIAL }

  public record Components(String street, String city, String state, String zip) {}
}
