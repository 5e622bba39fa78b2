package com.vp.client;

import java.util.List;

/**
 * Phone validation outcome.
 * areaLocation is the geographic description ("Boston, MA"), falling back to the region code.
 * valid=false comes with an error text; the formatted fields are null then.
 */
public record PhoneResult(
    boolean valid,
    String original,
    String formatted,
    String e164,
    String areaLocation,
    List<String> timeZones,
    String error
) {
  public PhoneResult {
    timeZones = timeZones == null ? null : List.copyOf(timeZones);
  }

  public static PhoneResult invalid(String original, String error) {
    return new PhoneResult(false, original, null, null, null, null, error);
  }
}
