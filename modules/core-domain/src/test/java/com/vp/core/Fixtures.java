package com.vp.core;

import com.vp.client.GeoResult;
import com.vp.client.IdentityRecord;
import com.vp.client.PhoneResult;
import com.vp.web.SearchHit;

import java.util.List;

/** Shared registry records and collaborator answers. */
public final class Fixtures {

  public static final String JOHN_SMITH_NPI = "1234567893";
  public static final String PROVIDENCE_NPI = "1952390643";

  private Fixtures() {
  }

  public static IdentityRecord johnSmith() {
    return IdentityRecord.person(JOHN_SMITH_NPI, "John", "Smith",
        "1 Main St, Boston, MA 02115", "Boston", "MA", "617-726-2000", "Internal Medicine");
  }

  public static IdentityRecord providence() {
    return IdentityRecord.organization(PROVIDENCE_NPI, "PROVIDENCE HOSPITAL, INC.",
        "1150 Varnum St NE, Washington, DC 20017", "Washington", "DC", "202-269-7000", "General Acute Care Hospital");
  }

  public static GeoResult exactGeo() {
    return new GeoResult(42.34, -71.10, "1, Main Street, Boston, MA 02115, USA", GeoResult.MatchType.EXACT,
        new GeoResult.Components("1 Main Street", "Boston", "Massachusetts", "02115"));
  }

  public static PhoneResult validPhone(String raw, String e164) {
    return new PhoneResult(true, raw, raw, e164, "US", List.of("America/New_York"), null);
  }

  public static List<SearchHit> footprintHits() {
    return List.of(
        new SearchHit("https://www.linkedin.com/in/johnsmith", "John Smith"),
        new SearchHit("https://www.healthgrades.com/physician/dr-john-smith", "Dr. John Smith"),
        new SearchHit("https://smithclinic.com", "Smith Clinic"),
        new SearchHit("https://news.example.com/story", "Local story"));
  }
}
