package com.vp.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.util.StringUtils;

/**
 * Normalized registry entry for a provider.
 * Either the person name pair or organizationName is populated, never both.
 * Blank strings from the registry are stored as null.
 */
public record IdentityRecord(
    String identifier,
    String firstName,
    String lastName,
    String organizationName,
    String credential,
    String address,
    String city,
    String state,
    String phone,
    String specialty
) {

  /** Placeholder the registry client writes when no LOCATION address exists. */
  public static final String ADDRESS_NOT_FOUND = "Address not found";

  public IdentityRecord {
    firstName = blankToNull(firstName);
    lastName = blankToNull(lastName);
    organizationName = blankToNull(organizationName);
    credential = blankToNull(credential);
    address = blankToNull(address);
    city = blankToNull(city);
    state = blankToNull(state);
    phone = blankToNull(phone);
    if (organizationName != null && (firstName != null || lastName != null)) {
      throw new IllegalArgumentException(
          "Record " + identifier + " carries both a person name and an organization name");
    }
  }

  public static IdentityRecord person(String identifier, String firstName, String lastName,
                                      String address, String city, String state, String phone, String specialty) {
    return new IdentityRecord(identifier, firstName, lastName, null, null, address, city, state, phone, specialty);
  }

  public static IdentityRecord organization(String identifier, String organizationName,
                                            String address, String city, String state, String phone, String specialty) {
    return new IdentityRecord(identifier, null, null, organizationName, null, address, city, state, phone, specialty);
  }

  /** Organization name if present, else "first last" trimmed. */
  @JsonProperty("displayName")
  public String displayName() {
    if (organizationName != null) return organizationName;
    return ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
  }

  public boolean isOrganization() {
    return organizationName != null;
  }

  /** True when a real street address is on file. */
  public boolean hasAddress() {
    return address != null && !ADDRESS_NOT_FOUND.equals(address);
  }

  private static String blankToNull(String s) {
    return StringUtils.hasText(s) ? s.trim() : null;
  }
}
