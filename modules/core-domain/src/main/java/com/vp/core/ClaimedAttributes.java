package com.vp.core;

import org.springframework.util.StringUtils;

/** Values asserted by an unverified source; blanks are stored as null. */
public record ClaimedAttributes(String name, String address, String phone) {

  public ClaimedAttributes {
    name = StringUtils.hasText(name) ? name.trim() : null;
    address = StringUtils.hasText(address) ? address.trim() : null;
    phone = StringUtils.hasText(phone) ? phone.trim() : null;
  }

  public static ClaimedAttributes none() {
    return new ClaimedAttributes(null, null, null);
  }
}
