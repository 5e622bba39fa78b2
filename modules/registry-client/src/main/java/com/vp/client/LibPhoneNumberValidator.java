package com.vp.client;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberToTimeZonesMapper;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.PhoneNumberUtil.PhoneNumberFormat;
import com.google.i18n.phonenumbers.Phonenumber.PhoneNumber;
import com.google.i18n.phonenumbers.geocoding.PhoneNumberOfflineGeocoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses and validates numbers with libphonenumber, defaulting to the configured region.
 * Valid numbers also get the offline geocoder's place name and their time zones.
 */
@Component
public class LibPhoneNumberValidator implements PhoneValidator {

  private final PhoneNumberUtil util = PhoneNumberUtil.getInstance();
  private final PhoneNumberOfflineGeocoder geocoder = PhoneNumberOfflineGeocoder.getInstance();
  private final PhoneNumberToTimeZonesMapper timeZoneMapper = PhoneNumberToTimeZonesMapper.getInstance();
  private final String defaultRegion;

  public LibPhoneNumberValidator(VpClientProperties props) {
    this.defaultRegion = props.getPhoneDefaultRegion();
  }

  @Override
  public Optional<PhoneResult> validate(String raw) {
    if (!StringUtils.hasText(raw)) return Optional.empty();

    PhoneNumber parsed;
    try {
      parsed = util.parse(raw, defaultRegion);
    } catch (NumberParseException e) {
      return Optional.of(PhoneResult.invalid(raw, "Parse Error: " + e.getMessage()));
    }

    if (!util.isValidNumber(parsed)) {
      return Optional.of(PhoneResult.invalid(raw, "Invalid structure or non-existent number"));
    }

    return Optional.of(new PhoneResult(
        true,
        raw,
        util.format(parsed, PhoneNumberFormat.NATIONAL),
        util.format(parsed, PhoneNumberFormat.E164),
        describe(parsed),
        timeZones(parsed),
        null
    ));
  }

  /* ------------ helpers ------------ */

  private String describe(PhoneNumber parsed) {
    String description = geocoder.getDescriptionForNumber(parsed, Locale.ENGLISH);
    return StringUtils.hasText(description) ? description : util.getRegionCodeForNumber(parsed);
  }

  private List<String> timeZones(PhoneNumber parsed) {
    return timeZoneMapper.getTimeZonesForNumber(parsed).stream()
        .filter(zone -> !PhoneNumberToTimeZonesMapper.getUnknownTimeZone().equals(zone))
        .toList();
  }
}
