package com.vp.core.steps;

import com.vp.client.GeoResult;
import com.vp.client.Geocoder;
import com.vp.client.IdentityRecord;
import com.vp.core.AuditLog;
import com.vp.core.InvestigationContext;
import com.vp.core.VerificationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Geocodes the registry address. */
@Component
@Order(30)
public class LocationStep implements VerificationStep {

  private static final Logger log = LoggerFactory.getLogger(LocationStep.class);

  private final Geocoder geocoder;

  public LocationStep(Geocoder geocoder) {
    this.geocoder = geocoder;
  }

  @Override
  public String name() {
    return "location";
  }

  @Override
  public boolean independent() {
    return true;
  }

  @Override
  public void execute(InvestigationContext context, AuditLog audit) {
    IdentityRecord record = context.registryRecord().orElse(null);
    if (record == null) return;

    if (!record.hasAddress()) {
      audit.append("No address to verify.");
      return;
    }

    String address = record.address();
    audit.append("Verifying address '" + address + "'...");
    try {
      Optional<GeoResult> geo = geocoder.geocode(address);
      if (geo.isPresent()) {
        context.setGeoResult(geo.get());
        audit.append("Address verified. Match: " + geo.get().matchType());
      } else {
        audit.append("Address could not be located.");
      }
    } catch (RuntimeException e) {
      log.warn("Geocoding '{}' failed", address, e);
      audit.append("Geocoding error: " + e.getMessage());
    }
  }
}
