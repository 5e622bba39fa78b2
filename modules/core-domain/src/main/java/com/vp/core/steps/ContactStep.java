package com.vp.core.steps;

import com.vp.client.IdentityRecord;
import com.vp.client.PhoneResult;
import com.vp.client.PhoneValidator;
import com.vp.core.AuditLog;
import com.vp.core.InvestigationContext;
import com.vp.core.VerificationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Validates the registry phone and, separately, any claimed phone.
 * A missing or failing one does not stop the other.
 */
@Component
@Order(40)
public class ContactStep implements VerificationStep {

  private static final Logger log = LoggerFactory.getLogger(ContactStep.class);

  private final PhoneValidator validator;

  public ContactStep(PhoneValidator validator) {
    this.validator = validator;
  }

  @Override
  public String name() {
    return "contact";
  }

  @Override
  public boolean independent() {
    return true;
  }

  @Override
  public void execute(InvestigationContext context, AuditLog audit) {
    IdentityRecord record = context.registryRecord().orElse(null);
    if (record == null) return;

    if (record.phone() != null) {
      validate("registry", record.phone(), audit).ifPresent(context::setPhoneResult);
    } else {
      audit.append("No registry phone number on file.");
    }

    String claimedPhone = context.claimed().phone();
    if (claimedPhone != null) {
      validate("claimed", claimedPhone, audit).ifPresent(context::setClaimedPhoneResult);
    }

    PhoneResult official = context.phoneResult().orElse(null);
    PhoneResult claimed = context.claimedPhoneResult().orElse(null);
    if (official != null && claimed != null && official.valid() && claimed.valid()) {
      if (Objects.equals(official.e164(), claimed.e164())) {
        audit.append("Claimed phone matches registry phone.");
      } else {
        audit.append("Claimed phone " + claimed.formatted() + " differs from registry phone " + official.formatted() + ".");
      }
    }
  }

  private Optional<PhoneResult> validate(String label, String raw, AuditLog audit) {
    audit.append("Validating " + label + " phone '" + raw + "'...");
    try {
      Optional<PhoneResult> result = validator.validate(raw);
      if (result.isEmpty()) {
        audit.append("No result for " + label + " phone.");
      } else if (result.get().valid()) {
        audit.append("Phone valid (" + label + "). Region: " + result.get().areaLocation());
      } else {
        audit.append("Phone validation failed (" + label + "): " + result.get().error());
      }
      return result;
    } catch (RuntimeException e) {
      log.warn("Validating {} phone failed", label, e);
      audit.append("Phone tool error (" + label + "): " + e.getMessage());
      return Optional.empty();
    }
  }
}
