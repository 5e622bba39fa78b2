package com.vp.core.steps;

import com.vp.client.IdentityRecord;
import com.vp.client.IdentityRegistry;
import com.vp.core.AuditLog;
import com.vp.core.InvestigationContext;
import com.vp.core.VerificationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Resolves the identifier to a registry record; an unknown identifier ends the investigation. */
@Component
@Order(10)
public class RegistryLookupStep implements VerificationStep {

  private static final Logger log = LoggerFactory.getLogger(RegistryLookupStep.class);

  private final IdentityRegistry registry;

  public RegistryLookupStep(IdentityRegistry registry) {
    this.registry = registry;
  }

  @Override
  public String name() {
    return "registry-lookup";
  }

  @Override
  public void execute(InvestigationContext context, AuditLog audit) {
    audit.append("Querying NPI registry...");

    Optional<IdentityRecord> record;
    try {
      record = registry.resolve(context.targetIdentifier());
    } catch (RuntimeException e) {
      // without a record nothing downstream can be checked
      log.warn("Registry lookup for {} failed", context.targetIdentifier(), e);
      audit.append("Registry lookup error: " + e.getMessage());
      record = Optional.empty();
    }

    if (record.isEmpty()) {
      audit.append("Identifier not found or invalid.");
      context.markInvalidIdentifier();
      return;
    }

    context.setRegistryRecord(record.get());
    audit.append("Registry record found for " + record.get().displayName());
  }
}
