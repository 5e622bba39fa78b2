package com.vp.core.steps;

import com.vp.client.IdentityRecord;
import com.vp.core.AuditLog;
import com.vp.core.InvestigationContext;
import com.vp.core.VerificationStep;
import com.vp.kyc.IdentityMatcher;
import com.vp.kyc.IdentityMatcher.MatchResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Compares the claimed name with the registry name and picks the name the
 * web search will use. A mismatch is flagged, never fatal.
 */
@Component
@Order(20)
public class IdentityMatchStep implements VerificationStep {

  private final IdentityMatcher matcher;

  public IdentityMatchStep(IdentityMatcher matcher) {
    this.matcher = matcher;
  }

  @Override
  public String name() {
    return "identity-match";
  }

  @Override
  public void execute(InvestigationContext context, AuditLog audit) {
    IdentityRecord record = context.registryRecord().orElse(null);
    String claimedName = context.claimed().name();

    String registryName = record == null ? "" : record.displayName();
    context.setSearchName(StringUtils.hasText(registryName) ? registryName : claimedName);

    if (claimedName == null) {
      audit.append("No claimed name supplied; identity match skipped.");
      return;
    }

    Optional<MatchResult> result = matcher.match(claimedName, record);
    if (result.isEmpty()) {
      audit.append("Registry name unavailable; identity match skipped.");
      return;
    }

    MatchResult m = result.get();
    context.setMatchResult(m);
    if (m.mismatch()) {
      audit.append("WARNING: Identity mismatch! Claimed name (" + m.claimedName()
          + ") vs registry (" + m.registryName() + ") is " + m.percent() + "% match.");
    } else {
      audit.append("Name match confirmed (" + m.percent() + "%).");
    }
  }
}
