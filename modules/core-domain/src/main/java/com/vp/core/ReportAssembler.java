package com.vp.core;

import org.springframework.stereotype.Component;

import java.time.Clock;

/** Projects a finished context into the report handed to callers. */
@Component
public class ReportAssembler {

  private final Clock clock;

  public ReportAssembler() {
    this(Clock.systemUTC());
  }

  ReportAssembler(Clock clock) {
    this.clock = clock;
  }

  public InvestigationReport assemble(InvestigationContext context) {
    if (context.status() == InvestigationStatus.INVALID_IDENTIFIER) {
      return InvestigationReport.invalidIdentifier(context.auditLog().entries());
    }

    boolean mismatch = context.isNameMismatch();
    return new InvestigationReport(
        context.status(),
        mismatch ? ReportStatus.MISMATCH_WARNING : ReportStatus.COMPLETE,
        context.targetIdentifier(),
        context.registryRecord().orElse(null),
        context.matchResult().orElse(null),
        context.geoResult().orElse(null),
        context.phoneResult().orElse(null),
        context.claimedPhoneResult().orElse(null),
        context.webFootprint().orElse(null),
        context.addressConfirmationLinks().orElse(null),
        mismatch,
        context.auditLog().entries(),
        clock.instant()
    );
  }
}
