package com.vp.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vp.client.GeoResult;
import com.vp.client.IdentityRecord;
import com.vp.client.PhoneResult;
import com.vp.kyc.IdentityMatcher.MatchResult;
import com.vp.web.Footprint;

import java.time.Instant;
import java.util.List;

/**
 * Trust report of one investigation.
 * Evidence fields are null when their check was skipped or failed; the audit log says which and why.
 * For an unknown identifier only status, overallStatus and auditLog are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvestigationReport(
    InvestigationStatus status,
    ReportStatus overallStatus,
    String identifier,
    IdentityRecord registryRecord,
    MatchResult matchResult,
    GeoResult geoResult,
    PhoneResult phoneResult,
    PhoneResult claimedPhoneResult,
    Footprint webFootprint,
    List<String> addressConfirmationLinks,
    Boolean nameMismatch,
    List<String> auditLog,
    Instant completedAt
) {

  public InvestigationReport {
    auditLog = auditLog == null ? List.of() : List.copyOf(auditLog);
    addressConfirmationLinks = addressConfirmationLinks == null ? null : List.copyOf(addressConfirmationLinks);
  }

  public static InvestigationReport invalidIdentifier(List<String> auditLog) {
    return new InvestigationReport(InvestigationStatus.INVALID_IDENTIFIER, ReportStatus.INVALID_IDENTIFIER,
        null, null, null, null, null, null, null, null, null, auditLog, null);
  }
}
