package com.vp.core;

import com.vp.client.GeoResult;
import com.vp.client.IdentityRecord;
import com.vp.client.PhoneResult;
import com.vp.kyc.IdentityMatcher.MatchResult;
import com.vp.web.Footprint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of a single investigation, threaded through the steps.
 * Owned by one {@link InvestigationService#investigate} call and discarded afterwards.
 * Each step writes only its own fields; once sealed, writes fail.
 * Concurrent steps work on a {@link #stage() staged} copy that is committed only if they finish in time.
 */
public class InvestigationContext {

  private final String targetIdentifier;
  private final ClaimedAttributes claimed;
  private final AuditLog auditLog = new AuditLog();

  private volatile InvestigationStatus status = InvestigationStatus.PENDING;
  private volatile boolean sealed;

  private IdentityRecord registryRecord;
  private MatchResult matchResult;
  /** Best name to search the web with: registry display name, else the claimed name. */
  private String searchName;
  private GeoResult geoResult;
  private PhoneResult phoneResult;
  private PhoneResult claimedPhoneResult;
  private Footprint webFootprint;
  private List<String> addressConfirmationLinks;

  public InvestigationContext(String targetIdentifier, ClaimedAttributes claimed) {
    this.targetIdentifier = Objects.requireNonNull(targetIdentifier, "targetIdentifier");
    this.claimed = claimed == null ? ClaimedAttributes.none() : claimed;
  }

  public String targetIdentifier() { return targetIdentifier; }
  public ClaimedAttributes claimed() { return claimed; }
  public AuditLog auditLog() { return auditLog; }
  public InvestigationStatus status() { return status; }

  // ---------- status transitions ----------

  /** PENDING -> INVALID_IDENTIFIER. */
  public void markInvalidIdentifier() {
    requirePending();
    status = InvestigationStatus.INVALID_IDENTIFIER;
  }

  /** PENDING -> COMPLETE. */
  public void markComplete() {
    requirePending();
    status = InvestigationStatus.COMPLETE;
  }

  public boolean isShortCircuited() {
    return status == InvestigationStatus.INVALID_IDENTIFIER;
  }

  /** Called before the report is assembled; late writes are rejected. */
  void seal() {
    sealed = true;
  }

  /**
   * Private copy for one concurrently running step. It sees the evidence gathered so far
   * and its own audit log; nothing reaches this context until {@link #commit}.
   */
  InvestigationContext stage() {
    InvestigationContext staged = new InvestigationContext(targetIdentifier, claimed);
    staged.registryRecord = registryRecord;
    staged.matchResult = matchResult;
    staged.searchName = searchName;
    return staged;
  }

  /** Takes over the fields a staged step produced, and its audit entries after ours. */
  void commit(InvestigationContext staged) {
    checkOpen();
    if (staged.geoResult != null) geoResult = staged.geoResult;
    if (staged.phoneResult != null) phoneResult = staged.phoneResult;
    if (staged.claimedPhoneResult != null) claimedPhoneResult = staged.claimedPhoneResult;
    if (staged.webFootprint != null) webFootprint = staged.webFootprint;
    if (staged.addressConfirmationLinks != null) addressConfirmationLinks = staged.addressConfirmationLinks;
    auditLog.appendAll(staged.auditLog);
  }

  // ---------- evidence ----------

  public Optional<IdentityRecord> registryRecord() { return Optional.ofNullable(registryRecord); }
  public void setRegistryRecord(IdentityRecord registryRecord) { checkOpen(); this.registryRecord = registryRecord; }

  public Optional<MatchResult> matchResult() { return Optional.ofNullable(matchResult); }
  public void setMatchResult(MatchResult matchResult) { checkOpen(); this.matchResult = matchResult; }

  public Optional<String> searchName() { return Optional.ofNullable(searchName); }
  public void setSearchName(String searchName) { checkOpen(); this.searchName = searchName; }

  public Optional<GeoResult> geoResult() { return Optional.ofNullable(geoResult); }
  public void setGeoResult(GeoResult geoResult) { checkOpen(); this.geoResult = geoResult; }

  public Optional<PhoneResult> phoneResult() { return Optional.ofNullable(phoneResult); }
  public void setPhoneResult(PhoneResult phoneResult) { checkOpen(); this.phoneResult = phoneResult; }

  public Optional<PhoneResult> claimedPhoneResult() { return Optional.ofNullable(claimedPhoneResult); }
  public void setClaimedPhoneResult(PhoneResult claimedPhoneResult) { checkOpen(); this.claimedPhoneResult = claimedPhoneResult; }

  public Optional<Footprint> webFootprint() { return Optional.ofNullable(webFootprint); }
  public void setWebFootprint(Footprint webFootprint) { checkOpen(); this.webFootprint = webFootprint; }

  public Optional<List<String>> addressConfirmationLinks() { return Optional.ofNullable(addressConfirmationLinks); }
  public void setAddressConfirmationLinks(List<String> links) {
    checkOpen();
    this.addressConfirmationLinks = links == null ? null : List.copyOf(links);
  }

  /** True only when a comparison happened and came out below the threshold. */
  public boolean isNameMismatch() {
    return matchResult != null && matchResult.mismatch();
  }

  // ---------- helpers ----------

  private void requirePending() {
    if (status != InvestigationStatus.PENDING) {
      throw new IllegalStateException("Investigation " + targetIdentifier + " already " + status);
    }
  }

  private void checkOpen() {
    if (sealed) {
      throw new IllegalStateException("Investigation " + targetIdentifier + " is already reported");
    }
  }
}
