package com.vp.kyc;

import com.vp.client.IdentityRecord;

import java.util.Locale;
import java.util.Optional;

public interface IdentityMatcher {

  /**
   * Outcome of comparing a claimed name with the registry name.
   * @param similarity   score in [0, 1]
   * @param mismatch     true when the score is below the mismatch threshold
   * @param claimedName  name as claimed (not normalized)
   * @param registryName registry display name (not normalized)
   */
  record MatchResult(double similarity, boolean mismatch, String claimedName, String registryName) {

    /** Similarity as a percentage with one decimal, e.g. "87.5". */
    public String percent() {
      return String.format(Locale.ROOT, "%.1f", similarity * 100);
    }
  }

  /**
   * Compares a claimed name against a registry record.
   * @param claimedName name asserted by an unverified source (may be null)
   * @param record      registry record (may be null)
   * @return empty when there is nothing to compare: no record, or a blank name on either side
   */
  Optional<MatchResult> match(String claimedName, IdentityRecord record);
}
