package com.vp.kyc;

import com.vp.client.IdentityRecord;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Name check: normalize both sides, score with {@link SequenceMatcher},
 * flag a mismatch below the threshold. A missing claim is not a mismatch.
 */
@Service
public class NameMatchRules implements IdentityMatcher {

  /** Tolerates credentials and formatting ("Dr.", middle initials), flags different identities. */
  public static final double DEFAULT_MISMATCH_THRESHOLD = 0.60;

  private final double threshold;

  public NameMatchRules() {
    this(DEFAULT_MISMATCH_THRESHOLD);
  }

  NameMatchRules(double threshold) {
    this.threshold = threshold;
  }

  @Override
  public Optional<MatchResult> match(String claimedName, IdentityRecord record) {
    if (record == null) return Optional.empty();

    String registryName = record.displayName();
    String claimedNorm = NameNormalizer.normalize(claimedName);
    String registryNorm = NameNormalizer.normalize(registryName);
    if (claimedNorm.isEmpty() || registryNorm.isEmpty()) return Optional.empty();

    double similarity = SequenceMatcher.ratio(claimedNorm, registryNorm);
    return Optional.of(new MatchResult(similarity, similarity < threshold, claimedName, registryName));
  }
}
