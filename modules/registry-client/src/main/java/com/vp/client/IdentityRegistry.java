package com.vp.client;

import java.util.Optional;

public interface IdentityRegistry {

  /**
   * Looks up a provider by its registry identifier.
   * @param identifier registry key (e.g. a 10-digit NPI)
   * @return the normalized record, or empty when the registry has no such entry
   * @throws VpApiException on transport-level failure only
   */
  Optional<IdentityRecord> resolve(String identifier);
}
