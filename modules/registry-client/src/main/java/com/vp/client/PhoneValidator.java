package com.vp.client;

import java.util.Optional;

public interface PhoneValidator {

  /** @return empty for blank input, otherwise a result (possibly valid=false) */
  Optional<PhoneResult> validate(String raw);
}
