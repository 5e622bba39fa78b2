package com.vp.core;

/** Lifecycle of one investigation. INVALID_IDENTIFIER and COMPLETE are terminal. */
public enum InvestigationStatus {
  PENDING,
  INVALID_IDENTIFIER,
  COMPLETE
}
