package com.vp.core;

/** Coarse outcome for callers; MISMATCH_WARNING refines COMPLETE when the names disagree. */
public enum ReportStatus {
  INVALID_IDENTIFIER,
  COMPLETE,
  MISMATCH_WARNING
}
