package com.vp.core;

import java.util.ArrayList;
import java.util.List;

/** Append-only, human-readable trail of one investigation. Order is chronological. */
public class AuditLog {

  private final List<String> entries = new ArrayList<>();

  public void append(String entry) {
    entries.add(entry);
  }

  /** Appends another log's entries after this one's, keeping their order. */
  public void appendAll(AuditLog other) {
    entries.addAll(other.entries);
  }

  public List<String> entries() {
    return List.copyOf(entries);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
