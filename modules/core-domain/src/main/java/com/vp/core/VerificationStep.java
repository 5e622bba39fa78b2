package com.vp.core;

/**
 * One stage of an investigation. A step reads and writes the shared
 * {@link InvestigationContext} and narrates what it did into the audit log.
 * Steps catch their own collaborator failures: they log the cause, leave
 * their field empty and return normally.
 */
public interface VerificationStep {

  /** Short name used in logs. */
  String name();

  void execute(InvestigationContext context, AuditLog audit);

  /**
   * True when the step neither reads nor writes another independent step's fields,
   * so consecutive independent steps may run concurrently.
   */
  default boolean independent() {
    return false;
  }
}
