package com.vp.core;

import com.vp.client.VpClientProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the verification steps against a fresh context and returns the report.
 * Steps run in their @Order. An unknown identifier stops the run right after
 * the registry lookup; any other failure only empties the affected field.
 * With app.parallel-fanout, consecutive independent steps run concurrently
 * on staged copies of the context that are committed back in step order.
 */
@Service
public class InvestigationService {

  private static final Logger log = LoggerFactory.getLogger(InvestigationService.class);

  private final List<VerificationStep> steps;
  private final ReportAssembler assembler;
  private final ExecutorService executor;
  private final boolean parallelFanout;
  private final Duration stepTimeout;

  public InvestigationService(List<VerificationStep> steps,
                              ReportAssembler assembler,
                              ExecutorService investigationExecutor,
                              VpClientProperties props) {
    this.steps = List.copyOf(steps);
    this.assembler = assembler;
    this.executor = investigationExecutor;
    this.parallelFanout = props.isParallelFanout();
    this.stepTimeout = props.getStepTimeout();
  }

  public InvestigationReport investigate(String identifier) {
    return investigate(identifier, ClaimedAttributes.none());
  }

  public InvestigationReport investigate(String identifier, String claimedName, String claimedAddress, String claimedPhone) {
    return investigate(identifier, new ClaimedAttributes(claimedName, claimedAddress, claimedPhone));
  }

  public InvestigationReport investigate(String identifier, ClaimedAttributes claimed) {
    if (!StringUtils.hasText(identifier)) {
      throw new IllegalArgumentException("identifier must not be blank");
    }

    InvestigationContext context = new InvestigationContext(identifier.trim(), claimed);
    context.auditLog().append("Starting investigation for identifier: " + context.targetIdentifier());
    log.info("Starting investigation for {}", context.targetIdentifier());

    int i = 0;
    while (i < steps.size() && !context.isShortCircuited()) {
      VerificationStep step = steps.get(i);
      if (parallelFanout && step.independent()) {
        int j = i;
        while (j < steps.size() && steps.get(j).independent()) j++;
        runConcurrently(steps.subList(i, j), context);
        i = j;
      } else {
        runGuarded(step, context, context.auditLog());
        i++;
      }
    }

    if (!context.isShortCircuited()) {
      context.markComplete();
    }
    context.seal();
    log.info("Investigation for {} finished: {}", context.targetIdentifier(), context.status());
    return assembler.assemble(context);
  }

  /* ------------ helpers ------------ */

  /** Last line of defence: a step that throws anyway must not take the run down. */
  private static void runGuarded(VerificationStep step, InvestigationContext context, AuditLog audit) {
    try {
      step.execute(context, audit);
    } catch (RuntimeException e) {
      log.error("Step {} failed for {}", step.name(), context.targetIdentifier(), e);
      audit.append("Step " + step.name() + " failed: " + e.getMessage());
    }
  }

  /**
   * Each step runs on its own staged copy of the context. Copies are committed in step order;
   * a step that misses the deadline is interrupted and contributes nothing but a timeout entry.
   */
  private void runConcurrently(List<VerificationStep> stage, InvestigationContext context) {
    List<InvestigationContext> staged = new ArrayList<>();
    List<Future<?>> futures = new ArrayList<>();
    for (VerificationStep step : stage) {
      InvestigationContext copy = context.stage();
      staged.add(copy);
      futures.add(executor.submit(() -> runGuarded(step, copy, copy.auditLog())));
    }

    long deadline = System.nanoTime() + stepTimeout.toNanos();
    for (int k = 0; k < stage.size(); k++) {
      VerificationStep step = stage.get(k);
      Future<?> future = futures.get(k);
      try {
        future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        context.commit(staged.get(k));
      } catch (TimeoutException e) {
        future.cancel(true);
        staged.get(k).seal();
        log.warn("Step {} timed out after {} ms for {}", step.name(), stepTimeout.toMillis(), context.targetIdentifier());
        context.auditLog().append("Step " + step.name() + " timed out after " + stepTimeout.toMillis() + "ms.");
      } catch (ExecutionException e) {
        staged.get(k).seal();
        log.error("Step {} failed for {}", step.name(), context.targetIdentifier(), e.getCause());
        context.auditLog().append("Step " + step.name() + " failed: " + e.getCause().getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        future.cancel(true);
        staged.get(k).seal();
        context.auditLog().append("Step " + step.name() + " interrupted.");
      }
    }
  }
}
