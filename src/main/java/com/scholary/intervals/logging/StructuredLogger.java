package com.scholary.intervals.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets its fields in the MDC for the duration of a single log call, so log shippers
 * can index them as separate fields.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log merge started event. */
  public void logMergeStarted(String mode, int inputCount) {
    try {
      MDC.put("event_type", "merge_started");
      MDC.put("mode", mode);
      MDC.put("inputCount", String.valueOf(inputCount));

      logger.debug("Merge started: mode={}, intervals={}", mode, inputCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log merge completed event. */
  public void logMergeCompleted(
      String mode, int inputCount, int outputCount, boolean cacheHit, long durationMicros) {
    try {
      MDC.put("event_type", "merge_completed");
      MDC.put("mode", mode);
      MDC.put("inputCount", String.valueOf(inputCount));
      MDC.put("outputCount", String.valueOf(outputCount));
      MDC.put("cacheHit", String.valueOf(cacheHit));
      MDC.put("durationMicros", String.valueOf(durationMicros));

      logger.info(
          "Merge completed: mode={}, intervals={}->{}, cacheHit={}, duration={}us",
          mode,
          inputCount,
          outputCount,
          cacheHit,
          durationMicros);
    } finally {
      clearEventFields();
    }
  }

  /** Log merge rejected event. */
  public void logMergeRejected(String mode, int inputCount, String reason) {
    try {
      MDC.put("event_type", "merge_rejected");
      MDC.put("mode", mode);
      MDC.put("inputCount", String.valueOf(inputCount));
      MDC.put("reason", reason);

      logger.warn("Merge rejected: mode={}, intervals={}, reason={}", mode, inputCount, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log scenario result event. */
  public void logScenarioResult(
      String scenario, String mode, String outcome, int resultSize, int expectedSize) {
    try {
      MDC.put("event_type", "scenario_result");
      MDC.put("scenario", scenario);
      MDC.put("mode", mode);
      MDC.put("outcome", outcome);
      MDC.put("outputCount", String.valueOf(resultSize));
      MDC.put("expectedCount", String.valueOf(expectedSize));

      if ("PASSED".equals(outcome)) {
        logger.info("Scenario {}: mode={}, outcome={}", scenario, mode, outcome);
      } else {
        logger.warn(
            "Scenario {}: mode={}, outcome={}, resultSize={}, expectedSize={}",
            scenario,
            mode,
            outcome,
            resultSize,
            expectedSize);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String requestId) {
    MDC.put("requestId", requestId);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("requestId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("mode");
    MDC.remove("inputCount");
    MDC.remove("outputCount");
    MDC.remove("cacheHit");
    MDC.remove("durationMicros");
    MDC.remove("reason");
    MDC.remove("scenario");
    MDC.remove("outcome");
    MDC.remove("expectedCount");
  }
}
