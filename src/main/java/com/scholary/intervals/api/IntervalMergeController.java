package com.scholary.intervals.api;

import com.scholary.intervals.interval.Interval;
import com.scholary.intervals.interval.InvalidIntervalException;
import com.scholary.intervals.logging.StructuredLogger;
import com.scholary.intervals.merge.MergeMode;
import com.scholary.intervals.scenario.ScenarioReport;
import com.scholary.intervals.scenario.ScenarioRunner;
import com.scholary.intervals.service.IntervalMergeService;
import com.scholary.intervals.service.MergeOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for interval merging.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Merging a collection of intervals with a selectable algorithm
 *   <li>Running the built-in scenario catalog
 * </ul>
 */
@RestController
@Tag(name = "Intervals", description = "Interval merge API")
public class IntervalMergeController {

  private static final Logger LOGGER = LoggerFactory.getLogger(IntervalMergeController.class);

  private final IntervalMergeService mergeService;
  private final ScenarioRunner scenarioRunner;

  public IntervalMergeController(IntervalMergeService mergeService, ScenarioRunner scenarioRunner) {
    this.mergeService = mergeService;
    this.scenarioRunner = scenarioRunner;
  }

  /**
   * Merge overlapping, touching and contained intervals.
   *
   * <p>Returns 400 if any interval has min > max or the collection exceeds the configured limit.
   */
  @PostMapping("/api/intervals/merge")
  @Operation(
      summary = "Merge intervals",
      description =
          "Merge overlapping, touching and nested closed intervals. "
              + "SWEEP sorts then folds in one pass; PAIRWISE reduces pairs until stable.")
  public ResponseEntity<MergeResponse> merge(@Valid @RequestBody MergeRequest request) {
    String requestId = UUID.randomUUID().toString();
    try {
      StructuredLogger.setRequestContext(requestId);
      LOGGER.info(
          "Merge request: intervals={}, mode={}", request.intervals().size(), request.mode());

      List<Interval> intervals =
          request.intervals().stream().map(IntervalPayload::toInterval).toList();
      MergeOutcome outcome = mergeService.merge(intervals, request.mode());
      return ResponseEntity.ok(MergeResponse.from(outcome));

    } catch (InvalidIntervalException e) {
      LOGGER.warn("Rejected merge request: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /**
   * Run the scenario catalog.
   *
   * <p>With {@code verbose=true} the plain-text report, including every interval collection, is also
   * written to the log.
   */
  @GetMapping("/api/scenarios")
  @Operation(
      summary = "Run scenarios",
      description = "Run the built-in merge scenarios and report which ones pass")
  public ResponseEntity<ScenarioReportResponse> runScenarios(
      @RequestParam(required = false) MergeMode mode,
      @RequestParam(defaultValue = "false") boolean verbose) {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    ScenarioReport report = scenarioRunner.runAll(mode, verbose, out);
    if (verbose) {
      LOGGER.info("Scenario report:\n{}", buffer.toString(StandardCharsets.UTF_8));
    }
    return ResponseEntity.ok(ScenarioReportResponse.from(report));
  }
}
