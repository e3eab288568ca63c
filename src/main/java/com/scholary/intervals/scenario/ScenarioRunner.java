package com.scholary.intervals.scenario;

import com.scholary.intervals.format.IntervalFormatter;
import com.scholary.intervals.interval.Interval;
import com.scholary.intervals.logging.StructuredLogger;
import com.scholary.intervals.merge.MergeMode;
import com.scholary.intervals.scenario.ScenarioResult.Outcome;
import com.scholary.intervals.service.IntervalMergeService;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs merge scenarios and checks the results against their expectations.
 *
 * <p>Results are compared as unordered multisets: no strategy promises an output order, so only the
 * intervals themselves (and how often each occurs) matter.
 *
 * <p>A plain-text report is written to the supplied stream; with verbose output the input, result
 * and expected collections are printed one interval per line.
 */
@Component
public class ScenarioRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScenarioRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Comparator<Interval> BY_BOUNDS =
      Comparator.comparingInt(Interval::min).thenComparingInt(Interval::max);

  private static final String START_BANNER = "************ Start Test ************";
  private static final String FAILED_BANNER = "************ Test Failed ************";
  private static final String SUCCESS_BANNER = "************ Test Successful ************";
  private static final String CLOSING_BANNER = "*************************************";

  private final IntervalMergeService mergeService;
  private final IntervalFormatter formatter;

  public ScenarioRunner(IntervalMergeService mergeService, IntervalFormatter formatter) {
    this.mergeService = mergeService;
    this.formatter = formatter;
  }

  /**
   * Run every scenario of the default catalog.
   *
   * @param mode the merge mode, or null for the configured default
   * @param verbose whether to print the interval collections
   * @param out where the report is written
   * @return the collected results
   */
  public ScenarioReport runAll(MergeMode mode, boolean verbose, PrintStream out) {
    return runAll(ScenarioCatalog.defaultScenarios(), mode, verbose, out);
  }

  public ScenarioReport runAll(
      List<MergeScenario> scenarios, MergeMode mode, boolean verbose, PrintStream out) {
    MergeMode effectiveMode = mode != null ? mode : mergeService.getDefaultMode();
    List<ScenarioResult> results = new ArrayList<>(scenarios.size());
    for (MergeScenario scenario : scenarios) {
      results.add(run(scenario, effectiveMode, verbose, out));
    }

    ScenarioReport report = new ScenarioReport(effectiveMode, results);
    LOGGER.info(
        "Scenario run finished: mode={}, passed={}, failed={}",
        effectiveMode,
        report.passedCount(),
        report.failedCount());
    return report;
  }

  /**
   * Run a single scenario.
   *
   * @param scenario the scenario to run
   * @param mode the merge mode, or null for the configured default
   * @param verbose whether to print the interval collections
   * @param out where the report is written
   * @return the scenario result
   */
  public ScenarioResult run(MergeScenario scenario, MergeMode mode, boolean verbose, PrintStream out) {
    MergeMode effectiveMode = mode != null ? mode : mergeService.getDefaultMode();
    out.println(START_BANNER);
    List<Interval> result = mergeService.merge(scenario.input(), effectiveMode).intervals();

    if (verbose) {
      printSection(out, "Input", scenario.input());
      printSection(out, "Result", result);
      printSection(out, "Expected", scenario.expected());
    }

    Outcome outcome = compare(result, scenario.expected());
    switch (outcome) {
      case SIZE_MISMATCH -> {
        out.println(FAILED_BANNER);
        out.println(
            "Result set size: " + result.size() + ", Expected set size: " + scenario.expected().size());
        out.println(CLOSING_BANNER);
      }
      case CONTENT_MISMATCH -> {
        out.println(FAILED_BANNER);
        out.println("Result set is not equal to the expected set");
        out.println(CLOSING_BANNER);
      }
      case PASSED -> out.println(SUCCESS_BANNER);
    }

    structuredLogger.logScenarioResult(
        scenario.name(),
        effectiveMode.name(),
        outcome.name(),
        result.size(),
        scenario.expected().size());
    return new ScenarioResult(scenario, result, outcome);
  }

  /**
   * Compare two interval collections as unordered multisets.
   *
   * @param result the merge result
   * @param expected the expected intervals
   * @return PASSED, or which kind of mismatch was found
   */
  static Outcome compare(List<Interval> result, List<Interval> expected) {
    if (result.size() != expected.size()) {
      return Outcome.SIZE_MISMATCH;
    }
    List<Interval> sortedResult = new ArrayList<>(result);
    List<Interval> sortedExpected = new ArrayList<>(expected);
    sortedResult.sort(BY_BOUNDS);
    sortedExpected.sort(BY_BOUNDS);
    return sortedResult.equals(sortedExpected) ? Outcome.PASSED : Outcome.CONTENT_MISMATCH;
  }

  private void printSection(PrintStream out, String title, List<Interval> intervals) {
    out.println("----------- " + title + " ----------");
    for (String line : formatter.formatLines(intervals)) {
      out.println(line);
    }
  }
}
