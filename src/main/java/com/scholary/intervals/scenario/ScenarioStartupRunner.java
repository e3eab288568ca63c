package com.scholary.intervals.scenario;

import com.scholary.intervals.config.IntervalMergeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the scenario catalog once at startup and prints the report to standard output.
 *
 * <p>Only active when {@code intervals.scenarios.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(prefix = "intervals.scenarios", name = "run-on-startup", havingValue = "true")
public class ScenarioStartupRunner implements CommandLineRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScenarioStartupRunner.class);

  private final ScenarioRunner scenarioRunner;
  private final IntervalMergeProperties properties;

  public ScenarioStartupRunner(ScenarioRunner scenarioRunner, IntervalMergeProperties properties) {
    this.scenarioRunner = scenarioRunner;
    this.properties = properties;
  }

  @Override
  public void run(String... args) {
    LOGGER.info("Running scenario catalog on startup");
    ScenarioReport report =
        scenarioRunner.runAll(null, properties.scenarios().verbose(), System.out);
    if (!report.allPassed()) {
      LOGGER.warn("{} of {} scenarios failed", report.failedCount(), report.results().size());
    }
  }
}
