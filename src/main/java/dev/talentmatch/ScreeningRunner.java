package dev.talentmatch;

import dev.talentmatch.model.ScreeningReport;
import dev.talentmatch.model.ScreeningScenario;
import dev.talentmatch.service.ScreeningService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs one screening over the loaded scenario.
 * Kept apart from the application class so it can be mocked in context tests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScreeningRunner {

  private static final String SEPARATOR = "========================================";

  private final ScreeningService screeningService;
  private final ScreeningScenario screeningScenario;

  /**
   * Executes the screening.
   *
   * @return Number of shortlisted candidates
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Talent Match Screening Starting");
    log.info(SEPARATOR);

    try {
      ScreeningReport report = screeningService.screen(screeningScenario);
      int count = report.shortlist().size();

      log.info(SEPARATOR);
      log.info("Talent Match Screening Completed Successfully");
      if (report.publishedVersion() != null) {
        log.info("Published JD version: {}", report.publishedVersion().getVersion());
      }
      log.info("Candidates screened: {}", report.candidatesScreened());
      log.info("Candidates shortlisted: {}", count);
      log.info(SEPARATOR);

      return count;
    } catch (Exception e) {
      log.error("Talent Match Screening failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Screening execution failed", e);
    }
  }
}
