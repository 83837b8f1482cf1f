package dev.talentmatch;

import dev.talentmatch.model.Application;
import dev.talentmatch.model.PipelineStage;
import dev.talentmatch.model.ScreeningReport;
import dev.talentmatch.model.ScreeningScenario;
import dev.talentmatch.service.ApplicationService;
import dev.talentmatch.service.JdVersionService;
import dev.talentmatch.service.ScreeningService;
import dev.talentmatch.service.StageHistoryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "screening.scenario-file=src/test/resources/scenario/techstart.json")
@ActiveProfiles("test")
class ScreeningIntegrationTest {

  @MockitoBean
  private ScreeningRunner screeningRunner;

  @Autowired
  private ScreeningScenario scenario;

  @Autowired
  private ScreeningService screeningService;

  @Autowired
  private ApplicationService applicationService;

  @Autowired
  private StageHistoryService stageHistoryService;

  @Autowired
  private JdVersionService jdVersionService;

  @Test
  void shouldScreenTheTechStartScenario() {
    ScreeningReport report = screeningService.screen(scenario);

    assertThat(report.publishedVersion().getVersion()).isEqualTo(1);
    assertThat(report.publishedVersion().getCreatedBy()).isEqualTo("recruiter@techstart.io");
    assertThat(jdVersionService.findLatest("var-techstart-fe").getPublishedContent())
        .contains("### Nice to Have\n- TailwindCSS");
    assertThat(report.candidatesScreened()).isEqualTo(2);
    assertThat(report.shortlist()).singleElement().satisfies(ranked -> {
      assertThat(ranked.candidateId()).isEqualTo("cand-ana");
      assertThat(ranked.explanation().overallScore()).isEqualTo(80);
      assertThat(ranked.explanation().gaps()).containsExactly("Missing nice-to-have: TailwindCSS");
    });

    Application ana = applicationService.findById(report.shortlist().get(0).applicationId());
    assertThat(ana.getStatus()).isEqualTo(PipelineStage.SHORTLISTED);
    assertThat(ana.getFitScore()).isEqualTo(80);
    assertThat(stageHistoryService.timeline(ana.getId()))
        .extracting(entry -> entry.toStage())
        .containsExactly(PipelineStage.APPLIED, PipelineStage.SCREENING, PipelineStage.SHORTLISTED);
    assertThat(stageHistoryService.automatedEntries(ana.getId()))
        .filteredOn(entry -> entry.fromStage() != null)
        .extracting(entry -> entry.changedBy())
        .containsExactly("test-runner", "test-runner");
    assertThat(applicationService.countByStage())
        .containsEntry(PipelineStage.SHORTLISTED, 1L)
        .containsEntry(PipelineStage.SCREENING, 1L);
  }
}
