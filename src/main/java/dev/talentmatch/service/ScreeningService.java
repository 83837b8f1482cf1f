package dev.talentmatch.service;

import dev.talentmatch.config.ScoringConfig;
import dev.talentmatch.config.ScreeningConfig;
import dev.talentmatch.exception.RecruitingException;
import dev.talentmatch.metrics.RecruitingMetrics;
import dev.talentmatch.model.Application;
import dev.talentmatch.model.CandidateProfile;
import dev.talentmatch.model.JdVersion;
import dev.talentmatch.model.MatchExplanation;
import dev.talentmatch.model.PipelineStage;
import dev.talentmatch.model.ResolvedJobSpec;
import dev.talentmatch.model.ScreeningReport;
import dev.talentmatch.model.ScreeningReport.RankedCandidate;
import dev.talentmatch.model.ScreeningScenario;
import dev.talentmatch.model.ScreeningScenario.ScenarioCandidate;
import dev.talentmatch.model.StageTransition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Screening run over one job: resolve, publish, apply every candidate, score,
 * then shortlist those that clear the minimum fit score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreeningService {

    private final RequirementResolver resolver;
    private final JdVersionService jdVersionService;
    private final SkillNormalizer skillNormalizer;
    private final FitScoringService fitScoringService;
    private final ApplicationService applicationService;
    private final RecruitingMetrics metrics;
    private final ScreeningConfig screeningConfig;
    private final ScoringConfig scoringConfig;

    public ScreeningReport screen(ScreeningScenario scenario) {
        if (scenario == null || scenario.isEmpty()) {
            log.info("No job variant in scenario, nothing to screen");
            metrics.updateLastRunStats(0, 0);
            return ScreeningReport.empty();
        }

        ResolvedJobSpec spec = resolver.resolve(
                scenario.getFamily(), scenario.getTemplate(), scenario.getCompany(), scenario.getVariant());
        log.info("Resolved '{}' at {} with {} requirements",
                spec.getTitle(), spec.getCompany().getName(), spec.getRequirements().size());

        String actor = scenario.getPublishedBy() != null ? scenario.getPublishedBy() : screeningConfig.getSystemUser();
        JdVersion published = null;
        if (screeningConfig.isPublish()) {
            published = jdVersionService.publish(scenario.getVariant(), spec, actor).version();
        } else {
            log.info("Publishing disabled, screening against the unpublished spec");
        }

        // application id -> explanation, in scenario order
        Map<String, MatchExplanation> scored = new LinkedHashMap<>();
        for (ScenarioCandidate candidate : scenario.getCandidates()) {
            try {
                Application application = applicationService.create(
                        candidate.getId(), spec.getCompanyJobVariantId(), actor);
                MatchExplanation explanation = scoreCandidate(candidate, spec);
                applicationService.recordMatch(application.getId(), explanation);
                applicationService.transitionStage(application.getId(), StageTransition.automated(
                        PipelineStage.SCREENING, screeningConfig.getSystemUser(),
                        "Fit score " + explanation.overallScore()));
                scored.put(application.getId(), explanation);
            } catch (RecruitingException e) {
                log.warn("Skipping candidate {} ({}): {}", candidate.getId(), e.getCode(), e.getMessage());
            }
        }

        List<RankedCandidate> shortlist = new ArrayList<>();
        for (MatchExplanation explanation : fitScoringService.shortlist(List.copyOf(scored.values()))) {
            String applicationId = applicationIdOf(scored, explanation);
            applicationService.transitionStage(applicationId, StageTransition.automated(
                    PipelineStage.SHORTLISTED, screeningConfig.getSystemUser(),
                    "Fit score at or above " + scoringConfig.getMinFitScore()));
            shortlist.add(new RankedCandidate(explanation.candidateId(), applicationId, explanation));
        }

        metrics.recordCandidatesShortlisted(shortlist.size());
        metrics.updateLastRunStats(scored.size(), shortlist.size());
        log.info("Screened {} candidates, {} shortlisted", scored.size(), shortlist.size());
        shortlist.forEach(r -> log.info("  {} - {} (gaps: {})",
                r.explanation().overallScore(), r.candidateId(), r.explanation().gaps()));

        return new ScreeningReport(published, scored.size(), List.copyOf(shortlist));
    }

    private MatchExplanation scoreCandidate(ScenarioCandidate candidate, ResolvedJobSpec spec) {
        CandidateProfile profile = skillNormalizer.normalizeProfile(candidate.getId(), candidate.getResume());
        MatchExplanation explanation = metrics.getScoringTimer().record(() -> fitScoringService.score(profile, spec));
        metrics.recordCandidateScored(explanation.gated());
        return explanation;
    }

    private static String applicationIdOf(Map<String, MatchExplanation> scored, MatchExplanation explanation) {
        return scored.entrySet().stream()
                .filter(e -> e.getValue() == explanation)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Shortlisted explanation has no application"));
    }
}
