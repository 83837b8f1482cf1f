package dev.talentmatch.metrics;

import dev.talentmatch.model.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for screening, pipeline and publishing operations.
 */
@Component
public class RecruitingMetrics {

    private static final String TAG_STAGE = "stage";
    private final MeterRegistry registry;

    // Counters
    private final Counter applicationsCreatedCounter;
    private final Counter candidatesScoredCounter;
    private final Counter candidatesGatedCounter;
    private final Counter candidatesShortlistedCounter;
    private final Counter jdVersionsPublishedCounter;
    private final Counter conflictsCounter;

    private final Timer scoringTimer;

    // Gauges
    private final AtomicInteger lastRunCandidatesScreened = new AtomicInteger(0);
    private final AtomicInteger lastRunCandidatesShortlisted = new AtomicInteger(0);

    public RecruitingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.applicationsCreatedCounter = Counter.builder("talent_match_applications_created_total")
                .description("Total applications created")
                .register(registry);

        this.candidatesScoredCounter = Counter.builder("talent_match_candidates_scored_total")
                .description("Total candidate fit scores computed")
                .register(registry);

        this.candidatesGatedCounter = Counter.builder("talent_match_candidates_gated_total")
                .description("Total fit scores capped by a weak must-have requirement")
                .register(registry);

        this.candidatesShortlistedCounter = Counter.builder("talent_match_candidates_shortlisted_total")
                .description("Total candidates at or above the minimum fit score")
                .register(registry);

        this.jdVersionsPublishedCounter = Counter.builder("talent_match_jd_versions_published_total")
                .description("Total job description versions published")
                .register(registry);

        this.conflictsCounter = Counter.builder("talent_match_application_conflicts_total")
                .description("Total rejected application writes (duplicate, finalized or stale)")
                .register(registry);

        this.scoringTimer = Timer.builder("talent_match_scoring_duration")
                .description("Time to score one candidate")
                .register(registry);

        Gauge.builder("talent_match_last_run_candidates_screened", lastRunCandidatesScreened, AtomicInteger::get)
                .description("Candidates screened in last run")
                .register(registry);

        Gauge.builder("talent_match_last_run_candidates_shortlisted", lastRunCandidatesShortlisted, AtomicInteger::get)
                .description("Candidates shortlisted in last run")
                .register(registry);
    }

    public Timer getScoringTimer() {
        return scoringTimer;
    }

    public void recordApplicationCreated() {
        applicationsCreatedCounter.increment();
    }

    /**
     * Record a stage change, tagged with the stage entered.
     */
    public void recordTransition(PipelineStage toStage) {
        Counter.builder("talent_match_stage_transitions_total")
                .tag(TAG_STAGE, toStage.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordCandidateScored(boolean gated) {
        candidatesScoredCounter.increment();
        if (gated) {
            candidatesGatedCounter.increment();
        }
    }

    public void recordCandidatesShortlisted(int count) {
        candidatesShortlistedCounter.increment(count);
    }

    public void recordJdVersionPublished() {
        jdVersionsPublishedCounter.increment();
    }

    public void recordConflict(String code) {
        conflictsCounter.increment();
        Counter.builder("talent_match_application_conflicts_by_code_total")
                .tag("code", code)
                .register(registry)
                .increment();
    }

    /**
     * Update last run statistics.
     */
    public void updateLastRunStats(int screened, int shortlisted) {
        lastRunCandidatesScreened.set(screened);
        lastRunCandidatesShortlisted.set(shortlisted);
    }
}
