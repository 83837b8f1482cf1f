package dev.talentmatch.service;

import dev.talentmatch.model.Application;
import dev.talentmatch.model.PipelineStage;
import dev.talentmatch.model.StageHistoryEntry;
import dev.talentmatch.repository.ApplicationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Read-only queries over application stage histories.
 */
@Service
@RequiredArgsConstructor
public class StageHistoryService {

    private final ApplicationService applicationService;
    private final ApplicationRepository applicationRepository;

    /**
     * Transition counts of one application. The creation entry is counted as
     * an automated transition.
     */
    public record TransitionStats(long total, long automated, long manual) {
    }

    /**
     * History of one application, oldest first.
     */
    public List<StageHistoryEntry> timeline(String applicationId) {
        return applicationService.findById(applicationId).getStageHistory().stream()
                .sorted(Comparator.comparing(StageHistoryEntry::changedAt))
                .toList();
    }

    /**
     * Entries across all applications that moved into {@code stage}, newest first.
     */
    public List<StageHistoryEntry> entriesByStage(PipelineStage stage) {
        return applicationRepository.findAll().stream()
                .map(Application::getStageHistory)
                .flatMap(List::stream)
                .filter(e -> e.toStage() == stage)
                .sorted(Comparator.comparing(StageHistoryEntry::changedAt).reversed())
                .toList();
    }

    public List<StageHistoryEntry> automatedEntries(String applicationId) {
        return timeline(applicationId).stream().filter(StageHistoryEntry::automated).toList();
    }

    public List<StageHistoryEntry> manualEntries(String applicationId) {
        return timeline(applicationId).stream().filter(e -> !e.automated()).toList();
    }

    public TransitionStats stats(String applicationId) {
        List<StageHistoryEntry> history = timeline(applicationId);
        long automated = history.stream().filter(StageHistoryEntry::automated).count();
        return new TransitionStats(history.size(), automated, history.size() - automated);
    }
}
