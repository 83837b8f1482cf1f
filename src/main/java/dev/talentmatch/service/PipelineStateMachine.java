package dev.talentmatch.service;

import dev.talentmatch.exception.ConflictException;
import dev.talentmatch.exception.ValidationException;
import dev.talentmatch.model.Application;
import dev.talentmatch.model.PipelineStage;
import dev.talentmatch.model.StageHistoryEntry;
import dev.talentmatch.model.StageTransition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Legal stage changes of an {@link Application}.
 *
 * <p>Manual transitions move one step along the happy path or to
 * {@link PipelineStage#REJECTED}. Automated transitions may jump anywhere.
 * Nothing leaves a terminal stage.
 */
@Component
@RequiredArgsConstructor
public class PipelineStateMachine {

    static final String CREATED_NOTE = "Application created";

    private final Clock clock;
    private final IdGenerator idGenerator;

    /**
     * Whether a move from {@code from} to {@code to} is allowed.
     */
    public boolean canTransition(PipelineStage from, PipelineStage to, boolean automated) {
        if (from == null || to == null || from.isTerminal()) {
            return false;
        }
        if (automated) {
            return true;
        }
        return to == PipelineStage.REJECTED || to == from.next();
    }

    /**
     * A fresh application in {@link PipelineStage#APPLIED} with its creation
     * entry as the first history record.
     */
    public Application initial(String candidateId, String companyJobVariantId, String createdBy) {
        String applicationId = idGenerator.generateId().toString();
        Instant now = clock.instant();
        StageHistoryEntry created = new StageHistoryEntry(
                idGenerator.generateId().toString(), applicationId, null, PipelineStage.APPLIED,
                createdBy, true, now, CREATED_NOTE);

        return Application.builder()
                .id(applicationId)
                .candidateId(candidateId)
                .companyJobVariantId(companyJobVariantId)
                .status(PipelineStage.APPLIED)
                .stageHistory(List.of(created))
                .version(0)
                .appliedAt(now)
                .lastUpdated(now)
                .build();
    }

    /**
     * The application after the transition, with the history entry appended
     * and the version bumped. The input is left untouched.
     *
     * @throws ConflictException   if the application is already hired or rejected
     * @throws ValidationException if the move is not allowed
     */
    public Application apply(Application application, StageTransition transition) {
        PipelineStage from = application.getStatus();
        PipelineStage to = transition.toStage();

        if (to == null) {
            throw new ValidationException("Target stage is required", ValidationException.INVALID_STAGE_TRANSITION);
        }
        if (from.isTerminal()) {
            throw ConflictException.finalized(application.getId());
        }
        if (!canTransition(from, to, transition.automated())) {
            throw new ValidationException("Cannot move application " + application.getId()
                    + " from " + from + " to " + to, ValidationException.INVALID_STAGE_TRANSITION);
        }

        Instant now = clock.instant();
        StageHistoryEntry entry = new StageHistoryEntry(
                idGenerator.generateId().toString(), application.getId(), from, to,
                transition.changedBy(), transition.automated(), now, transition.notes());

        List<StageHistoryEntry> history = new ArrayList<>(application.getStageHistory());
        history.add(entry);

        return application.toBuilder()
                .status(to)
                .stageHistory(List.copyOf(history))
                .version(application.getVersion() + 1)
                .lastUpdated(now)
                .build();
    }
}
