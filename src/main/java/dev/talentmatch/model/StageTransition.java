package dev.talentmatch.model;

/**
 * A requested stage change. {@code changedBy} may be null for automated
 * transitions.
 */
public record StageTransition(
        PipelineStage toStage,
        String changedBy,
        boolean automated,
        String notes) {

    public static StageTransition manual(PipelineStage toStage, String changedBy, String notes) {
        return new StageTransition(toStage, changedBy, false, notes);
    }

    public static StageTransition automated(PipelineStage toStage, String notes) {
        return new StageTransition(toStage, null, true, notes);
    }

    public static StageTransition automated(PipelineStage toStage, String changedBy, String notes) {
        return new StageTransition(toStage, changedBy, true, notes);
    }
}
