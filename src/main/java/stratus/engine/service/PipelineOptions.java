package stratus.engine.service;

/**
 * Per-run switches for the operation pipeline.
 *
 * @param force    bypass the idempotency probe and prerequisite gate
 * @param resume   consult the checkpoint first and skip if already completed
 * @param parentId workflow execution id when run as a step, otherwise null
 */
public record PipelineOptions(boolean force, boolean resume, String parentId) {

    public static PipelineOptions defaults() {
        return new PipelineOptions(false, false, null);
    }

    public PipelineOptions withParent(String parentId) {
        return new PipelineOptions(force, resume, parentId);
    }
}
