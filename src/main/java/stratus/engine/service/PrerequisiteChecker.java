package stratus.engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stratus.engine.error.PrerequisiteNotMetException;
import stratus.engine.model.Checkpoint;
import stratus.engine.model.OperationStatus;
import stratus.engine.monitor.CheckpointStore;
import stratus.engine.operation.OperationDefinition;
import stratus.engine.operation.Prerequisite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Gates an operation on the checkpointed status of the operations it requires.
 */
public class PrerequisiteChecker {

    private static final Logger log = LoggerFactory.getLogger(PrerequisiteChecker.class);

    private final CheckpointStore checkpoints;

    public PrerequisiteChecker(CheckpointStore checkpoints) {
        this.checkpoints = checkpoints;
    }

    /**
     * @return optional prerequisites that were not met (already logged as warnings)
     * @throws PrerequisiteNotMetException on the first unmet required prerequisite
     */
    public List<Prerequisite> check(OperationDefinition definition) {
        List<Prerequisite> unmetOptional = new ArrayList<>();
        for (Prerequisite prerequisite : definition.requires()) {
            Optional<OperationStatus> actual = checkpoints.find(prerequisite.operation()).map(Checkpoint::status);
            if (actual.isPresent() && actual.get() == prerequisite.status()) {
                continue;
            }
            String actualLabel = actual.map(OperationStatus::label).orElse("not run");
            if (prerequisite.optional()) {
                log.warn("{}: optional prerequisite {} is {} (wanted {}), continuing",
                        definition.id(), prerequisite.operation(), actualLabel, prerequisite.status().label());
                unmetOptional.add(prerequisite);
            } else {
                throw new PrerequisiteNotMetException(definition.id(), prerequisite.operation(),
                        prerequisite.status().label(), actualLabel);
            }
        }
        return unmetOptional;
    }
}
