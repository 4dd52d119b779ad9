package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.model.domain.WorkflowCheckpoint;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.CheckpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class JpaCheckpointStore implements CheckpointStore {

    private final CheckpointRepository repository;
    private final StateCodec codec;

    public JpaCheckpointStore(CheckpointRepository repository, StateCodec codec) {
        this.repository = repository;
        this.codec = codec;
    }

    @Override
    @Transactional
    public Checkpoint append(String runId, WorkflowStage stage, WorkflowState state) {
        Optional<WorkflowCheckpoint> head = repository.findFirstByRunIdOrderBySequenceIdDesc(runId);
        long sequence = head.map(h -> h.getSequenceId() + 1).orElse(0L);
        Long parent = head.map(WorkflowCheckpoint::getSequenceId).orElse(null);

        // Unique (run_id, sequence_id) turns a concurrent writer into a constraint violation
        WorkflowCheckpoint saved = repository.save(
                new WorkflowCheckpoint(runId, sequence, parent, stage.wireName(), codec.encode(state)));
        log.debug("[CHECKPOINT] runId={} seq={} stage={}", runId, sequence, stage.wireName());
        return toCheckpoint(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Checkpoint> latest(String runId) {
        return repository.findFirstByRunIdOrderBySequenceIdDesc(runId).map(this::toCheckpoint);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Checkpoint> history(String runId) {
        return repository.findByRunIdOrderBySequenceIdAsc(runId).stream()
                .map(this::toCheckpoint)
                .toList();
    }

    private Checkpoint toCheckpoint(WorkflowCheckpoint row) {
        return new Checkpoint(
                row.getRunId(),
                row.getSequenceId(),
                row.getParentSequenceId(),
                WorkflowStage.fromWireName(row.getStage()),
                codec.decode(row.getSerializedState()),
                row.getCreatedAt());
    }
}
