package com.learnflow.learnflow_backend.config;

import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Keeps the workflow_runs status check constraint in line with {@link RunStatus}.
 * Needed when a status is added after the table was created.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunStatusConstraintMigration {

    private final JdbcTemplate jdbcTemplate;

    @PostConstruct
    public void updateStatusConstraint() {
        try {
            String allowed = String.join("', '", Arrays.stream(RunStatus.values()).map(Enum::name).toList());
            jdbcTemplate.execute("ALTER TABLE workflow_runs DROP CONSTRAINT IF EXISTS workflow_runs_status_check");
            jdbcTemplate.execute("ALTER TABLE workflow_runs ADD CONSTRAINT workflow_runs_status_check CHECK (status IN ('" + allowed + "'))");
            log.debug("Updated workflow_runs_status_check to allow all RunStatus values");
        } catch (Exception e) {
            log.warn("Could not update workflow_runs_status_check: {}", e.getMessage());
        }
    }
}
