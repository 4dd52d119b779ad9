package com.learnflow.learnflow_backend.model.roadmap;

import com.learnflow.learnflow_backend.model.workflow.EditSource;

import java.util.List;

/**
 * Input for the roadmap editor agent: the current framework plus whatever
 * prompted the edit (validator issues or reviewer feedback).
 */
public record EditRequest(RoadmapFramework framework,
                          EditSource source,
                          List<ValidationIssue> issues,
                          String reviewerFeedback,
                          LearningPreferences preferences) {
}
