package com.learnflow.learnflow_backend.model.roadmap;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Concept {

    private String conceptId;
    private String name;
    private String description;
    private Double estimatedHours;

    // Status fields folded back by the content job
    private String contentStatus;
    private String tutorialRef;
    private String resourcesStatus;
    private String resourcesRef;
    private String quizStatus;
    private String quizRef;
}
