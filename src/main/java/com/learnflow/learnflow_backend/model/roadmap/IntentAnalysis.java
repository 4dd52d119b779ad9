package com.learnflow.learnflow_backend.model.roadmap;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntentAnalysis {

    private String parsedGoal;
    private String roadmapId;

    @Builder.Default
    private List<String> keyTechnologies = new ArrayList<>();

    private String difficultyProfile;
    private Integer estimatedWeeks;
}
