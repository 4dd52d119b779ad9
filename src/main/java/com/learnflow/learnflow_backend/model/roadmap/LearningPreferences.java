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
public class LearningPreferences {

    private String learningGoal;
    private String currentLevel;

    @Builder.Default
    private int availableHoursPerWeek = 10;

    @Builder.Default
    private List<String> learningStyle = new ArrayList<>();

    @Builder.Default
    private String preferredLanguage = "en";
}
