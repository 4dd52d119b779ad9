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
public class ValidationResult {

    private boolean valid;
    private Double overallScore;

    @Builder.Default
    private List<ValidationIssue> issues = new ArrayList<>();

    public static ValidationResult passed() {
        return ValidationResult.builder().valid(true).overallScore(1.0).build();
    }

    public static ValidationResult failed(ValidationIssue... issues) {
        return ValidationResult.builder().valid(false).overallScore(0.0).issues(new ArrayList<>(List.of(issues))).build();
    }
}
