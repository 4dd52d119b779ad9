package com.learnflow.learnflow_backend.model.roadmap;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Curriculum tree: stages -> modules -> concepts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoadmapFramework {

    private String roadmapId;
    private String title;

    @Builder.Default
    private List<RoadmapStage> stages = new ArrayList<>();

    /** Concepts in curriculum order. */
    public List<Concept> allConcepts() {
        List<Concept> concepts = new ArrayList<>();
        for (RoadmapStage stage : stages) {
            for (RoadmapModule module : stage.getModules()) {
                concepts.addAll(module.getConcepts());
            }
        }
        return concepts;
    }

    public Optional<Concept> findConcept(String conceptId) {
        return allConcepts().stream()
                .filter(c -> c.getConceptId().equals(conceptId))
                .findFirst();
    }

    public boolean containsConcept(String conceptId) {
        return findConcept(conceptId).isPresent();
    }
}
