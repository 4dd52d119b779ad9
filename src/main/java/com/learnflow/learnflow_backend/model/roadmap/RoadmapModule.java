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
public class RoadmapModule {

    private String moduleId;
    private String name;

    @Builder.Default
    private List<Concept> concepts = new ArrayList<>();
}
