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
public class RoadmapStage {

    private String stageId;
    private String name;
    private int order;

    @Builder.Default
    private List<RoadmapModule> modules = new ArrayList<>();
}
