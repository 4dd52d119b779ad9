package com.learnflow.learnflow_backend.support;

import com.learnflow.learnflow_backend.model.roadmap.Concept;
import com.learnflow.learnflow_backend.model.roadmap.LearningPreferences;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapModule;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapStage;
import com.learnflow.learnflow_backend.model.roadmap.UserRequest;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    public static final String ROADMAP_ID = "rust-systems-1a2b3c4d";

    private Fixtures() {
    }

    public static UserRequest request(String goal) {
        return UserRequest.builder()
                .userId("user-1")
                .sessionId("session-1")
                .preferences(LearningPreferences.builder()
                        .learningGoal(goal)
                        .currentLevel("beginner")
                        .build())
                .build();
    }

    /** One stage, one module, concepts {@code roadmapId:c1 .. roadmapId:cN}. */
    public static RoadmapFramework framework(String roadmapId, int concepts) {
        List<Concept> list = new ArrayList<>();
        for (int i = 1; i <= concepts; i++) {
            list.add(Concept.builder()
                    .conceptId(conceptId(roadmapId, i))
                    .name("Concept " + i)
                    .description("About concept " + i)
                    .estimatedHours(2.0)
                    .build());
        }
        RoadmapModule module = RoadmapModule.builder().moduleId("m1").name("Basics").concepts(list).build();
        RoadmapStage stage = RoadmapStage.builder().stageId("s1").name("Foundations").order(1)
                .modules(new ArrayList<>(List.of(module))).build();
        return RoadmapFramework.builder()
                .roadmapId(roadmapId)
                .title("Rust systems programming")
                .stages(new ArrayList<>(List.of(stage)))
                .build();
    }

    public static String conceptId(String roadmapId, int index) {
        return roadmapId + ":c" + index;
    }

    public static WorkflowState state(String runId, WorkflowConfig config) {
        return WorkflowState.initial(runId, "trace-" + runId, request("Learn Rust for systems programming"), config);
    }
}
