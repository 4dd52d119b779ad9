package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.model.roadmap.ContentGenerationRequest;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;

public interface ContentGenerator {

    ContentType supportedType();

    // Returns the generated content body; any exception fails this unit only
    String generate(ContentGenerationRequest request);
}
