package com.learnflow.learnflow_backend.model.roadmap;

/**
 * Identity of one content unit: a (concept, content type) pair.
 */
public record UnitKey(String conceptId, ContentType contentType) {

    @Override
    public String toString() {
        return conceptId + "/" + contentType.wireName();
    }
}
