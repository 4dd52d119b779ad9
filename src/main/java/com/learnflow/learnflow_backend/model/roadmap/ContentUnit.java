package com.learnflow.learnflow_backend.model.roadmap;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One (concept, content type) generation task. Owned by the job that created it;
 * status moves pending -> generating -> completed | failed and never back.
 */
@Data
@NoArgsConstructor
public class ContentUnit {

    private String conceptId;
    private ContentType contentType;
    private ContentUnitStatus status = ContentUnitStatus.PENDING;
    private String resultRef;
    private String content;
    private String error;

    public ContentUnit(String conceptId, ContentType contentType) {
        this.conceptId = conceptId;
        this.contentType = contentType;
    }

    public UnitKey key() {
        return new UnitKey(conceptId, contentType);
    }

    public synchronized void markGenerating() {
        if (status != ContentUnitStatus.PENDING) {
            throw new IllegalStateException("Unit " + key() + " cannot start from " + status);
        }
        status = ContentUnitStatus.GENERATING;
    }

    /** Returns false when the unit already finished; the first outcome wins. */
    public synchronized boolean markCompleted(String ref, String body) {
        if (finished()) {
            return false;
        }
        status = ContentUnitStatus.COMPLETED;
        resultRef = ref;
        content = body;
        error = null;
        return true;
    }

    /** Returns false when the unit already finished; the first outcome wins. */
    public synchronized boolean markFailed(String reason) {
        if (finished()) {
            return false;
        }
        status = ContentUnitStatus.FAILED;
        error = reason;
        return true;
    }

    /** Generated but never stored: the one move out of completed. */
    public synchronized void markUnsaved(String reason) {
        if (status == ContentUnitStatus.COMPLETED) {
            status = ContentUnitStatus.FAILED;
            resultRef = null;
            error = reason;
        }
    }

    public synchronized boolean finished() {
        return status == ContentUnitStatus.COMPLETED || status == ContentUnitStatus.FAILED;
    }
}
