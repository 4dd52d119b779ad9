package com.learnflow.learnflow_backend.executor.agent;

/**
 * Opaque AI collaborator with a fixed input/output contract.
 * Any exception means the calling stage or unit failed.
 */
public interface Agent<I, O> {

    String name();

    O execute(I input);
}
