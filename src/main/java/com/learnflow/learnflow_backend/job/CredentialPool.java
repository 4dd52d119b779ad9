package com.learnflow.learnflow_backend.job;

import java.util.List;

/**
 * Shared pool of rate-limited search credentials. One call is one bulk read.
 */
public interface CredentialPool {

    List<KeyLease> listKeys(int minQuota);
}
