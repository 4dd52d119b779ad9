package com.learnflow.learnflow_backend.repository;

import com.learnflow.learnflow_backend.model.domain.ApiCredential;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ApiCredentialRepository extends JpaRepository<ApiCredential, UUID> {

    // Single bulk read of the usable pool, richest key first
    List<ApiCredential> findByRemainingQuotaGreaterThanEqualOrderByRemainingQuotaDesc(int minQuota);
}
