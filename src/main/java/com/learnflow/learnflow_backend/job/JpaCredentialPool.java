package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.repository.ApiCredentialRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaCredentialPool implements CredentialPool {

    private final ApiCredentialRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<KeyLease> listKeys(int minQuota) {
        return repository.findByRemainingQuotaGreaterThanEqualOrderByRemainingQuotaDesc(minQuota).stream()
                .map(c -> new KeyLease(c.getApiKey(), c.getRemainingQuota()))
                .toList();
    }
}
