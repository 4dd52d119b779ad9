package com.learnflow.learnflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * Rate-limited search API key shared by content generators. Quota is tracked
 * externally; the content job only ever reads this table.
 */
@Entity
@Table(name = "api_credentials")
@Data
public class ApiCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "api_key", nullable = false, unique = true)
    private String apiKey;

    @Column(name = "remaining_quota", nullable = false)
    private int remainingQuota;

    @Column(name = "plan_limit")
    private int planLimit;

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();
}
