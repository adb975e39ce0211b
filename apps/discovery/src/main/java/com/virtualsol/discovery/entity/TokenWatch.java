package com.virtualsol.discovery.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * A user's interest in lifecycle events of one token. Rows are written by the API process.
 */
@Data
@Entity
@Table(name = "token_watch", uniqueConstraints = {
        @UniqueConstraint(name = "idx_token_watch_user_mint", columnNames = {"user_id", "mint"})
})
public class TokenWatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false, length = 64)
    private String mint;

    @Column(name = "notify_on_graduation", nullable = false)
    private boolean notifyOnGraduation;

    @Column(name = "notify_on_migration", nullable = false)
    private boolean notifyOnMigration;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
