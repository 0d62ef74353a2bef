package com.phaseflow.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A key/value row of the queue_config table.
 *
 * Only one key exists today ({@link #PAUSED_KEY}). The row is versioned so
 * concurrent writers to the pause flag fail instead of overwriting each other.
 *
 * DB table: queue_config  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "queue_config")
public class QueueConfigEntry {

    public static final String PAUSED_KEY = "queue_paused";

    @Id
    @Column(name = "config_key")
    private String configKey;

    @Column(name = "config_value", nullable = false)
    private String configValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Version
    private Long version;

    @PrePersist
    @PreUpdate
    void onWrite() {
        this.updatedAt = Instant.now();
    }

    protected QueueConfigEntry() {}   // required by JPA

    public QueueConfigEntry(String configKey, String configValue) {
        this.configKey   = configKey;
        this.configValue = configValue;
    }

    public String  getConfigKey()   { return configKey; }
    public String  getConfigValue() { return configValue; }
    public Instant getUpdatedAt()   { return updatedAt; }
    public Long    getVersion()     { return version; }

    public void setConfigValue(String configValue) { this.configValue = configValue; }
}
