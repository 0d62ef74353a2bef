package com.phaseflow.coordinator.repository;

import com.phaseflow.coordinator.model.QueueConfigEntry;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD for the queue_config table. Spring Data generates the implementation.
 */
public interface QueueConfigRepository extends JpaRepository<QueueConfigEntry, String> {
}
