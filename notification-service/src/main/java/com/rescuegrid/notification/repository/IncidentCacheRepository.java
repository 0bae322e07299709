package com.rescuegrid.notification.repository;

import com.rescuegrid.notification.entity.IncidentCache;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface IncidentCacheRepository extends JpaRepository<IncidentCache, UUID> {
}
