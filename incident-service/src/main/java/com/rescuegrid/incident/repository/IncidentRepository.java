package com.rescuegrid.incident.repository;

import com.rescuegrid.incident.entity.Incident;
import com.rescuegrid.incident.entity.IncidentStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IncidentRepository extends JpaRepository<Incident, UUID> {

    Optional<Incident> findByIncidentCode(String incidentCode);

    boolean existsByIncidentCode(String incidentCode);

    List<Incident> findAllByOrderByReportedAtDesc();

    List<Incident> findByStatusOrderByReportedAtDesc(IncidentStatus status);
}
