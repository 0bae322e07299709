package com.rescuegrid.incident.dto;

import com.rescuegrid.incident.entity.IncidentType;
import com.rescuegrid.incident.entity.Severity;

import java.util.UUID;

/**
 * 사건 접수 명령.
 *
 * @param type     null이면 OTHER
 * @param severity null이면 MEDIUM
 */
public record CreateIncidentRequest(
        String title,
        String description,
        IncidentType type,
        Severity severity,
        Double latitude,
        Double longitude,
        String reporterName,
        String reporterContact,
        UUID createdByUserId
) {
}
