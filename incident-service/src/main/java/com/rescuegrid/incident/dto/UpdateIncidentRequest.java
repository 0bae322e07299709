package com.rescuegrid.incident.dto;

import com.rescuegrid.incident.entity.IncidentStatus;
import com.rescuegrid.incident.entity.IncidentType;
import com.rescuegrid.incident.entity.Severity;

/** 사건 부분 수정 명령. null/공백 필드는 변경하지 않는다 */
public record UpdateIncidentRequest(
        String title,
        String description,
        IncidentType type,
        Severity severity,
        IncidentStatus status,
        Double latitude,
        Double longitude,
        String resolutionNotes
) {
}
