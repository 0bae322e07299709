package com.rescuegrid.dispatch.repository;

import com.rescuegrid.dispatch.entity.IncidentProjection;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/** 사건 projection. IncidentEventHandler만 쓰기를 한다 */
public interface IncidentProjectionRepository extends JpaRepository<IncidentProjection, UUID> {
}
