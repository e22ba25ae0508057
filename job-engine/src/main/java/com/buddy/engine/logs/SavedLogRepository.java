package com.buddy.engine.logs;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SavedLogRepository extends JpaRepository<SavedLogEntity, String> {

    List<SavedLogEntity> findByTargetOrderByCreatedAtDesc(String target);
}
