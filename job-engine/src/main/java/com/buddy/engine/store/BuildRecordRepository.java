package com.buddy.engine.store;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BuildRecordRepository extends JpaRepository<BuildRecordEntity, String> {

    List<BuildRecordEntity> findAllByOrderByTargetAsc();
}
