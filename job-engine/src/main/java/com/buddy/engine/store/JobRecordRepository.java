package com.buddy.engine.store;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

/**
 * CRUD + retention queries for the job_records table.
 */
public interface JobRecordRepository extends JpaRepository<JobRecordEntity, String> {

    /** Newest archived jobs first, limited by the page size. */
    List<JobRecordEntity> findAllByOrderByStartedAtDesc(Pageable page);

    /** Ids of every archived job, newest first; pruning drops everything past the retention limit. */
    @Query("SELECT r.id FROM JobRecordEntity r ORDER BY r.startedAt DESC")
    List<String> findIdsNewestFirst();
}
