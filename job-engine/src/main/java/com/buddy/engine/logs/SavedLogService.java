package com.buddy.engine.logs;

import com.buddy.engine.error.SavedLogNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Saved log snapshots, e.g. a Lambda log tail kept for later comparison.
 */
@Service
public class SavedLogService {

    private static final Logger log = LoggerFactory.getLogger(SavedLogService.class);

    private final SavedLogRepository repository;

    public SavedLogService(SavedLogRepository repository) {
        this.repository = repository;
    }

    /**
     * @throws IllegalArgumentException if target, name or content is blank
     */
    @Transactional
    public SavedLogEntity save(String target, String name, String content) {
        if (isBlank(target) || isBlank(name) || content == null || content.isEmpty()) {
            throw new IllegalArgumentException("target, name and content are required");
        }
        SavedLogEntity saved = repository.save(new SavedLogEntity(target, name, content));
        log.info("Saved log '{}' for {} ({} chars)", name, target, content.length());
        return saved;
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<SavedLogEntity> list(String target) {
        return repository.findByTargetOrderByCreatedAtDesc(target);
    }

    @Transactional(readOnly = true)
    public SavedLogEntity get(String id) {
        return repository.findById(id).orElseThrow(() -> new SavedLogNotFoundException(id));
    }

    @Transactional
    public void delete(String id) {
        if (!repository.existsById(id)) {
            throw new SavedLogNotFoundException(id);
        }
        repository.deleteById(id);
        log.info("Deleted saved log {}", id);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
