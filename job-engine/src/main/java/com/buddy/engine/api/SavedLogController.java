package com.buddy.engine.api;

import com.buddy.engine.api.dto.SaveLogRequest;
import com.buddy.engine.api.dto.SavedLogResponse;
import com.buddy.engine.logs.SavedLogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Saved log snapshots.
 *
 * GET    /api/logs/{target}     saved logs for a target, newest first
 * POST   /api/logs              save {target, name, content}
 * GET    /api/logs/view/{id}    one saved log with its content
 * DELETE /api/logs/{id}
 */
@RestController
@RequestMapping("/api/logs")
public class SavedLogController {

    private final SavedLogService logs;

    public SavedLogController(SavedLogService logs) {
        this.logs = logs;
    }

    @GetMapping("/{target}")
    public List<SavedLogResponse> list(@PathVariable String target) {
        return logs.list(target).stream().map(SavedLogResponse::summary).toList();
    }

    @PostMapping
    public ResponseEntity<SavedLogResponse> save(@RequestBody SaveLogRequest req) {
        var saved = logs.save(req.target(), req.name(), req.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(SavedLogResponse.summary(saved));
    }

    @GetMapping("/view/{id}")
    public SavedLogResponse view(@PathVariable String id) {
        return SavedLogResponse.full(logs.get(id));
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable String id) {
        logs.delete(id);
        return Map.of("success", true);
    }
}
