package com.buddy.engine.logs;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A named piece of log text a user chose to keep for a target.
 *
 * DB table: saved_logs  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "saved_logs")
public class SavedLogEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String target;

    @Column(nullable = false)
    private String name;

    @Lob
    @Column(nullable = false)
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected SavedLogEntity() {}   // required by JPA

    public SavedLogEntity(String target, String name, String content) {
        this.id        = UUID.randomUUID().toString();
        this.target    = target;
        this.name      = name;
        this.content   = content;
        this.createdAt = Instant.now();
    }

    public String  getId()        { return id; }
    public String  getTarget()    { return target; }
    public String  getName()      { return name; }
    public String  getContent()   { return content; }
    public Instant getCreatedAt() { return createdAt; }
}
