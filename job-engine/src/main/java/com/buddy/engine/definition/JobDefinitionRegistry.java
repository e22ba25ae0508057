package com.buddy.engine.definition;

import com.buddy.engine.error.UnknownJobTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalogue of the job types this engine can run, keyed by type name.
 */
public class JobDefinitionRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobDefinitionRegistry.class);

    private final Map<String, JobDefinition> definitions = new ConcurrentHashMap<>();

    public JobDefinitionRegistry(Collection<JobDefinition> all) {
        for (JobDefinition def : all) {
            if (definitions.putIfAbsent(def.type(), def) != null) {
                throw new IllegalArgumentException("Duplicate job type '" + def.type() + "'");
            }
            log.info("Registered job type '{}' ({} phase(s){})", def.type(), def.phases().size(),
                    def.requiresApproval() ? ", approval" : "");
        }
    }

    /**
     * @throws UnknownJobTypeException if no such type is configured
     */
    public JobDefinition get(String type) {
        JobDefinition def = type == null ? null : definitions.get(type);
        if (def == null) {
            throw new UnknownJobTypeException(type);
        }
        return def;
    }

    /** All job types, sorted by name. */
    public List<JobDefinition> all() {
        return definitions.values().stream()
                .sorted(Comparator.comparing(JobDefinition::type))
                .toList();
    }
}
