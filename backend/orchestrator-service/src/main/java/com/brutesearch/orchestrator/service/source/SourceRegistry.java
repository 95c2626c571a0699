package com.brutesearch.orchestrator.service.source;

import com.brutesearch.orchestrator.service.resilience.HealthRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up {@link Source} beans by code and registers each one for health tracking.
 */
@Component
@Slf4j
public class SourceRegistry {

    private final Map<String, Source> sources;

    public SourceRegistry(ObjectProvider<Source> sourceBeans, HealthRegistry healthRegistry) {
        Map<String, Source> byCode = new LinkedHashMap<>();
        sourceBeans.orderedStream().forEach(source -> {
            Source previous = byCode.putIfAbsent(source.getCode(), source);
            if (previous != null) {
                log.warn("Duplicate source code '{}': keeping {}, ignoring {}",
                        source.getCode(), previous.getClass().getSimpleName(), source.getClass().getSimpleName());
                return;
            }
            healthRegistry.register(source.getCode(), source.getName());
        });
        this.sources = Collections.unmodifiableMap(byCode);
        log.info("Registered {} search sources: {}", sources.size(), sources.keySet());
    }

    public Optional<Source> find(String code) {
        return Optional.ofNullable(sources.get(code));
    }

    public List<Source> all() {
        return List.copyOf(sources.values());
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }
}
