package com.invitehunter.hunt.source;

import com.invitehunter.hunt.state.HunterStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed, ordered set of sources polled by every cycle. Registration order is
 * polling order.
 */
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final List<SourceDescriptor> sources;

    public SourceRegistry(List<SourceDescriptor> sources, HunterStateStore stateStore) {
        Set<String> names = new HashSet<>();
        for (SourceDescriptor source : sources) {
            if (!names.add(source.name())) {
                throw new IllegalArgumentException("duplicate source name: " + source.name());
            }
        }
        this.sources = List.copyOf(sources);
        for (SourceDescriptor source : this.sources) {
            stateStore.registerSource(source.name(), source.enabled());
        }
        log.info(
            "Registered {} sources ({} enabled)",
            this.sources.size(),
            this.sources.stream().filter(SourceDescriptor::enabled).count()
        );
    }

    public List<SourceDescriptor> getAll() {
        return sources;
    }

    public List<SourceDescriptor> getEnabled() {
        return sources.stream().filter(SourceDescriptor::enabled).toList();
    }

    public Optional<SourceDescriptor> find(String name) {
        return sources.stream().filter(source -> source.name().equals(name)).findFirst();
    }
}
