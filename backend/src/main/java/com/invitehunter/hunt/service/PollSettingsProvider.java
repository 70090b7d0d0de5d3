package com.invitehunter.hunt.service;

import com.invitehunter.config.HunterProperties;
import com.invitehunter.hunt.model.PollSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Resolves the settings of one poll cycle by re-binding the {@code hunter.*}
 * properties from the environment. Out-of-range values are clamped by
 * {@link HunterProperties}; a binding failure keeps the startup values.
 */
@Service
public class PollSettingsProvider {
    private static final Logger log = LoggerFactory.getLogger(PollSettingsProvider.class);

    private final Environment environment;
    private final HunterProperties startupProperties;

    public PollSettingsProvider(Environment environment, HunterProperties startupProperties) {
        this.environment = environment;
        this.startupProperties = startupProperties;
    }

    public PollSettings current() {
        try {
            HunterProperties fresh = Binder.get(environment)
                .bind("hunter", Bindable.of(HunterProperties.class))
                .orElseGet(HunterProperties::new);
            return PollSettings.from(fresh);
        } catch (RuntimeException e) {
            log.warn("Failed to re-read hunter settings, keeping startup values", e);
            return PollSettings.from(startupProperties);
        }
    }
}
