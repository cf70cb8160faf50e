package com.nevis.chunking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Switches that keep chunks away from the completion provider, plus the optional structural actions.
 */
@ConfigurationProperties(prefix = "app.features")
public record FeatureProperties(
    @DefaultValue("true") boolean routingEnabled,
    @DefaultValue("true") boolean refinementEnabled,
    @DefaultValue("false") boolean applyStructuralActions,
    Set<String> blacklistDomains
) {
    public FeatureProperties {
        blacklistDomains = blacklistDomains == null
            ? Set.of()
            : blacklistDomains.stream().map(d -> d.trim().toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
    }

    public boolean isBlacklisted(String domain) {
        return domain != null && blacklistDomains.contains(domain.trim().toLowerCase(Locale.ROOT));
    }
}
