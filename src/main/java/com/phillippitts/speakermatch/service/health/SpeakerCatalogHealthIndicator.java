package com.phillippitts.speakermatch.service.health;

import com.phillippitts.speakermatch.service.catalog.SpeakerCatalog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the speaker catalog.
 *
 * <p>UP when the catalog loaded with at least one speaker, DOWN otherwise.
 * Exposed via /actuator/health.
 */
@Component
public class SpeakerCatalogHealthIndicator implements HealthIndicator {

    private final SpeakerCatalog catalog;

    public SpeakerCatalogHealthIndicator(SpeakerCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Health health() {
        if (!catalog.isLoaded()) {
            return Health.down().withDetail("status", "Catalog failed to load").build();
        }
        int size = catalog.size();
        if (size == 0) {
            return Health.down()
                    .withDetail("status", "Catalog is empty")
                    .withDetail("speakers", 0)
                    .build();
        }
        return Health.up().withDetail("speakers", size).build();
    }
}
