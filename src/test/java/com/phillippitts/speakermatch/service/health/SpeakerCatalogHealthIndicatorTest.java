package com.phillippitts.speakermatch.service.health;

import com.phillippitts.speakermatch.service.catalog.SpeakerCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpeakerCatalogHealthIndicatorTest {

    @Test
    void upWhenCatalogHasSpeakers() {
        SpeakerCatalog catalog = mock(SpeakerCatalog.class);
        when(catalog.isLoaded()).thenReturn(true);
        when(catalog.size()).thenReturn(42);

        Health health = new SpeakerCatalogHealthIndicator(catalog).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("speakers", 42);
    }

    @Test
    void downWhenCatalogFailedToLoad() {
        SpeakerCatalog catalog = mock(SpeakerCatalog.class);
        when(catalog.isLoaded()).thenReturn(false);

        Health health = new SpeakerCatalogHealthIndicator(catalog).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Catalog failed to load");
    }

    @Test
    void downWhenCatalogIsEmpty() {
        SpeakerCatalog catalog = mock(SpeakerCatalog.class);
        when(catalog.isLoaded()).thenReturn(true);
        when(catalog.size()).thenReturn(0);

        assertThat(new SpeakerCatalogHealthIndicator(catalog).health().getStatus()).isEqualTo(Status.DOWN);
    }
}
