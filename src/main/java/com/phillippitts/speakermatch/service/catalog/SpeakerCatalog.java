package com.phillippitts.speakermatch.service.catalog;

import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.exception.UpstreamUnavailableException;

import java.util.List;

/**
 * Read-only source of speakers to score.
 */
public interface SpeakerCatalog {

    /**
     * @return immutable speaker list in catalog order
     * @throws UpstreamUnavailableException if the catalog failed to load or is empty
     */
    List<SpeakerRecord> getSpeakers();

    /**
     * @return true if the catalog loaded successfully (possibly with zero entries)
     */
    boolean isLoaded();

    /**
     * @return number of loaded speakers, 0 when not loaded
     */
    int size();
}
