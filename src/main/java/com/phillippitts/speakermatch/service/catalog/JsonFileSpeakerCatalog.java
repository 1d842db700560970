package com.phillippitts.speakermatch.service.catalog;

import com.phillippitts.speakermatch.config.properties.CatalogProperties;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.exception.UpstreamUnavailableException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Speaker catalog loaded once at startup from a JSON array of
 * {@code {name, title, organization, bio}} objects.
 *
 * <p>A missing or malformed file does not stop the application: the failure is logged, health
 * reports DOWN and {@link #getSpeakers()} throws {@link UpstreamUnavailableException}. Entries that
 * are not JSON objects are skipped with a warning; missing fields read as empty strings.
 */
@Component
public class JsonFileSpeakerCatalog implements SpeakerCatalog {

    private static final Logger LOG = LogManager.getLogger(JsonFileSpeakerCatalog.class);

    private final Resource resource;

    private volatile List<SpeakerRecord> speakers = List.of();
    private volatile String loadFailure = "catalog not loaded yet";

    @Autowired
    public JsonFileSpeakerCatalog(ResourceLoader resourceLoader, CatalogProperties properties) {
        this(resourceLoader.getResource(properties.getLocation()));
    }

    public JsonFileSpeakerCatalog(Resource resource) {
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    @PostConstruct
    public void load() {
        try (InputStream in = resource.getInputStream()) {
            String json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            List<SpeakerRecord> loaded = parse(json);
            this.speakers = List.copyOf(loaded);
            this.loadFailure = null;
            LOG.info("Loaded {} speakers from {}", loaded.size(), resource.getDescription());
        } catch (IOException e) {
            this.speakers = List.of();
            this.loadFailure = "cannot read " + resource.getDescription() + ": " + e.getMessage();
            LOG.error("Speaker catalog unavailable: {}", loadFailure);
        } catch (JSONException e) {
            this.speakers = List.of();
            this.loadFailure = "malformed catalog " + resource.getDescription() + ": " + e.getMessage();
            LOG.error("Speaker catalog unavailable: {}", loadFailure);
        }
    }

    static List<SpeakerRecord> parse(String json) {
        JSONArray array = new JSONArray(json);
        List<SpeakerRecord> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject obj = array.optJSONObject(i);
            if (obj == null) {
                LOG.warn("Skipping catalog entry {}: not a JSON object", i);
                continue;
            }
            out.add(new SpeakerRecord(
                    obj.optString("name", ""),
                    obj.optString("title", ""),
                    obj.optString("organization", ""),
                    obj.optString("bio", "")
            ));
        }
        return out;
    }

    @Override
    public List<SpeakerRecord> getSpeakers() {
        String failure = loadFailure;
        if (failure != null) {
            throw new UpstreamUnavailableException("Speaker catalog unavailable: " + failure);
        }
        List<SpeakerRecord> current = speakers;
        if (current.isEmpty()) {
            throw new UpstreamUnavailableException("Speaker catalog is empty");
        }
        return current;
    }

    @Override
    public boolean isLoaded() {
        return loadFailure == null;
    }

    @Override
    public int size() {
        return isLoaded() ? speakers.size() : 0;
    }
}
