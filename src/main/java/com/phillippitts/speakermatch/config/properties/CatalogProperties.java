package com.phillippitts.speakermatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the speaker catalog JSON.
 *
 * <p>Accepts any Spring resource location ({@code file:}, {@code classpath:}).
 */
@Validated
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    @NotBlank
    private String location = "file:data/speakers.json";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
