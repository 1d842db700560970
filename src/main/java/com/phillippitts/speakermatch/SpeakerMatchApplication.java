package com.phillippitts.speakermatch;

import com.phillippitts.speakermatch.config.properties.CatalogProperties;
import com.phillippitts.speakermatch.config.properties.MatchingProperties;
import com.phillippitts.speakermatch.config.properties.ScoringProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        MatchingProperties.class,
        ScoringProviderProperties.class,
        CatalogProperties.class
})
public class SpeakerMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakerMatchApplication.class, args);
    }

}
