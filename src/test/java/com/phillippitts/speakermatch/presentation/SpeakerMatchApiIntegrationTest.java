package com.phillippitts.speakermatch.presentation;

import com.phillippitts.speakermatch.exception.ProviderException;
import com.phillippitts.speakermatch.service.scoring.ScoringClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end request handling against the fixture catalog with a mocked provider.
 */
@SpringBootTest(properties = {
        "scoring.openai.api-key=test-key",
        "catalog.location=classpath:speakers-fixture.json"
})
@AutoConfigureMockMvc
class SpeakerMatchApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScoringClient scoringClient;

    @BeforeEach
    void setUp() {
        when(scoringClient.getProviderName()).thenReturn("mock");
        when(scoringClient.complete(anyString())).thenAnswer(invocation -> {
            String prompt = invocation.getArgument(0);
            if (prompt.contains("Name: Ada\n")) {
                return "{\"score\": 9, \"reasoning\": \"Direct buyer\"}";
            }
            if (prompt.contains("Name: Bo\n")) {
                throw new ProviderException("rate limited", "mock");
            }
            return "```json\n{\"score\": 7, \"reasoning\": \"Adjacent\"}\n```";
        });
    }

    @Test
    void rootReportsStatus() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Speaker Recommendation API"))
                .andExpect(jsonPath("$.speakers_loaded").value(3));
    }

    @Test
    void speakersListsCatalog() throws Exception {
        mockMvc.perform(get("/speakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.speakers[0].name").value("Ada"))
                .andExpect(jsonPath("$.speakers[2].organization").value(""));
    }

    @Test
    void matchRanksAndFiltersWithDefaultThreshold() throws Exception {
        mockMvc.perform(post("/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Request-ID", "req-it-1")
                        .content("{\"user_bio\": \"We sell grid analytics to utilities\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "req-it-1"))
                .andExpect(jsonPath("$.total_speakers").value(3))
                .andExpect(jsonPath("$.matches_found").value(2))
                .andExpect(jsonPath("$.matches[0].name").value("Ada"))
                .andExpect(jsonPath("$.matches[0].score").value(9.0))
                .andExpect(jsonPath("$.matches[1].name").value("Cy"))
                .andExpect(jsonPath("$.matches[1].reasoning").value("Adjacent"));
    }

    @Test
    void matchAtThresholdZeroIncludesFailedSpeakerLast() throws Exception {
        mockMvc.perform(post("/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_bio\": \"We sell grid analytics to utilities\", \"threshold\": 0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matches_found").value(3))
                .andExpect(jsonPath("$.matches[2].name").value("Bo"))
                .andExpect(jsonPath("$.matches[2].score").value(0.0))
                .andExpect(jsonPath("$.matches[2].reasoning").value(startsWith("Error: ")));
    }

    @Test
    void shortBioIsBadRequest() throws Exception {
        mockMvc.perform(post("/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_bio\": \"short\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("User bio must be at least 10 characters"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }
}
