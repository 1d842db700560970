package com.phillippitts.speakermatch.service.scoring.parse;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.speakermatch.exception.ResponseParseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonResponseParserTest {

    @Test
    void parsesBareObject() {
        ObjectNode json = JsonResponseParser.extractJson("{\"score\": 8, \"reasoning\": \"Strong fit\"}");

        assertThat(json.get("score").asInt()).isEqualTo(8);
        assertThat(json.get("reasoning").asText()).isEqualTo("Strong fit");
    }

    @Test
    void parsesJsonFencedBlockInsideProse() {
        String reply = "Here is my evaluation:\n```json\n{\"score\": 7, \"reasoning\": \"Relevant\"}\n```\nHope it helps.";

        ObjectNode json = JsonResponseParser.extractJson(reply);

        assertThat(json.get("score").asInt()).isEqualTo(7);
    }

    @Test
    void jsonFenceTagIsCaseInsensitive() {
        String reply = "```JSON\n{\"score\": 4}\n```";

        assertThat(JsonResponseParser.extractJson(reply).get("score").asInt()).isEqualTo(4);
    }

    @Test
    void jsonFenceAfterCaseExpandingCharactersKeepsWholeObject() {
        // "İ".toLowerCase() is two chars long
        String reply = "İİİ note\n```json\n{\"score\": 8, \"reasoning\": \"ok\"}\n```";

        assertThat(JsonResponseParser.selectCandidate(reply)).isEqualTo("{\"score\": 8, \"reasoning\": \"ok\"}");
        assertThat(JsonResponseParser.extractJson(reply).get("score").asInt()).isEqualTo(8);
    }

    @Test
    void parsesUntaggedFencedBlock() {
        String reply = "```\n{\"score\": 3, \"reasoning\": \"Weak\"}\n```";

        assertThat(JsonResponseParser.extractJson(reply).get("score").asInt()).isEqualTo(3);
    }

    @Test
    void stripsOtherLanguageTagFromFence() {
        String reply = "```javascript\n{\"score\": 2}\n```";

        assertThat(JsonResponseParser.extractJson(reply).get("score").asInt()).isEqualTo(2);
    }

    @Test
    void jsonTaggedFenceWinsOverEarlierPlainFence() {
        String reply = "```\nnot json\n```\n```json\n{\"score\": 9}\n```";

        assertThat(JsonResponseParser.extractJson(reply).get("score").asInt()).isEqualTo(9);
    }

    @Test
    void recoversObjectEmbeddedInUnfencedProse() {
        String reply = "Sure! {\"score\": 6, \"reasoning\": \"Moderate\"} Let me know.";

        assertThat(JsonResponseParser.extractJson(reply).get("score").asInt()).isEqualTo(6);
    }

    @Test
    void recoversObjectFromProseOpeningWithBracket() {
        String reply = "[Assessment] The speaker fits. {\"score\": 8, \"reasoning\": \"ok\"}";

        ObjectNode json = JsonResponseParser.extractJson(reply);

        assertThat(json.get("score").asInt()).isEqualTo(8);
        assertThat(json.get("reasoning").asText()).isEqualTo("ok");
    }

    @Test
    void rejectsArrayWrappingAnObject() {
        assertThatThrownBy(() -> JsonResponseParser.extractJson("[{\"score\": 8}]"))
                .isInstanceOf(ResponseParseException.class)
                .hasMessage("Model reply is not a JSON object");
    }

    @Test
    void toleratesUnterminatedFence() {
        String reply = "```json\n{\"score\": 5}";

        assertThat(JsonResponseParser.extractJson(reply).get("score").asInt()).isEqualTo(5);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> JsonResponseParser.extractJson("{\"score\": 8,"))
                .isInstanceOf(ResponseParseException.class)
                .hasMessageStartingWith("No valid JSON object found in model reply");
    }

    @Test
    void rejectsReplyWithoutJson() {
        assertThatThrownBy(() -> JsonResponseParser.extractJson("I cannot evaluate this speaker."))
                .isInstanceOf(ResponseParseException.class);
    }

    @Test
    void rejectsNonObjectJson() {
        assertThatThrownBy(() -> JsonResponseParser.extractJson("[1, 2, 3]"))
                .isInstanceOf(ResponseParseException.class)
                .hasMessage("Model reply is not a JSON object");
    }

    @Test
    void rejectsBlankReply() {
        assertThatThrownBy(() -> JsonResponseParser.extractJson("  \n "))
                .isInstanceOf(ResponseParseException.class)
                .hasMessage("Empty model reply");
    }

    @Test
    void failureCarriesTruncatedPreview() {
        String reply = "x".repeat(500);

        assertThatThrownBy(() -> JsonResponseParser.extractJson(reply))
                .isInstanceOfSatisfying(ResponseParseException.class,
                        ex -> assertThat(ex.getRawPreview()).hasSize(203).endsWith("..."));
    }

    @Test
    void selectCandidateReturnsWholeTextWithoutFences() {
        assertThat(JsonResponseParser.selectCandidate("  {\"a\":1}  ")).isEqualTo("{\"a\":1}");
    }
}
