package com.phillippitts.speakermatch.service.scoring.openai;

import com.phillippitts.speakermatch.service.scoring.AbstractScoringClient;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.List;
import java.util.Objects;

/**
 * Scoring client for OpenAI chat models.
 *
 * <p>Call shape: a fixed system message asking for JSON output, followed by the scoring prompt
 * as the user message.
 */
public class OpenAiScoringClient extends AbstractScoringClient {

    public static final String PROVIDER_NAME = "openai";

    static final String SYSTEM_PROMPT =
            "You are a strategic business advisor. Always respond with valid JSON.";

    private final ChatModel chatModel;

    /**
     * @param chatModel configured OpenAI chat model (model id, temperature, token limit, no retries)
     */
    public OpenAiScoringClient(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    protected String doComplete(String prompt) {
        ChatResponse response = chatModel.chat(List.of(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from(prompt)
        ));
        AiMessage message = response == null ? null : response.aiMessage();
        return message == null ? null : message.text();
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }
}
