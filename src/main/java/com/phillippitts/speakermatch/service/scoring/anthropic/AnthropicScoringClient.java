package com.phillippitts.speakermatch.service.scoring.anthropic;

import com.phillippitts.speakermatch.service.scoring.AbstractScoringClient;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import java.util.List;
import java.util.Objects;

/**
 * Scoring client for Anthropic Claude models.
 *
 * <p>Call shape: the scoring prompt as a single user message. Claude tends to wrap JSON in prose
 * or fenced blocks; the response parser handles that.
 */
public class AnthropicScoringClient extends AbstractScoringClient {

    public static final String PROVIDER_NAME = "anthropic";

    private final ChatModel chatModel;

    /**
     * @param chatModel configured Anthropic chat model (model id, temperature, max tokens, no retries)
     */
    public AnthropicScoringClient(ChatModel chatModel) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
    }

    @Override
    protected String doComplete(String prompt) {
        ChatResponse response = chatModel.chat(List.of(UserMessage.from(prompt)));
        AiMessage message = response == null ? null : response.aiMessage();
        return message == null ? null : message.text();
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }
}
