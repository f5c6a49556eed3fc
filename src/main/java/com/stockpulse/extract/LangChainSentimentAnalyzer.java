package com.stockpulse.extract;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.MalformedOutputException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Sentiment/event extraction through LangChain4j + Ollama.
 */
public final class LangChainSentimentAnalyzer implements StructuredAnalyzer {
    private static final Logger LOG = LogManager.getLogger(LangChainSentimentAnalyzer.class);

    private final ChatLanguageModel chatModel;

    public LangChainSentimentAnalyzer(Config config) {
        this(buildModel(config));
    }

    LangChainSentimentAnalyzer(ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public AnalysisPayload analyze(String text) throws MalformedOutputException {
        if (chatModel == null) {
            throw new IllegalStateException("language model unavailable");
        }
        List<ChatMessage> messages = List.of(
                SystemMessage.from(SentimentPrompts.systemPrompt()),
                UserMessage.from(SentimentPrompts.userPrompt(text))
        );
        Response<AiMessage> response = chatModel.generate(messages);
        String out = response == null || response.content() == null ? "" : response.content().text();
        return SentimentOutputParser.parse(out);
    }

    private static ChatLanguageModel buildModel(Config config) {
        try {
            return OllamaChatModel.builder()
                    .baseUrl(config.getString("ai.base_url", "http://127.0.0.1:11434"))
                    .modelName(config.getString("ai.model", "llama3.1:latest"))
                    .temperature(config.getDouble("ai.temperature", 0.2))
                    .timeout(Duration.ofSeconds(Math.max(10, config.getInt("ai.timeout_sec", 120))))
                    .build();
        } catch (RuntimeException e) {
            LOG.warn("failed to initialize LangChain4j Ollama model: {}", e.getMessage());
            return null;
        }
    }
}
