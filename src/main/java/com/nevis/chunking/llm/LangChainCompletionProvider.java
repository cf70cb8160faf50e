package com.nevis.chunking.llm;

import com.nevis.chunking.exception.LlmException;
import com.nevis.chunking.exception.LlmFatalException;
import com.nevis.chunking.exception.LlmTransientException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link CompletionProvider} backed by a LangChain4j {@link ChatModel}.
 * LangChain4j's non-retriable errors (authentication, invalid request) become fatal; anything
 * else the model throws is treated as transient.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LangChainCompletionProvider implements CompletionProvider {

    private final ChatModel chatModel;

    @Override
    public Completion complete(String prompt) {
        ChatResponse response;
        try {
            response = chatModel.chat(ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .build());
        } catch (NonRetriableException e) {
            throw new LlmFatalException("Completion request rejected: " + e.getMessage(), e);
        } catch (LlmException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LlmTransientException("Completion request failed: " + e.getMessage(), e);
        }

        AiMessage message = response == null ? null : response.aiMessage();
        if (message == null || message.text() == null || message.text().isBlank()) {
            throw new LlmFatalException("Completion provider returned an empty reply");
        }

        TokenUsage usage = response.tokenUsage();
        if (usage == null) {
            log.debug("Completion provider reported no token usage");
            return new Completion(message.text(), null, null);
        }
        return new Completion(message.text(), usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
    }
}
