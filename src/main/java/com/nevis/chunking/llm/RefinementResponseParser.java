package com.nevis.chunking.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.chunking.exception.LlmFatalException;
import com.nevis.chunking.model.RefinementAction;
import com.nevis.chunking.model.RefinementAdvice;
import com.nevis.chunking.model.SemanticType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads the provider's JSON verdict. Models like to wrap JSON in markdown fences, so only the
 * outermost object in the reply is parsed.
 */
@Component
@RequiredArgsConstructor
public class RefinementResponseParser {

    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper;

    public RefinementAdvice parse(String reply, SemanticType fallbackType) {
        int open = reply.indexOf('{');
        int close = reply.lastIndexOf('}');
        if (open < 0 || close <= open) {
            throw new LlmFatalException("Reply holds no JSON object: " + abbreviate(reply));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(reply.substring(open, close + 1));
        } catch (JsonProcessingException e) {
            throw new LlmFatalException("Reply is not valid JSON: " + abbreviate(reply), e);
        }

        RefinementAction action = RefinementAction.fromLabel(root.path("action").asText(null))
            .orElseThrow(() -> new LlmFatalException("Reply has unknown action: " + root.path("action")));

        JsonNode offsetNode = root.path("offset_adjust");
        if (!offsetNode.isMissingNode() && !offsetNode.isNull() && !offsetNode.isNumber()) {
            throw new LlmFatalException("offset_adjust is not a number: " + offsetNode);
        }

        double confidence = root.path("confidence").asDouble(DEFAULT_CONFIDENCE);
        return new RefinementAdvice(
            action,
            offsetNode.asInt(0),
            SemanticType.fromLabel(root.path("semantic_type").asText(null), fallbackType),
            Math.max(0.0, Math.min(1.0, confidence)),
            root.path("reason").asText(""),
            0
        );
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
