package com.nevis.chunking.service;

import com.nevis.chunking.chunking.TextSpans;
import com.nevis.chunking.config.ChunkingProperties;
import com.nevis.chunking.exception.LlmFatalException;
import com.nevis.chunking.infra.Admission;
import com.nevis.chunking.infra.LlmCircuitBreaker;
import com.nevis.chunking.infra.RateLimiter;
import com.nevis.chunking.llm.Completion;
import com.nevis.chunking.llm.CompletionProvider;
import com.nevis.chunking.llm.CostModel;
import com.nevis.chunking.llm.RefinementPrompts;
import com.nevis.chunking.llm.RefinementResponseParser;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.OutcomeKind;
import com.nevis.chunking.model.RefinementAdvice;
import com.nevis.chunking.model.RefinementOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Rate limiter first, then the breaker, then the provider behind the retry template.
 * One admission covers every retry attempt of a chunk; the breaker sees one outcome per chunk.
 */
@Service
@Slf4j
public class LlmRefinementServiceImpl implements RefinementService {

    private final CompletionProvider completionProvider;
    private final RateLimiter rateLimiter;
    private final LlmCircuitBreaker circuitBreaker;
    private final RetryTemplate retryTemplate;
    private final RefinementResponseParser responseParser;
    private final CostModel costModel;
    private final Clock clock;

    public LlmRefinementServiceImpl(
        CompletionProvider completionProvider,
        @Qualifier("llmRateLimiter") RateLimiter rateLimiter,
        LlmCircuitBreaker circuitBreaker,
        @Qualifier("llmRetryTemplate") RetryTemplate retryTemplate,
        RefinementResponseParser responseParser,
        CostModel costModel,
        Clock clock
    ) {
        this.completionProvider = completionProvider;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.retryTemplate = retryTemplate;
        this.responseParser = responseParser;
        this.costModel = costModel;
        this.clock = clock;
    }

    @Override
    public RefinementOutcome refine(Article article, List<Chunk> chunks, int index, String batchId, ChunkingProperties chunking) {
        Chunk chunk = chunks.get(index);
        String prompt = RefinementPrompts.build(article, chunks, index, chunking.targetWords(), chunking.maxOffset());

        Admission admission = rateLimiter.admit(article.domain(), batchId, costModel.estimateCost(prompt));
        if (!admission.granted()) {
            log.debug("Chunk {} of article {} left unrefined: {}", index, article.id(), admission.reason());
            return new RefinementOutcome(chunk, OutcomeKind.RATE_LIMITED, admission.reason().name());
        }

        if (!circuitBreaker.allow()) {
            rateLimiter.release(admission);
            log.debug("Chunk {} of article {} left unrefined: circuit open", index, article.id());
            return RefinementOutcome.of(chunk, OutcomeKind.CIRCUIT_OPEN);
        }

        Instant started = clock.instant();
        Completion completion;
        try {
            completion = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying refinement of chunk {} of article {}, attempt {}",
                        index, article.id(), context.getRetryCount() + 1);
                }
                return completionProvider.complete(prompt);
            });
        } catch (LlmFatalException e) {
            circuitBreaker.onFailure(elapsedSince(started), e);
            rateLimiter.record(admission, 0.0);
            log.error("Refinement of chunk {} of article {} failed permanently: {}", index, article.id(), e.getMessage());
            return new RefinementOutcome(chunk.refinementFailed(), OutcomeKind.FATAL_FAILURE, e.getMessage());
        } catch (RuntimeException e) {
            circuitBreaker.onFailure(elapsedSince(started), e);
            rateLimiter.record(admission, 0.0);
            log.warn("Refinement of chunk {} of article {} gave up after retries: {}", index, article.id(), e.getMessage());
            return new RefinementOutcome(chunk.refinementFailed(), OutcomeKind.TRANSIENT_FAILURE, e.getMessage());
        }

        rateLimiter.record(admission, costModel.actualCost(prompt, completion));

        RefinementAdvice advice;
        try {
            advice = responseParser.parse(completion.text(), chunk.semanticType());
        } catch (LlmFatalException e) {
            circuitBreaker.onFailure(elapsedSince(started), e);
            log.error("Malformed refinement reply for chunk {} of article {}: {}", index, article.id(), e.getMessage());
            return new RefinementOutcome(chunk.refinementFailed(), OutcomeKind.FATAL_FAILURE, e.getMessage());
        }
        circuitBreaker.onSuccess(elapsedSince(started));

        boolean lastChunk = index == chunks.size() - 1;
        Chunk refined = applyOffset(article.text(), chunk, advice, chunking, lastChunk);
        log.debug("Chunk {} of article {} refined: action={}, offset={}/{}",
            index, article.id(), advice.action(), refined.advice().appliedOffset(), advice.offsetAdjust());
        return RefinementOutcome.of(refined, OutcomeKind.REFINED);
    }

    /**
     * Moves the end boundary by the suggested offset when the move is small enough and leaves a
     * chunk of legal size. Otherwise the chunk keeps its boundary but is still marked refined.
     */
    Chunk applyOffset(String source, Chunk chunk, RefinementAdvice advice, ChunkingProperties chunking, boolean lastChunk) {
        int adjust = advice.offsetAdjust();
        if (adjust == 0 || Math.abs(adjust) > chunking.maxOffset()) {
            return chunk.refined(advice.withAppliedOffset(0), advice.semanticType());
        }

        int end = chunk.charEnd() + adjust;
        // the final chunk has no neighbour to take over a trimmed tail
        if (lastChunk && adjust < 0) {
            return chunk.refined(advice.withAppliedOffset(0), advice.semanticType());
        }
        if (end <= chunk.charStart() || end > source.length()) {
            return chunk.refined(advice.withAppliedOffset(0), advice.semanticType());
        }
        // never cut through a word: fall back to the end of the previous word
        while (end > chunk.charStart() && end < source.length()
            && !Character.isWhitespace(source.charAt(end)) && !Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }
        while (end > chunk.charStart() && Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }

        int applied = end - chunk.charEnd();
        if (end <= chunk.charStart() || applied == 0 || Math.abs(applied) > chunking.maxOffset()) {
            return chunk.refined(advice.withAppliedOffset(0), advice.semanticType());
        }

        String text = source.substring(chunk.charStart(), end);
        int words = TextSpans.countWords(text);
        boolean sizeOk = words <= chunking.maxWords() && (lastChunk || words >= chunking.minWords());
        if (!sizeOk) {
            return chunk.refined(advice.withAppliedOffset(0), advice.semanticType());
        }
        return chunk.withSpan(text, chunk.charStart(), end, words)
            .refined(advice.withAppliedOffset(applied), advice.semanticType());
    }

    private Duration elapsedSince(Instant started) {
        return Duration.between(started, clock.instant());
    }
}
