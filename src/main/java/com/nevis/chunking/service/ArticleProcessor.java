package com.nevis.chunking.service;

import com.nevis.chunking.chunking.BaseChunker;
import com.nevis.chunking.chunking.QualityRouter;
import com.nevis.chunking.config.PipelineSettings;
import com.nevis.chunking.exception.ChunkingException;
import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.ArticleError;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.ErrorKind;
import com.nevis.chunking.model.RefinementOutcome;
import com.nevis.chunking.model.RoutingDecision;
import com.nevis.chunking.repository.ChunkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one article through chunking, routing, refinement, assembly and storage. Chunks of one
 * article are always refined one after another.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ArticleProcessor {

    private final RefinementService refinementService;
    private final ChunkAssembler chunkAssembler;
    private final ChunkRepository chunkRepository;

    /**
     * @throws ChunkingException when the article cannot be segmented
     */
    PreparedArticle prepare(Article article, PipelineSettings settings) {
        List<Chunk> candidates = new BaseChunker(settings.chunking()).chunk(article);

        if (!settings.features().routingEnabled() || !settings.features().refinementEnabled()
            || settings.features().isBlacklisted(article.domain())) {
            return new PreparedArticle(article, settings, candidates, List.of());
        }

        QualityRouter router = new QualityRouter(settings.router(), settings.chunking());
        List<Chunk> scored = new ArrayList<>(candidates.size());
        List<Integer> flagged = new ArrayList<>();
        for (Chunk chunk : candidates) {
            try {
                RoutingDecision decision = router.route(chunk);
                scored.add(decision.chunk());
                if (decision.needsLlm()) {
                    flagged.add(chunk.index());
                    log.debug("Chunk {} of article {} routed to refinement (score {}): {}",
                        chunk.index(), article.id(), decision.score(), decision.reasons());
                }
            } catch (RuntimeException e) {
                log.warn("Routing failed for chunk {} of article {}, keeping it as is: {}", chunk.index(), article.id(), e.getMessage());
                scored.add(chunk);
            }
        }
        return new PreparedArticle(article, settings, scored, flagged);
    }

    ArticleOutcome complete(PreparedArticle prepared, String batchId) {
        Article article = prepared.article();
        PipelineSettings settings = prepared.settings();
        List<Chunk> working = new ArrayList<>(prepared.chunks());
        List<ArticleError> warnings = new ArrayList<>();

        int requests = 0;
        int refined = 0;
        int denied = 0;
        int circuitSkips = 0;
        int failures = 0;

        for (int index : prepared.flagged()) {
            RefinementOutcome outcome = refinementService.refine(article, working, index, batchId, settings.chunking());
            working.set(index, outcome.chunk());
            if (outcome.calledProvider()) {
                requests++;
            }
            switch (outcome.kind()) {
                case REFINED -> refined++;
                case RATE_LIMITED -> denied++;
                case CIRCUIT_OPEN -> circuitSkips++;
                case TRANSIENT_FAILURE -> failures++;
                case FATAL_FAILURE -> {
                    failures++;
                    warnings.add(new ArticleError(article.id(), ErrorKind.LLM_FATAL, outcome.detail()));
                }
            }
        }

        List<Chunk> assembled = chunkAssembler.assemble(article, working, settings.chunking(),
            settings.features().applyStructuralActions());

        try {
            chunkRepository.persistChunks(article.id(), assembled);
        } catch (RuntimeException e) {
            log.error("Failed to store chunks of article {}: {}", article.id(), e.getMessage(), e);
            return ArticleOutcome.failed(article, new ArticleError(article.id(), ErrorKind.PERSISTENCE_FAILED, e.getMessage()));
        }

        log.debug("Article {} stored as {} chunks ({} refined)", article.id(), assembled.size(), refined);
        return new ArticleOutcome(article, assembled.size(), requests, refined, denied, circuitSkips, failures,
            warnings, null);
    }
}
