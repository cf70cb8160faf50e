package com.nevis.chunking.chunking;

import com.nevis.chunking.config.RouterProperties;
import com.nevis.chunking.config.TestSettings;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.ChunkingStrategy;
import com.nevis.chunking.model.RoutingDecision;
import com.nevis.chunking.model.SemanticType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static com.nevis.chunking.chunking.Texts.paragraph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityRouterTest {

    private final QualityRouter router = new QualityRouter(TestSettings.router(), TestSettings.chunking());

    @Test
    @DisplayName("Should not route a clean 450-word chunk to the LLM")
    void shouldKeepCleanChunk() {
        RoutingDecision decision = router.route(chunkOf(paragraph("alpha", 450)));

        assertThat(decision.needsLlm()).isFalse();
        assertThat(decision.scores().boundary()).isEqualTo(1.0);
        assertThat(decision.scores().size()).isCloseTo(0.75, within(1e-9));
        assertThat(decision.scores().complexity()).isEqualTo(1.0);
        assertThat(decision.score()).isCloseTo(0.925, within(1e-9));
        assertThat(decision.reasons()).isEmpty();
        assertThat(decision.chunk().scores()).isEqualTo(decision.scores());
    }

    @Test
    @DisplayName("Should route a chunk that starts and ends mid-sentence at minimum size")
    void shouldRouteBrokenChunk() {
        String text = "and " + Texts.unpunctuated("word", 198) + " trailing,";

        RoutingDecision decision = router.route(chunkOf(text));

        assertThat(decision.needsLlm()).isTrue();
        assertThat(decision.scores().boundary()).isZero();
        assertThat(decision.scores().size()).isZero();
        assertThat(decision.score()).isCloseTo(0.3, within(1e-9));
        assertThat(decision.reasons()).contains(QualityRouter.BOUNDARY_PROBLEMS, QualityRouter.SIZE_DEVIATION);
    }

    @Test
    @DisplayName("Should not refine when the score equals the confidence minimum exactly")
    void shouldNotRouteOnTie() {
        Chunk chunk = chunkOf(paragraph("alpha", 450));
        double score = router.route(chunk).score();
        QualityRouter tiedRouter = new QualityRouter(new RouterProperties(0.4, 0.3, 0.3, score), TestSettings.chunking());

        assertThat(tiedRouter.route(chunk).needsLlm()).isFalse();
    }

    @Test
    @DisplayName("Should never raise the score as boundary penalties accumulate")
    void shouldBeMonotonicInBoundaryPenalties() {
        String body = Texts.unpunctuated("word", 398);
        double clean = router.route(chunkOf("Start " + body + " end.")).score();
        double lowercase = router.route(chunkOf("start " + body + " end.")).score();
        double unterminated = router.route(chunkOf("start " + body + " end")).score();
        double dangling = router.route(chunkOf("and " + body + " end,")).score();

        assertThat(clean).isGreaterThanOrEqualTo(lowercase);
        assertThat(lowercase).isGreaterThanOrEqualTo(unterminated);
        assertThat(unterminated).isGreaterThanOrEqualTo(dangling);
    }

    @Test
    @DisplayName("Should score size 1 at target, 0 at min and max, linear in between")
    void shouldScoreSize() {
        assertThat(router.sizeScore(400)).isEqualTo(1.0);
        assertThat(router.sizeScore(200)).isZero();
        assertThat(router.sizeScore(600)).isZero();
        assertThat(router.sizeScore(300)).isCloseTo(0.5, within(1e-9));
        assertThat(router.sizeScore(500)).isCloseTo(0.5, within(1e-9));
        assertThat(router.sizeScore(50)).isZero();
        assertThat(router.sizeScore(900)).isZero();
    }

    @Test
    @DisplayName("Should penalise lists, tables and unbalanced code fences")
    void shouldScoreStructuralComplexity() {
        double plain = router.complexityScore("A plain sentence.\nAnother plain sentence.");
        double list = router.complexityScore("Items:\n- one\n- two\n- three");
        double table = router.complexityScore("| a | b |\n| 1 | 2 |");
        double openFence = router.complexityScore("Example:\n```\ncode here");

        assertThat(plain).isEqualTo(1.0);
        assertThat(list).isLessThan(plain);
        assertThat(table).isLessThan(plain);
        assertThat(openFence).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should flag unbalanced brackets and quotes")
    void shouldPenaliseUnbalancedPairs() {
        assertThat(router.complexityScore("He said (quietly that it was over.")).isCloseTo(0.85, within(1e-9));
        assertThat(router.complexityScore("He said \"it was over.")).isCloseTo(0.85, within(1e-9));
    }

    private static Chunk chunkOf(String text) {
        return Chunk.candidate(UUID.randomUUID(), 1, text, 0, text.length(), TextSpans.countWords(text),
            ChunkingStrategy.PARAGRAPH, SemanticType.BODY);
    }
}
