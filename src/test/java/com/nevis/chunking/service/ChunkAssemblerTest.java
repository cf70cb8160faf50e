package com.nevis.chunking.service;

import com.nevis.chunking.chunking.TextSpans;
import com.nevis.chunking.config.ChunkingProperties;
import com.nevis.chunking.config.TestSettings;
import com.nevis.chunking.model.Chunk;
import com.nevis.chunking.model.ChunkingStrategy;
import com.nevis.chunking.model.RefinementAction;
import com.nevis.chunking.model.RefinementAdvice;
import com.nevis.chunking.model.RefinementStatus;
import com.nevis.chunking.model.SemanticType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkAssemblerTest {

    private final ChunkAssembler assembler = new ChunkAssembler();
    private final ChunkingProperties chunking = TestSettings.chunking();

    @Nested
    @DisplayName("Neighbour boundaries")
    class NeighbourBoundaries {

        @Test
        @DisplayName("Should start the next chunk right after a boundary moved backwards")
        void shouldShiftNextStartBackwards() {
            ArticleFixture fixture = ArticleFixture.of(450, 300);
            int newEnd = fixture.endOfWords(0, 445);
            List<Chunk> chunks = withMovedEnd(fixture, 0, newEnd, RefinementAction.KEEP);

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, false);

            assertThat(assembled.get(0).charEnd()).isEqualTo(newEnd);
            assertThat(assembled.get(1).charStart()).isEqualTo(newEnd + 1);
            assertThat(assembled.get(1).wordCount()).isEqualTo(305);
            assertThat(assembled.get(1).text()).isEqualTo(fixture.text().substring(newEnd + 1, fixture.text().length()));
        }

        @Test
        @DisplayName("Should start the next chunk at the first word after a boundary moved forwards")
        void shouldShiftNextStartForwards() {
            ArticleFixture fixture = ArticleFixture.of(300, 300);
            int nextStart = fixture.chunks().get(1).charStart();
            int newEnd = fixture.endOfWords(nextStart, 3);
            List<Chunk> chunks = withMovedEnd(fixture, 0, newEnd, RefinementAction.KEEP);

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, false);

            assertThat(assembled.get(0).wordCount()).isEqualTo(303);
            assertThat(assembled.get(1).charStart()).isEqualTo(newEnd + 1);
            assertThat(assembled.get(1).wordCount()).isEqualTo(297);
            assertThat(fixture.text().substring(assembled.get(0).charEnd(), assembled.get(1).charStart())).isBlank();
        }

        @Test
        @DisplayName("Should revert the move when the neighbour would drop below the minimum")
        void shouldRevertWhenNeighbourTooSmall() {
            ArticleFixture fixture = ArticleFixture.of(300, 202, 300);
            Chunk originalFirst = fixture.chunks().get(0);
            int newEnd = fixture.endOfWords(fixture.chunks().get(1).charStart(), 3);
            List<Chunk> chunks = withMovedEnd(fixture, 0, newEnd, RefinementAction.KEEP);

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, false);

            assertThat(assembled.get(0).charEnd()).isEqualTo(originalFirst.charEnd());
            assertThat(assembled.get(0).text()).isEqualTo(originalFirst.text());
            assertThat(assembled.get(0).status()).isEqualTo(RefinementStatus.REFINED);
            assertThat(assembled.get(0).advice().appliedOffset()).isZero();
            assertThat(assembled.get(1).wordCount()).isEqualTo(202);
        }

        @Test
        @DisplayName("Should revert the move when the neighbour would exceed the maximum")
        void shouldRevertWhenNeighbourTooLarge() {
            ArticleFixture fixture = ArticleFixture.of(450, 598);
            int newEnd = fixture.endOfWords(0, 445);
            List<Chunk> chunks = withMovedEnd(fixture, 0, newEnd, RefinementAction.KEEP);

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, false);

            assertThat(assembled.get(0).wordCount()).isEqualTo(450);
            assertThat(assembled.get(1).wordCount()).isEqualTo(598);
        }

        @Test
        @DisplayName("Should revert a backward move when the next chunk is a window that cannot follow it")
        void shouldRevertWhenWindowNeighbourLeavesGap() {
            ArticleFixture fixture = ArticleFixture.of(450, 300);
            Chunk originalFirst = fixture.chunks().get(0);
            Chunk window = fixture.chunks().get(1);
            int newEnd = fixture.endOfWords(0, 436);
            List<Chunk> chunks = withMovedEnd(fixture, 0, newEnd, RefinementAction.KEEP);
            chunks.set(1, Chunk.candidate(window.articleId(), 1, window.text(), window.charStart(), window.charEnd(),
                window.wordCount(), ChunkingStrategy.SLIDING_WINDOW, SemanticType.BODY));

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, false);

            assertThat(assembled.get(0).charEnd()).isEqualTo(originalFirst.charEnd());
            assertThat(assembled.get(0).advice().appliedOffset()).isZero();
            assertThat(assembled.get(1).charStart()).isEqualTo(window.charStart());
            assertThat(fixture.text().substring(assembled.get(0).charEnd(), assembled.get(1).charStart())).isBlank();
        }

        @Test
        @DisplayName("Should keep a forward move when the next chunk is a window that already overlaps it")
        void shouldKeepForwardMoveIntoWindow() {
            ArticleFixture fixture = ArticleFixture.of(300, 300);
            Chunk window = fixture.chunks().get(1);
            int newEnd = fixture.endOfWords(window.charStart(), 3);
            List<Chunk> chunks = withMovedEnd(fixture, 0, newEnd, RefinementAction.KEEP);
            chunks.set(1, Chunk.candidate(window.articleId(), 1, window.text(), window.charStart(), window.charEnd(),
                window.wordCount(), ChunkingStrategy.SLIDING_WINDOW, SemanticType.BODY));

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, false);

            assertThat(assembled.get(0).charEnd()).isEqualTo(newEnd);
            assertThat(assembled.get(1).charStart()).isEqualTo(window.charStart());
        }

        @Test
        @DisplayName("Should revert a pulled-back end on the final chunk so its tail stays covered")
        void shouldRevertFinalChunkPullBack() {
            ArticleFixture fixture = ArticleFixture.of(450, 300);
            Chunk last = fixture.chunks().get(1);
            int newEnd = fixture.endOfWords(last.charStart(), 286);
            List<Chunk> chunks = withMovedEnd(fixture, 1, newEnd, RefinementAction.KEEP);

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, false);

            assertThat(assembled.get(1).charEnd()).isEqualTo(fixture.text().length());
            assertThat(assembled.get(1).wordCount()).isEqualTo(300);
            assertThat(assembled.get(1).advice().appliedOffset()).isZero();
        }

        @Test
        @DisplayName("Should leave untouched chunks exactly as they came in, renumbered")
        void shouldKeepUnmovedChunks() {
            ArticleFixture fixture = ArticleFixture.of(300, 300, 300);

            List<Chunk> assembled = assembler.assemble(fixture.article(), fixture.chunks(), chunking, true);

            assertThat(assembled).extracting(Chunk::text)
                .containsExactlyElementsOf(fixture.chunks().stream().map(Chunk::text).toList());
            assertThat(assembled).extracting(Chunk::index).containsExactly(0, 1, 2);
        }
    }

    @Nested
    @DisplayName("Structural actions")
    class StructuralActions {

        @Test
        @DisplayName("Should ignore drop and merge verdicts when structural actions are off")
        void shouldIgnoreActionsWhenDisabled() {
            ArticleFixture fixture = ArticleFixture.of(250, 10, 150, 300, 200);

            List<Chunk> assembled = assembler.assemble(fixture.article(), withActions(fixture), chunking, false);

            assertThat(assembled).hasSize(5);
            assertThat(assembled).extracting(Chunk::index).containsExactly(0, 1, 2, 3, 4);
        }

        @Test
        @DisplayName("Should drop boilerplate and merge into the previous chunk within the maximum")
        void shouldApplyActions() {
            ArticleFixture fixture = ArticleFixture.of(250, 10, 150, 300, 200);
            List<Chunk> original = fixture.chunks();

            List<Chunk> assembled = assembler.assemble(fixture.article(), withActions(fixture), chunking, true);

            assertThat(assembled).extracting(Chunk::wordCount).containsExactly(250, 450, 200);
            assertThat(assembled).extracting(Chunk::index).containsExactly(0, 1, 2);
            Chunk merged = assembled.get(1);
            assertThat(merged.charStart()).isEqualTo(original.get(2).charStart());
            assertThat(merged.charEnd()).isEqualTo(original.get(3).charEnd());
            assertThat(merged.text()).contains("\n\n");
            assertThat(assembled).noneMatch(chunk -> chunk.text().equals(original.get(1).text()));
        }

        @Test
        @DisplayName("Should treat merge-next verdicts as keep")
        void shouldKeepOnMergeNext() {
            ArticleFixture fixture = ArticleFixture.of(250, 250);
            List<Chunk> chunks = new ArrayList<>(fixture.chunks());
            chunks.set(0, refined(chunks.get(0), RefinementAction.MERGE_NEXT));

            List<Chunk> assembled = assembler.assemble(fixture.article(), chunks, chunking, true);

            assertThat(assembled).extracting(Chunk::wordCount).containsExactly(250, 250);
        }
    }

    /**
     * Verdicts: keep, drop, merge into a dropped neighbour, merge within limit, merge over limit.
     */
    private static List<Chunk> withActions(ArticleFixture fixture) {
        List<Chunk> chunks = new ArrayList<>(fixture.chunks());
        chunks.set(0, refined(chunks.get(0), RefinementAction.KEEP));
        chunks.set(1, refined(chunks.get(1), RefinementAction.DROP));
        chunks.set(2, refined(chunks.get(2), RefinementAction.MERGE_PREV));
        chunks.set(3, refined(chunks.get(3), RefinementAction.MERGE_PREV));
        chunks.set(4, refined(chunks.get(4), RefinementAction.MERGE_PREV));
        return chunks;
    }

    private static Chunk refined(Chunk chunk, RefinementAction action) {
        return chunk.refined(new RefinementAdvice(action, 0, SemanticType.BODY, 0.8, "", 0), SemanticType.BODY);
    }

    private static List<Chunk> withMovedEnd(ArticleFixture fixture, int index, int newEnd, RefinementAction action) {
        List<Chunk> chunks = new ArrayList<>(fixture.chunks());
        Chunk chunk = chunks.get(index);
        int applied = newEnd - chunk.charEnd();
        String text = fixture.text().substring(chunk.charStart(), newEnd);
        chunks.set(index, chunk.withSpan(text, chunk.charStart(), newEnd, TextSpans.countWords(text))
            .refined(new RefinementAdvice(action, applied, SemanticType.BODY, 0.8, "", applied), SemanticType.BODY));
        return chunks;
    }
}
