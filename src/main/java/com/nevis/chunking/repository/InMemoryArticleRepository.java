package com.nevis.chunking.repository;

import com.nevis.chunking.model.Article;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@RequiredArgsConstructor
public class InMemoryArticleRepository implements ArticleRepository {

    private final Map<UUID, Article> articles = new ConcurrentHashMap<>();
    private final Map<Long, UUID> insertionOrder = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ChunkRepository chunkRepository;

    @Override
    public Article save(Article article) {
        if (articles.put(article.id(), article) == null) {
            insertionOrder.put(sequence.incrementAndGet(), article.id());
        }
        return article;
    }

    @Override
    public List<Article> loadArticles(Collection<UUID> ids) {
        return ids.stream()
            .map(articles::get)
            .filter(Objects::nonNull)
            .toList();
    }

    @Override
    public List<Article> loadArticlesByDomain(String domain, int limit) {
        String wanted = domain.toLowerCase(Locale.ROOT);
        return insertionOrder.values().stream()
            .map(articles::get)
            .filter(article -> article.domain() != null && article.domain().toLowerCase(Locale.ROOT).equals(wanted))
            .limit(limit)
            .toList();
    }

    @Override
    public List<UUID> findUnchunkedArticleIds(int limit) {
        return insertionOrder.values().stream()
            .filter(id -> !chunkRepository.hasChunks(id))
            .limit(limit)
            .toList();
    }
}
