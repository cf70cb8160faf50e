package com.nevis.chunking.repository;

import com.nevis.chunking.model.Article;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ArticleRepository {

    Article save(Article article);

    /**
     * Loads the articles that exist among {@code ids}, in request order. Unknown ids are skipped.
     */
    List<Article> loadArticles(Collection<UUID> ids);

    List<Article> loadArticlesByDomain(String domain, int limit);

    List<UUID> findUnchunkedArticleIds(int limit);
}
