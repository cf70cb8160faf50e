package com.nevis.chunking.service;

import com.nevis.chunking.model.Article;
import com.nevis.chunking.model.BatchResult;
import com.nevis.chunking.model.ProcessingContext;

import java.util.List;

public interface BatchProcessingService {

    /**
     * Processes every article and blocks until all of them finished or the context was cancelled.
     * Per-article failures end up in {@link BatchResult#errors()}; nothing is thrown for them.
     */
    BatchResult processBatch(List<Article> articles, ProcessingContext context);
}
