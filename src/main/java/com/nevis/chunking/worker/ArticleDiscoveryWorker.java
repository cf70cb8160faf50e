package com.nevis.chunking.worker;

import com.nevis.chunking.config.DiscoveryProperties;
import com.nevis.chunking.event.ArticlesDiscoveredEvent;
import com.nevis.chunking.repository.ArticleRepository;
import com.nevis.chunking.service.JobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.discovery", name = "enabled", havingValue = "true")
public class ArticleDiscoveryWorker {

    private final ArticleRepository articleRepository;
    private final JobService jobService;
    private final DiscoveryProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    @Scheduled(fixedDelayString = "${app.discovery.interval-ms:300000}")
    public void discoverUnchunkedArticles() {
        log.debug("Looking for articles without chunks...");

        // over-fetch so that articles already owned by a job do not starve the rest
        Set<UUID> active = jobService.activeArticleIds();
        List<UUID> articleIds = articleRepository.findUnchunkedArticleIds(properties.batchLimit() + active.size()).stream()
            .filter(id -> !active.contains(id))
            .limit(properties.batchLimit())
            .toList();

        if (articleIds.isEmpty()) {
            return;
        }

        log.info("Discovered {} unchunked articles, submitting at priority {}", articleIds.size(), properties.priority());
        eventPublisher.publishEvent(new ArticlesDiscoveredEvent(articleIds, properties.priority()));
    }
}
