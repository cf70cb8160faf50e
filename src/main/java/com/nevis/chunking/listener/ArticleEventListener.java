package com.nevis.chunking.listener;

import com.nevis.chunking.event.ArticlesDiscoveredEvent;
import com.nevis.chunking.service.JobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class ArticleEventListener {

    private final JobService jobService;

    @EventListener
    public void handleDiscovered(ArticlesDiscoveredEvent event) {
        List<UUID> jobIds = jobService.submitJobs(event.articleIds(), event.priority());
        log.info("Submitted {} jobs for {} discovered articles", jobIds.size(), event.articleIds().size());
    }
}
