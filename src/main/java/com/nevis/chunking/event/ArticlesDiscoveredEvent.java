package com.nevis.chunking.event;

import com.nevis.chunking.model.JobPriority;

import java.util.List;
import java.util.UUID;

public record ArticlesDiscoveredEvent(List<UUID> articleIds, JobPriority priority) {
}
