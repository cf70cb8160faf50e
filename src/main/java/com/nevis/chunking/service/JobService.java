package com.nevis.chunking.service;

import com.nevis.chunking.exception.JobNotFoundException;
import com.nevis.chunking.model.JobCounts;
import com.nevis.chunking.model.JobPriority;
import com.nevis.chunking.model.JobStatusSnapshot;

import java.util.List;
import java.util.Set;
import java.util.UUID;

public interface JobService {

    UUID submitJob(List<UUID> articleIds, JobPriority priority);

    /**
     * Splits {@code articleIds} into jobs of the configured job size, all with the same priority.
     */
    List<UUID> submitJobs(List<UUID> articleIds, JobPriority priority);

    /**
     * @throws JobNotFoundException when no job has this id, or it finished longer ago than the
     *                              configured retention
     */
    JobStatusSnapshot getJobStatus(UUID jobId);

    /**
     * Queued jobs are cancelled at once. Running jobs stop taking new work and finish as
     * {@code CANCELLED} once their in-flight articles are done.
     *
     * @return {@code false} when the job had already finished
     * @throws JobNotFoundException when no job has this id
     */
    boolean cancelJob(UUID jobId);

    JobCounts counts();

    /**
     * Ids of articles that belong to queued or running jobs.
     */
    Set<UUID> activeArticleIds();
}
