package com.scholary.pipeline.service;

import com.scholary.pipeline.document.Document;
import com.scholary.pipeline.job.Job;
import java.util.List;
import java.util.Map;

/** Counts and recent items for one owner. */
public record DashboardSummary(
    long documents,
    long jobs,
    Map<String, Long> jobsByType,
    List<Document> recentDocuments,
    List<Job> recentJobs) {}
