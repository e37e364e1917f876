package com.ai.jobmatch.service;

import com.ai.jobmatch.entity.JobPosting;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * 후보자가 이미 지원한 공고에 isApplied 표시
 */
@Component
public class AppliedStatusAnnotator {

    public void annotate(Collection<JobPosting> jobs, Set<String> appliedJobIds) {
        Set<String> applied = appliedJobIds == null ? Set.of() : appliedJobIds;
        for (JobPosting job : jobs) {
            job.setApplied(job.getId() != null && applied.contains(job.getId()));
        }
    }
}
