package com.ai.jobmatch.service;

import com.ai.jobmatch.entity.JobPosting;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AppliedStatusAnnotatorTest {

    private final AppliedStatusAnnotator annotator = new AppliedStatusAnnotator();

    @Test
    void marksOnlyAppliedIds() {
        JobPosting applied = new JobPosting("A", "t", "d");
        JobPosting other = new JobPosting("B", "t", "d");

        annotator.annotate(List.of(applied, other), Set.of("A"));

        assertThat(applied.isApplied()).isTrue();
        assertThat(other.isApplied()).isFalse();
    }

    @Test
    void nullApplicationsMarkNothing() {
        JobPosting job = new JobPosting("A", "t", "d");

        annotator.annotate(List.of(job), null);

        assertThat(job.isApplied()).isFalse();
    }
}
