package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.dto.JobSearchFilters;
import com.ai.jobmatch.dto.LocationConstraint;
import com.ai.jobmatch.dto.LocationType;
import com.ai.jobmatch.dto.ResolvedLocation;
import com.ai.jobmatch.dto.SearchVariation;
import com.ai.jobmatch.entity.JobPosting;
import com.ai.jobmatch.exception.ExternalSearchException;
import com.ai.jobmatch.service.AppliedStatusAnnotator;
import com.ai.jobmatch.service.FranceTravailService;
import com.ai.jobmatch.service.LocationResolverService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchOrchestratorServiceImplTest {

    @Mock
    private FranceTravailService franceTravailService;

    @Mock
    private LocationResolverService locationResolverService;

    private SearchOrchestratorServiceImpl orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new SearchOrchestratorServiceImpl(franceTravailService, locationResolverService,
                new AppliedStatusAnnotator(), Runnable::run);
    }

    @Test
    void mergesInSubmissionOrderWithoutDuplicates() {
        when(franceTravailService.searchJobs(eq("python developer"), any(), any()))
                .thenReturn(List.of(job("A"), job("B")));
        when(franceTravailService.searchJobs(eq("python"), any(), any()))
                .thenReturn(List.of(job("B"), job("C"), job(null)));

        List<JobPosting> jobs = orchestrator.execute(List.of(variation("python developer"), variation("python")), Set.of());

        assertThat(jobs).extracting(JobPosting::getId).containsExactly("A", "B", "C");
        verifyNoInteractions(locationResolverService);
    }

    @Test
    void resolvedCommuneTriggersOneDepartmentSearch() {
        SearchVariation lyon = variation("python").toBuilder().locationRaw("Lyon").locationType(LocationType.COMMUNE).build();
        when(locationResolverService.resolve("Lyon", LocationType.COMMUNE))
                .thenReturn(ResolvedLocation.commune("69123", "69"));
        when(franceTravailService.searchJobs("python", LocationConstraint.commune("69123"), JobSearchFilters.NONE))
                .thenThrow(new ExternalSearchException(500, "boom"));
        when(franceTravailService.searchJobs("python", LocationConstraint.department("69"), JobSearchFilters.NONE))
                .thenReturn(List.of(job("D1")));

        List<JobPosting> jobs = orchestrator.execute(List.of(lyon), Set.of());

        assertThat(jobs).extracting(JobPosting::getId).containsExactly("D1");
        verify(franceTravailService, times(1)).searchJobs("python", LocationConstraint.department("69"), JobSearchFilters.NONE);
        verify(franceTravailService, never()).searchJobs(any(), eq(LocationConstraint.national()), any());
    }

    @Test
    void parisDoesNotCascadeTwiceToTheSameDepartment() {
        SearchVariation paris = variation("java").toBuilder().locationRaw("Paris").build();
        when(locationResolverService.resolve("Paris", LocationType.UNKNOWN))
                .thenReturn(ResolvedLocation.commune("75056", "75"));
        when(franceTravailService.searchJobs("java", LocationConstraint.commune("75056"), JobSearchFilters.NONE))
                .thenReturn(List.of(job("P1")));

        assertThat(orchestrator.execute(List.of(paris), Set.of())).extracting(JobPosting::getId).containsExactly("P1");
        verify(franceTravailService, times(1)).searchJobs(any(), any(), any());
    }

    @Test
    void oneFailedTaskDoesNotCancelOthers() {
        when(franceTravailService.searchJobs(eq("first"), any(), any())).thenThrow(new ExternalSearchException(503, "down"));
        when(franceTravailService.searchJobs(eq("second"), any(), any())).thenReturn(List.of(job("S1")));

        List<JobPosting> jobs = orchestrator.execute(List.of(variation("first"), variation("second")), Set.of());

        assertThat(jobs).extracting(JobPosting::getId).containsExactly("S1");
    }

    @Test
    void emptyResultsTriggerExactlyOneNationalSearch() {
        SearchVariation remote = variation("rust").toBuilder().contractType("CDI").build();
        when(franceTravailService.searchJobs("rust", LocationConstraint.national(), remote.toFilters())).thenReturn(List.of());
        when(franceTravailService.searchJobs("rust", LocationConstraint.national(), JobSearchFilters.NONE))
                .thenReturn(List.of(job("N1")));

        List<JobPosting> jobs = orchestrator.execute(List.of(remote), Set.of());

        assertThat(jobs).extracting(JobPosting::getId).containsExactly("N1");
        verify(franceTravailService, times(1)).searchJobs("rust", LocationConstraint.national(), JobSearchFilters.NONE);
    }

    @Test
    void noVariationsUseTheRawQueryForTheNationalSearch() {
        when(franceTravailService.searchJobs("plombier", LocationConstraint.national(), JobSearchFilters.NONE))
                .thenReturn(List.of());

        assertThat(orchestrator.execute(List.of(), Set.of(), "plombier")).isEmpty();
        verify(franceTravailService, times(1)).searchJobs(any(), any(), any());
    }

    @Test
    void failingNationalSearchReturnsEmpty() {
        when(franceTravailService.searchJobs(any(), any(), any())).thenThrow(new ExternalSearchException(500, "down"));

        assertThat(orchestrator.execute(List.of(variation("go")), Set.of())).isEmpty();
        verify(franceTravailService, times(2)).searchJobs(any(), any(), any());
    }

    @Test
    void marksAppliedJobs() {
        when(franceTravailService.searchJobs(eq("kotlin"), any(), any())).thenReturn(List.of(job("K1"), job("K2")));

        List<JobPosting> jobs = orchestrator.execute(List.of(variation("kotlin")), Set.of("K2"));

        assertThat(jobs).extracting(JobPosting::isApplied).containsExactly(false, true);
    }

    @Test
    void saturatedExecutorContributesNoResultsInsteadOfThrowing() {
        SearchOrchestratorServiceImpl saturated = new SearchOrchestratorServiceImpl(franceTravailService,
                locationResolverService, new AppliedStatusAnnotator(), command -> {
                    throw new RejectedExecutionException("queue full");
                });
        SearchVariation lyon = variation("java").toBuilder().locationRaw("Lyon").build();
        when(franceTravailService.searchJobs("java", LocationConstraint.national(), JobSearchFilters.NONE))
                .thenReturn(List.of(job("N1")));

        List<JobPosting> jobs = saturated.execute(List.of(lyon), Set.of());

        // 위치 해석과 1차 검색이 모두 거부되면 전국 검색만 호출 스레드에서 실행된다
        assertThat(jobs).extracting(JobPosting::getId).containsExactly("N1");
        verifyNoInteractions(locationResolverService);
        verify(franceTravailService, times(1)).searchJobs(any(), any(), any());
    }

    private static SearchVariation variation(String keywords) {
        return SearchVariation.builder().keywords(keywords).build();
    }

    private static JobPosting job(String id) {
        return new JobPosting(id, "Job " + id, "description of " + id);
    }
}
