package com.ai.jobmatch.dto;

import com.ai.jobmatch.entity.JobPosting;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * France Travail offres/search 응답 본문
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobSearchResponse {

    @JsonProperty("resultats")
    private List<JobPosting> results = new ArrayList<>();
}
