package com.ai.jobmatch.service;

import com.ai.jobmatch.dto.Candidate;

import java.util.Optional;

public interface CandidateService {

    Optional<Candidate> findById(String candidateId);

    Candidate save(Candidate candidate);
}
