package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.dto.Candidate;
import com.ai.jobmatch.service.CandidateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리 기반 후보자 저장소. 영속화는 범위 밖이다.
 */
@Service
@Slf4j
public class InMemoryCandidateService implements CandidateService {

    private final Map<String, Candidate> store = new ConcurrentHashMap<>();

    public InMemoryCandidateService() {
        save(Candidate.builder()
                .id("demo")
                .technicalSkill("Python")
                .technicalSkill("FastAPI")
                .technicalSkill("PostgreSQL")
                .workExperience(new Candidate.WorkExperience("Acme", "Backend Developer"))
                .projectName("Job board aggregator")
                .build());
    }

    @Override
    public Optional<Candidate> findById(String candidateId) {
        if (candidateId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.get(candidateId));
    }

    @Override
    public Candidate save(Candidate candidate) {
        if (candidate.getId() == null) {
            throw new IllegalArgumentException("후보자 id가 없습니다");
        }
        store.put(candidate.getId(), candidate);
        log.debug("후보자 저장: {}", candidate.getId());
        return candidate;
    }
}
