package com.ai.jobmatch.controller;

import com.ai.jobmatch.entity.JobPosting;
import com.ai.jobmatch.service.SmartJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobSearchController {

    private final SmartJobService smartJobService;

    // 프로필 기반 스마트 검색
    @GetMapping("/smart-search")
    public ResponseEntity<List<JobPosting>> smartSearch(
            @RequestParam String candidateId,
            @RequestParam(required = false) String query) {

        log.info("스마트 검색 요청 - 후보자: {}, 검색어: '{}'", candidateId, query);
        return ResponseEntity.ok(smartJobService.smartSearch(candidateId, query));
    }
}
