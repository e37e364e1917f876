package com.ai.jobmatch.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 후보자 정보 (이력서 구조화, 지원 이력은 외부에서 관리)
 */
@Value
@Builder
public class Candidate {
    String id;
    @Singular
    List<String> technicalSkills;
    @Singular
    List<WorkExperience> workExperiences;
    @Singular("projectName")
    List<String> projectNames;
    @Singular
    Set<String> appliedJobIds;

    @Value
    public static class WorkExperience {
        String company;
        String role;
    }
}
