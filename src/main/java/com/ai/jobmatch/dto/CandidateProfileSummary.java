package com.ai.jobmatch.dto;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 임베딩과 Planner 입력으로 쓰는 후보자 요약. 저장되지 않는다.
 */
@Value
public class CandidateProfileSummary {

    public static final int MAX_SKILLS = 10;
    public static final int MAX_EXPERIENCES = 3;
    public static final int MAX_PROJECTS = 3;
    public static final String EMPTY_PROFILE = "No profile data available.";

    List<String> technicalSkills;
    List<Candidate.WorkExperience> recentExperiences;
    List<String> projectNames;

    public static CandidateProfileSummary from(Candidate candidate) {
        return new CandidateProfileSummary(
                head(candidate.getTechnicalSkills(), MAX_SKILLS),
                head(candidate.getWorkExperiences(), MAX_EXPERIENCES),
                head(candidate.getProjectNames(), MAX_PROJECTS));
    }

    public String render() {
        List<String> parts = new ArrayList<>();

        if (!technicalSkills.isEmpty()) {
            parts.add("Technical Skills: " + String.join(", ", technicalSkills));
        }

        if (!recentExperiences.isEmpty()) {
            List<String> experiences = new ArrayList<>();
            for (Candidate.WorkExperience w : recentExperiences) {
                experiences.add(w.getRole() + " at " + w.getCompany());
            }
            parts.add("Experience: " + String.join("; ", experiences));
        }

        if (!projectNames.isEmpty()) {
            parts.add("Projects: " + String.join(", ", projectNames));
        }

        return parts.isEmpty() ? EMPTY_PROFILE : String.join("\n", parts);
    }

    private static <T> List<T> head(List<T> list, int limit) {
        if (list == null) {
            return List.of();
        }
        return List.copyOf(list.subList(0, Math.min(limit, list.size())));
    }
}
