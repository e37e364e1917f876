package com.ai.jobmatch.exception;

public class CandidateNotFoundException extends RuntimeException {

    public CandidateNotFoundException(String candidateId) {
        super("후보자를 찾을 수 없습니다: " + candidateId);
    }
}
