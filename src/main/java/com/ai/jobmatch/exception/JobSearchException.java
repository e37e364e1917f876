package com.ai.jobmatch.exception;

/**
 * 외부 연동(채용공고, 인증, 추론, 임베딩) 실패의 공통 상위 예외
 */
public class JobSearchException extends RuntimeException {

    public JobSearchException(String message) {
        super(message);
    }

    public JobSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
