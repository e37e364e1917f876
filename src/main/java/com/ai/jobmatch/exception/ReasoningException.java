package com.ai.jobmatch.exception;

/**
 * Planner 호출 실패 또는 해석할 수 없는 응답
 */
public class ReasoningException extends JobSearchException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
