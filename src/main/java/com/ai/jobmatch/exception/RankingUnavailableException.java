package com.ai.jobmatch.exception;

public class RankingUnavailableException extends JobSearchException {

    public RankingUnavailableException(String message) {
        super(message);
    }

    public RankingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
