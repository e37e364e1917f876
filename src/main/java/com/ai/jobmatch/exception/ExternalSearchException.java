package com.ai.jobmatch.exception;

import lombok.Getter;

/**
 * France Travail 검색이 204 이외의 비정상 응답을 반환한 경우
 */
@Getter
public class ExternalSearchException extends JobSearchException {

    private final int statusCode;

    public ExternalSearchException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExternalSearchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }
}
