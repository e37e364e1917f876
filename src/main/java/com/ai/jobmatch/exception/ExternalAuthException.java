package com.ai.jobmatch.exception;

/**
 * France Travail 토큰 발급 실패. 해당 호출 한 건만 실패시킨다.
 */
public class ExternalAuthException extends JobSearchException {

    public ExternalAuthException(String message) {
        super(message);
    }

    public ExternalAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
