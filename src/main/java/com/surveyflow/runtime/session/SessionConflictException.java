package com.surveyflow.runtime.session;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SessionConflictException extends RuntimeException {
    public SessionConflictException(String sessionId, int attempts) {
        super("Session " + sessionId + " was modified concurrently; gave up after " + attempts + " attempts");
    }
}
