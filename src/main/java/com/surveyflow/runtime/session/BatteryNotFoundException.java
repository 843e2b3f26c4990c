package com.surveyflow.runtime.session;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class BatteryNotFoundException extends RuntimeException {
    public BatteryNotFoundException(String batteryId) {
        super("Loop battery not found: " + batteryId);
    }
}
