package com.surveyflow.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "survey.runtime")
public class RuntimeProperties {
    /** Attempts at a session compare-and-swap write before giving up with a conflict */
    private int casMaxAttempts = 3;
    /** Fixed seed for shuffles; unset means a fresh random seed per process */
    private Long shuffleSeed;

    public int getCasMaxAttempts() { return casMaxAttempts; }
    public void setCasMaxAttempts(int casMaxAttempts) { this.casMaxAttempts = casMaxAttempts; }

    public Long getShuffleSeed() { return shuffleSeed; }
    public void setShuffleSeed(Long shuffleSeed) { this.shuffleSeed = shuffleSeed; }
}
