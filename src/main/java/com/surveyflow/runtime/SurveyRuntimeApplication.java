package com.surveyflow.runtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SurveyRuntimeApplication {
    public static void main(String[] args) {
        SpringApplication.run(SurveyRuntimeApplication.class, args);
    }
}
