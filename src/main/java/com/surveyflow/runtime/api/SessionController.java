package com.surveyflow.runtime.api;

import com.surveyflow.runtime.loop.LoopModels;
import com.surveyflow.runtime.session.SessionModels;
import com.surveyflow.runtime.session.SurveyRuntimeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {
    private final SurveyRuntimeService runtimeService;

    public SessionController(SurveyRuntimeService runtimeService) {
        this.runtimeService = runtimeService;
    }

    @PostMapping
    public ResponseEntity<SessionModels.NavigationResult> start(@RequestBody StartRequest request) {
        return ResponseEntity.ok(runtimeService.startSession(request.surveyId(), request.embeddedData()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionModels.SessionState> session(@PathVariable String sessionId) {
        return ResponseEntity.ok(runtimeService.session(sessionId));
    }

    @GetMapping("/{sessionId}/pages/{pageId}")
    public ResponseEntity<SessionModels.ResolvedPage> page(@PathVariable String sessionId, @PathVariable String pageId) {
        return ResponseEntity.ok(runtimeService.resolvePage(sessionId, pageId));
    }

    @PostMapping("/{sessionId}/answers")
    public ResponseEntity<SessionModels.AnswerResult> answer(@PathVariable String sessionId, @RequestBody AnswerRequest request) {
        return ResponseEntity.ok(runtimeService.submitAnswer(sessionId, request.questionId(), request.values()));
    }

    @PostMapping("/{sessionId}/next")
    public ResponseEntity<SessionModels.NavigationResult> next(@PathVariable String sessionId) {
        return ResponseEntity.ok(runtimeService.next(sessionId));
    }

    @PostMapping("/{sessionId}/previous")
    public ResponseEntity<SessionModels.NavigationResult> previous(@PathVariable String sessionId) {
        return ResponseEntity.ok(runtimeService.previous(sessionId));
    }

    @GetMapping("/{sessionId}/loops/{batteryId}/progress")
    public ResponseEntity<LoopModels.LoopProgress> loopProgress(@PathVariable String sessionId, @PathVariable String batteryId) {
        return ResponseEntity.ok(runtimeService.loopProgress(sessionId, batteryId));
    }

    public record StartRequest(String surveyId, Map<String, String> embeddedData) {}

    public record AnswerRequest(String questionId, List<String> values) {}
}
