package com.surveyflow.runtime.api;

import com.surveyflow.runtime.definition.SurveyDefinitionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/surveys")
public class SurveyImportController {
    private final SurveyDefinitionService definitionService;

    public SurveyImportController(SurveyDefinitionService definitionService) {
        this.definitionService = definitionService;
    }

    @PostMapping("/import")
    public ResponseEntity<SurveyDefinitionService.ImportResult> importSurvey(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(definitionService.importSurvey(request.content(), request.dryRun()));
    }

    @GetMapping
    public ResponseEntity<List<String>> surveys() {
        return ResponseEntity.ok(definitionService.surveyIds());
    }

    public record ImportRequest(String content, boolean dryRun) {}
}
