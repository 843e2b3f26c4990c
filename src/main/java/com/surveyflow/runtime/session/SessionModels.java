package com.surveyflow.runtime.session;

import com.surveyflow.runtime.domain.SurveyModels.JumpDestination;
import com.surveyflow.runtime.domain.SurveyModels.QuestionType;
import com.surveyflow.runtime.loop.LoopModels.LoopContext;
import com.surveyflow.runtime.loop.LoopModels.LoopPlan;

import java.time.Instant;
import java.util.*;

public class SessionModels {
    public enum SessionStatus { IN_PROGRESS, COMPLETED, TERMINATED }

    /**
     * Session-scoped render memory: loop plans by battery id and display orders by {@code entity:mode}.
     */
    public record SessionRenderState(Map<String, LoopPlan> loopPlans, Map<String, List<String>> orderCache) {
        public SessionRenderState {
            loopPlans = loopPlans == null ? Map.of() : loopPlans;
            orderCache = orderCache == null ? Map.of() : orderCache;
        }

        public static SessionRenderState initial() {
            return new SessionRenderState(Map.of(), Map.of());
        }
    }

    /**
     * Persisted value of one respondent session. Every runtime step reads one version and writes the
     * next; {@code version} is owned by the repository.
     */
    public record SessionState(String sessionId,
                               String surveyId,
                               long version,
                               SessionStatus status,
                               String currentPageId,
                               Map<String, List<String>> responses,
                               Map<String, String> embeddedData,
                               SessionRenderState renderState,
                               List<String> visitHistory,
                               String terminationReason,
                               Instant startedAt) {

        public SessionState {
            responses = responses == null ? Map.of() : responses;
            embeddedData = embeddedData == null ? Map.of() : embeddedData;
            renderState = renderState == null ? SessionRenderState.initial() : renderState;
            visitHistory = visitHistory == null ? List.of() : visitHistory;
        }

        public SessionState withVersion(long newVersion) {
            return new SessionState(sessionId, surveyId, newVersion, status, currentPageId, responses, embeddedData,
                    renderState, visitHistory, terminationReason, startedAt);
        }
    }

    public record ResolvedOption(String id, String value, String label, boolean carriedForward) {}

    public record ResolvedMatrixEntry(String id, String value, String label) {}

    /**
     * {@code rows} and {@code scales} are empty unless the question is a matrix.
     */
    public record ResolvedQuestion(String id, String variableName, QuestionType type, String title,
                                   List<ResolvedOption> options, List<ResolvedMatrixEntry> rows,
                                   List<ResolvedMatrixEntry> scales) {}

    public record ResolvedGroup(String id, String title, List<ResolvedQuestion> questions) {}

    public record ResolvedPage(String surveyId, String pageId, String title, boolean visible,
                               List<ResolvedGroup> groups, LoopContext loopContext) {}

    public record NavigationResult(String sessionId, SessionStatus status, String pageId, LoopContext loopContext,
                                   JumpDestination jump) {}

    public record AnswerResult(String sessionId, SessionStatus status, String questionId,
                               JumpDestination jump, boolean loopReset) {}
}
