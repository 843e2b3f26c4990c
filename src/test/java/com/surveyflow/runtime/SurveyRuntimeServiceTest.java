package com.surveyflow.runtime;

import com.surveyflow.runtime.definition.SurveyDefinitionService;
import com.surveyflow.runtime.domain.SurveyModels.DestinationType;
import com.surveyflow.runtime.loop.LoopModels.LoopProgress;
import com.surveyflow.runtime.loop.LoopModels.LoopState;
import com.surveyflow.runtime.repository.SessionJdbcRepository;
import com.surveyflow.runtime.session.*;
import com.surveyflow.runtime.session.SessionModels.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SurveyRuntimeServiceTest {
    private static final String SURVEY = """
            @meta version="1" survey="coffee" title="Coffee habits"
            @expression id="drinks-coffee"
            anySelected('DRINKS', ['coffee'])
            @expression id="tea-only"
            noneSelected('DRINKS', ['coffee'])
            @expression id="is-minor"
            lessThan(answer('AGE'), 18)
            @expression id="vip"
            equals('panel', 'vip')

            @page id="intro" title="Welcome"
            @question id="age" type="number" var="AGE" terminate="is-minor"
            How old are you?
            @question id="drinks" type="multiple_choice" var="DRINKS"
            What do you drink?
            @option value="coffee" label="Coffee"
            @option value="tea" label="Tea"
            @jump id="tea-drinkers-leave" question="drinks" to="end" when="tea-only"
            @jump id="vip-shortcut" page="intro" to_page="outro" when="vip"

            @page id="brands" title="Brands" visible="drinks-coffee"
            @question id="brand" type="multiple_choice" var="BRANDS" order="random"
            Which brands do you buy?
            @option value="lav" label="Lavazza"
            @option value="ill" label="Illy"
            @option value="seg" label="Segafredo"

            @page id="rate-start" title="About {{loop.label}}"
            @question id="rating" type="number" var="RATING"
            Rate {{loop.label}} ({{loop.index}} of {{loop.total}})
            @page id="rate-end" title="More on {{loop.label}}"
            @question id="again" type="single_choice" var="AGAIN"
            Would you buy {{loop.label}} again?
            @option value="y" label="Yes"
            @option value="n" label="No"

            @page id="outro" title="Thanks"
            @question id="comment" type="text" var="COMMENT"
            You said ${pipe:question:BRANDS:text}. Anything else?
            @question id="favourite" type="single_choice" var="FAV" carry_forward="brand"
            Which one is your favourite?

            @loop id="brand-loop" name="Brand ratings" start="rate-start" end="rate-end" source="answer" question="brand"
            """;

    @Autowired
    private SurveyRuntimeService runtime;

    @Autowired
    private SurveyDefinitionService definitions;

    @Autowired
    private SessionJdbcRepository sessions;

    @BeforeEach
    void importSurvey() {
        var result = definitions.importSurvey(SURVEY, false);
        assertTrue(result.valid(), () -> result.errors().toString());
    }

    private String startOnBrands(List<String> brands) {
        String id = runtime.startSession("coffee", Map.of("panel", "north")).sessionId();
        runtime.submitAnswer(id, "age", List.of("30"));
        runtime.submitAnswer(id, "drinks", List.of("coffee"));
        assertEquals("brands", runtime.next(id).pageId());
        runtime.submitAnswer(id, "brand", brands);
        return id;
    }

    @Test
    void respondentRunsThroughAnswerLoop() {
        NavigationResult started = runtime.startSession("coffee", Map.of("panel", "north"));
        assertEquals("intro", started.pageId());
        assertEquals(SessionStatus.IN_PROGRESS, started.status());
        String id = started.sessionId();

        assertNull(runtime.submitAnswer(id, "age", List.of("30")).jump());
        assertNull(runtime.submitAnswer(id, "drinks", List.of("coffee")).jump());
        assertEquals("brands", runtime.next(id).pageId());
        runtime.submitAnswer(id, "brand", List.of("ill", "lav"));

        NavigationResult first = runtime.next(id);
        assertEquals("rate-start", first.pageId());
        assertEquals("ill", first.loopContext().item().key());
        assertEquals(2, first.loopContext().total());

        ResolvedPage rating = runtime.resolvePage(id, "rate-start");
        assertEquals("About Illy", rating.title());
        assertEquals("Rate Illy (1 of 2)", rating.groups().get(0).questions().get(0).title());

        assertEquals("rate-end", runtime.next(id).pageId());
        NavigationResult second = runtime.next(id);
        assertEquals("rate-start", second.pageId());
        assertEquals("lav", second.loopContext().item().key());

        LoopProgress progress = runtime.loopProgress(id, "brand-loop");
        assertEquals(LoopState.ITERATING, progress.state());
        assertEquals(2, progress.currentIteration());
        assertEquals(100, progress.percentComplete());

        assertEquals("rate-end", runtime.next(id).pageId());
        NavigationResult outro = runtime.next(id);
        assertEquals("outro", outro.pageId());
        assertNull(outro.loopContext());
        assertEquals(LoopState.DONE, runtime.loopProgress(id, "brand-loop").state());

        NavigationResult back = runtime.previous(id);
        assertEquals("rate-end", back.pageId());
        assertEquals("lav", back.loopContext().item().key());
        assertEquals("outro", runtime.next(id).pageId());

        NavigationResult done = runtime.next(id);
        assertEquals(SessionStatus.COMPLETED, done.status());
        assertNull(done.pageId());

        SessionState state = runtime.session(id);
        assertEquals(SessionStatus.COMPLETED, state.status());
        assertEquals("intro", state.visitHistory().get(0));
        assertEquals(List.of("ill", "lav"), state.responses().get("brand"));
    }

    @Test
    void outroPipesAndCarriesForwardSelectedBrands() {
        String id = startOnBrands(List.of("ill", "lav"));

        ResolvedPage outro = runtime.resolvePage(id, "outro");
        List<ResolvedQuestion> questions = outro.groups().get(0).questions();

        assertEquals("You said Illy, Lavazza. Anything else?", questions.get(0).title());
        assertEquals(List.of(
                        new ResolvedOption("cf:brand:ill", "ill", "Illy", true),
                        new ResolvedOption("cf:brand:lav", "lav", "Lavazza", true)),
                questions.get(1).options());
    }

    @Test
    void randomOptionOrderIsStableWithinSession() {
        String id = startOnBrands(List.of());

        List<String> first = runtime.resolvePage(id, "brands").groups().get(0).questions().get(0).options().stream()
                .map(ResolvedOption::value).toList();
        List<String> second = runtime.resolvePage(id, "brands").groups().get(0).questions().get(0).options().stream()
                .map(ResolvedOption::value).toList();

        assertEquals(first, second);
        assertEquals(3, first.size());
        assertTrue(first.containsAll(List.of("lav", "ill", "seg")));
        assertTrue(runtime.session(id).renderState().orderCache().containsKey("question:brand:RANDOM"));
    }

    @Test
    void hiddenPageResolvesWithoutContent() {
        String id = runtime.startSession("coffee", null).sessionId();

        ResolvedPage brands = runtime.resolvePage(id, "brands");
        assertFalse(brands.visible());
        assertTrue(brands.groups().isEmpty());
    }

    @Test
    void zeroSelectionsSkipTheLoop() {
        String id = startOnBrands(List.of());

        assertEquals("outro", runtime.next(id).pageId());
        assertEquals(LoopState.DONE, runtime.loopProgress(id, "brand-loop").state());
        assertEquals("brands", runtime.previous(id).pageId());
    }

    @Test
    void changingTheSourceAnswerReplansTheLoop() {
        String id = startOnBrands(List.of("ill", "lav"));
        assertEquals("ill", runtime.next(id).loopContext().item().key());

        AnswerResult changed = runtime.submitAnswer(id, "brand", List.of("seg"));
        assertTrue(changed.loopReset());
        assertFalse(runtime.session(id).renderState().loopPlans().containsKey("brand-loop"));

        assertEquals("About Segafredo", runtime.resolvePage(id, "rate-start").title());
        assertEquals(1, runtime.loopProgress(id, "brand-loop").totalIterations());
    }

    @Test
    void screenerTerminatesSession() {
        String id = runtime.startSession("coffee", Map.of()).sessionId();

        AnswerResult result = runtime.submitAnswer(id, "age", List.of("15"));
        assertEquals(SessionStatus.TERMINATED, result.status());

        SessionState state = runtime.session(id);
        assertEquals("question:age", state.terminationReason());
        assertNull(state.currentPageId());
        assertEquals(SessionStatus.TERMINATED, runtime.next(id).status());
    }

    @Test
    void jumpToEndCompletesSession() {
        String id = runtime.startSession("coffee", Map.of()).sessionId();

        AnswerResult answer = runtime.submitAnswer(id, "drinks", List.of("tea"));
        assertEquals(DestinationType.END, answer.jump().type());

        NavigationResult result = runtime.next(id);
        assertEquals(SessionStatus.COMPLETED, result.status());
        assertEquals(DestinationType.END, result.jump().type());
        assertNull(runtime.session(id).currentPageId());
    }

    @Test
    void pageJumpReadsEmbeddedData() {
        String vip = runtime.startSession("coffee", Map.of("panel", "vip")).sessionId();
        runtime.submitAnswer(vip, "drinks", List.of("coffee"));
        NavigationResult jumped = runtime.next(vip);
        assertEquals("outro", jumped.pageId());
        assertEquals(DestinationType.PAGE, jumped.jump().type());

        String anonymous = runtime.startSession("coffee", null).sessionId();
        runtime.submitAnswer(anonymous, "drinks", List.of("coffee"));
        NavigationResult regular = runtime.next(anonymous);
        assertEquals("brands", regular.pageId());
        assertNull(regular.jump());
    }

    @Test
    void endPageJumpWaitsForLastIteration() {
        String doc = """
                @meta version="1" survey="store-visits" title="Store visits"
                @page id="p1"
                @page id="p2" title="Visit to {{loop.label}}"
                @page id="p3"
                @page id="p4"
                @page id="p5"
                @loop id="stores" start="p2" end="p3" source="dataset"
                @item key="A" sort="1" label="Alpha"
                @item key="B" sort="2" label="Beta"
                @jump id="after-stores" page="p3" to_page="p5"
                """;
        var imported = definitions.importSurvey(doc, false);
        assertTrue(imported.valid(), () -> imported.errors().toString());

        String id = runtime.startSession("store-visits", Map.of()).sessionId();
        NavigationResult first = runtime.next(id);
        assertEquals("p2", first.pageId());
        assertEquals("A", first.loopContext().item().key());
        assertEquals("p3", runtime.next(id).pageId());

        NavigationResult second = runtime.next(id);
        assertEquals("p2", second.pageId());
        assertEquals("B", second.loopContext().item().key());
        assertNull(second.jump());
        assertEquals("p3", runtime.next(id).pageId());

        NavigationResult jumped = runtime.next(id);
        assertEquals("p5", jumped.pageId());
        assertEquals(DestinationType.PAGE, jumped.jump().type());
        assertEquals(LoopState.DONE, runtime.loopProgress(id, "stores").state());
    }

    @Test
    void matrixRowsFollowTheirVisibilityConditions() {
        String doc = """
                @meta version="1" survey="mobility-grid" title="Mobility"
                @expression id="owns-car"
                anySelected('OWN', ['car'])
                @page id="p1"
                @question id="own" type="multiple_choice" var="OWN"
                What do you own?
                @option value="car" label="Car"
                @option value="bike" label="Bike"
                @page id="p2"
                @question id="grid" type="matrix_single" var="GRID"
                Rate your options
                @row value="price" label="Price"
                @row value="fuel" label="Fuel cost" visible="owns-car"
                @scale value="1" label="Poor"
                @scale value="5" label="Great"
                """;
        var imported = definitions.importSurvey(doc, false);
        assertTrue(imported.valid(), () -> imported.errors().toString());

        String id = runtime.startSession("mobility-grid", Map.of()).sessionId();
        runtime.submitAnswer(id, "own", List.of("bike"));
        ResolvedQuestion grid = runtime.resolvePage(id, "p2").groups().get(0).questions().get(0);
        assertEquals(List.of(new ResolvedMatrixEntry("grid:row:price", "price", "Price")), grid.rows());
        assertEquals(List.of("Poor", "Great"), grid.scales().stream().map(ResolvedMatrixEntry::label).toList());
        assertTrue(grid.options().isEmpty());

        runtime.submitAnswer(id, "own", List.of("car", "bike"));
        List<String> rows = runtime.resolvePage(id, "p2").groups().get(0).questions().get(0).rows().stream()
                .map(ResolvedMatrixEntry::value).toList();
        assertEquals(List.of("price", "fuel"), rows);

        ResolvedQuestion own = runtime.resolvePage(id, "p1").groups().get(0).questions().get(0);
        assertTrue(own.rows().isEmpty());
        assertTrue(own.scales().isEmpty());
    }

    @Test
    void staleVersionLosesTheSwap() {
        String id = runtime.startSession("coffee", Map.of()).sessionId();
        SessionState read = runtime.session(id);

        assertTrue(sessions.compareAndSwap(read, read.version()));
        assertFalse(sessions.compareAndSwap(read, read.version()));
        assertEquals(read.version() + 1, runtime.session(id).version());

        runtime.submitAnswer(id, "age", List.of("40"));
        assertEquals(read.version() + 2, runtime.session(id).version());
    }

    @Test
    void unknownIdsAreReported() {
        String id = runtime.startSession("coffee", Map.of()).sessionId();

        assertThrows(SessionNotFoundException.class, () -> runtime.session("missing"));
        assertThrows(SurveyNotFoundException.class, () -> runtime.startSession("no-such-survey", Map.of()));
        assertThrows(PageNotFoundException.class, () -> runtime.resolvePage(id, "ghost"));
        assertThrows(QuestionNotFoundException.class, () -> runtime.submitAnswer(id, "ghost", List.of("x")));
        assertThrows(BatteryNotFoundException.class, () -> runtime.loopProgress(id, "ghost"));
    }
}
