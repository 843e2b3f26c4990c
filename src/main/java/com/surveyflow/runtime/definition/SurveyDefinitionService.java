package com.surveyflow.runtime.definition;

import com.surveyflow.runtime.domain.SurveyModels.*;
import com.surveyflow.runtime.parser.ParserDtos;
import com.surveyflow.runtime.parser.SurveyDocParser;
import com.surveyflow.runtime.repository.DefinitionJdbcRepository;
import com.surveyflow.runtime.session.SurveyNotFoundException;
import com.surveyflow.runtime.validation.SurveyDocValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class SurveyDefinitionService {
    private static final Logger log = LoggerFactory.getLogger(SurveyDefinitionService.class);

    private final SurveyDocParser parser;
    private final SurveyDocValidator validator;
    private final DefinitionJdbcRepository repository;

    private final Map<String, SurveyDefinition> definitions = new ConcurrentHashMap<>();

    public SurveyDefinitionService(SurveyDocParser parser,
                                   SurveyDocValidator validator,
                                   DefinitionJdbcRepository repository) {
        this.parser = parser;
        this.validator = validator;
        this.repository = repository;
    }

    public ImportResult importSurvey(String content, boolean dryRun) {
        SurveyDocParser.ParseResult parseResult = parser.parse(content);
        List<ParserDtos.ParseError> errors = new ArrayList<>(parseResult.errors());
        errors.addAll(validator.validate(parseResult.doc()));

        if (!errors.isEmpty()) {
            log.info("Survey {} rejected with {} authoring errors", parseResult.doc().surveyId(), errors.size());
            return new ImportResult(dryRun, false, null, errors);
        }

        SurveyDefinition definition = toDomain(parseResult.doc());
        if (!dryRun) {
            repository.save(definition.id(), definition.version(), definition.title(), content);
            definitions.put(definition.id(), definition);
            log.info("Survey {} version {} imported: {} pages, {} questions, {} loops",
                    definition.id(), definition.version(), definition.pages().size(),
                    definition.questions().size(), definition.batteries().size());
        }
        return new ImportResult(dryRun, true, Summary.of(definition), errors);
    }

    public SurveyDefinition definition(String surveyId) {
        SurveyDefinition cached = definitions.get(surveyId);
        if (cached != null) return cached;

        DefinitionJdbcRepository.StoredDefinition stored = repository.find(surveyId)
                .orElseThrow(() -> new SurveyNotFoundException(surveyId));
        SurveyDocParser.ParseResult parsed = parser.parse(stored.content());
        if (!parsed.errors().isEmpty()) {
            throw new IllegalStateException("Stored survey " + surveyId + " no longer parses: " + parsed.errors());
        }
        SurveyDefinition definition = toDomain(parsed.doc());
        definitions.put(surveyId, definition);
        return definition;
    }

    public List<String> surveyIds() {
        return repository.surveyIds();
    }

    private SurveyDefinition toDomain(ParserDtos.SurveyDoc doc) {
        List<Expression> expressions = doc.expressions().stream()
                .map(e -> new Expression(e.id(), e.dsl()))
                .toList();

        List<Page> pages = doc.pages().stream()
                .map(p -> new Page(p.id(), p.index(), p.title(), p.visibleIf(), mode(p.questionOrder()), mode(p.groupOrder())))
                .toList();

        List<QuestionGroup> groups = doc.groups().stream()
                .map(g -> new QuestionGroup(g.id(), g.pageId(), g.index(), g.title(), g.visibleIf(), mode(g.order())))
                .toList();

        List<Question> questions = doc.questions().stream()
                .map(q -> new Question(q.id(), q.pageId(), q.groupId(), q.index(), q.variableName(),
                        QuestionType.valueOf(q.type().toUpperCase(Locale.ROOT)), q.title(), mode(q.optionOrder()),
                        q.visibleIf(), q.carryForwardQuestionId(), q.terminateIf()))
                .toList();

        List<Option> options = doc.options().stream()
                .map(o -> new Option(o.id(), o.questionId(), o.index(), o.value(), o.label(), o.visibleIf(), o.groupKey(), o.weight()))
                .toList();

        List<JumpRule> jumps = doc.jumps().stream()
                .map(j -> new JumpRule(j.id(), j.fromQuestionId(), j.fromPageId(), destination(j), j.when(), j.priority()))
                .toList();

        List<LoopBattery> batteries = doc.loops().stream()
                .map(l -> new LoopBattery(l.id(), l.name(), l.startPageId(), l.endPageId(),
                        LoopSourceType.valueOf(l.source().toUpperCase(Locale.ROOT)), l.sourceQuestionId(),
                        l.maxItems(), l.randomize(), l.sampleWithoutReplacement()))
                .toList();

        List<LoopDatasetItem> items = doc.items().stream()
                .map(i -> new LoopDatasetItem(i.loopId(), i.key(), Map.copyOf(i.attributes()), i.active(), i.sortIndex()))
                .toList();

        List<MatrixEntry> matrix = doc.matrix().stream()
                .map(m -> new MatrixEntry(m.id(), m.questionId(), MatrixAxis.valueOf(m.axis().toUpperCase(Locale.ROOT)),
                        m.index(), m.value(), m.label(), m.visibleIf()))
                .toList();

        return SurveyDefinition.of(doc.surveyId(), doc.version(), doc.title(), pages, groups, questions, options,
                expressions, jumps, batteries, items, matrix);
    }

    private OrderMode mode(String raw) {
        return raw == null ? OrderMode.SEQUENTIAL : OrderMode.valueOf(raw.toUpperCase(Locale.ROOT));
    }

    private JumpDestination destination(ParserDtos.JumpDoc jump) {
        if (jump.toEnd()) return JumpDestination.end();
        if (jump.toPageId() != null) return new JumpDestination(DestinationType.PAGE, jump.toPageId());
        return new JumpDestination(DestinationType.QUESTION, jump.toQuestionId());
    }

    public record Summary(String surveyId, String version, String title, int pages, int questions, int loops) {
        static Summary of(SurveyDefinition definition) {
            return new Summary(definition.id(), definition.version(), definition.title(), definition.pages().size(),
                    definition.questions().size(), definition.batteries().size());
        }
    }

    public record ImportResult(boolean dryRun,
                               boolean valid,
                               Summary survey,
                               List<ParserDtos.ParseError> errors) {
    }
}
