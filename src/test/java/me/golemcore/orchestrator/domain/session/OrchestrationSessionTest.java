package me.golemcore.orchestrator.domain.session;

import me.golemcore.orchestrator.domain.model.ActionHistoryEntry;
import me.golemcore.orchestrator.domain.model.ErrorInfo;
import me.golemcore.orchestrator.domain.model.ErrorKind;
import me.golemcore.orchestrator.domain.model.ExecutionPlan;
import me.golemcore.orchestrator.domain.model.ToolErrorCode;
import me.golemcore.orchestrator.domain.model.ToolExecutionContext;
import me.golemcore.orchestrator.domain.model.ToolParameters;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.service.ToolExecutionService;
import me.golemcore.orchestrator.domain.service.ToolRegistryService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.IntentClassifierPort;
import me.golemcore.orchestrator.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestrationSessionTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private ToolRegistryService registry;
    private OrchestratorProperties properties;
    private OrchestrationSessionFactory factory;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistryService();
        properties = new OrchestratorProperties();
        properties.getContext().setTokenBudget(1200);
        ToolExecutionService executor = new ToolExecutionService(registry,
                ToolExecutionContext.builder().workingDirectory(Path.of("/workspace")).build(), properties);
        factory = new OrchestrationSessionFactory(properties, Clock.fixed(NOW, ZoneOffset.UTC), executor,
                new StaticListableBeanFactory().getBeanProvider(IntentClassifierPort.class));
    }

    @Test
    void shouldCreateIndependentSessions() {
        OrchestrationSession first = factory.create();
        OrchestrationSession second = factory.create();

        assertNotEquals(first.getId(), second.getId());
        assertNotSame(first.getRecoveryEngine(), second.getRecoveryEngine());
        assertNotSame(first.getSearchCache(), second.getSearchCache());
        assertEquals(1200, first.getContextBudgeter().getBudget());
        assertEquals(16, first.getIterationGuard().getMaxIterations());
        assertEquals("session-1", factory.create("session-1").getId());
    }

    @Test
    void shouldPlanWithDefaultTemplateWithoutClassifier() {
        OrchestrationSession session = factory.create();

        ExecutionPlan plan = session.getTaskPlanner().plan(
                session.getTaskPlanner().understand("implement login"), "implement login");

        assertEquals(2, plan.getSteps().size());
    }

    @Test
    void shouldServeRepeatedGlobFromCache() {
        StubTool glob = StubTool.returning("glob", List.of("src/a.ts"));
        registry.register(glob);
        OrchestrationSession session = factory.create();

        ToolResult first = session.executeTool("glob", ToolParameters.of("pattern", "**/*.ts", "path", "src"));
        ToolResult second = session.executeTool("glob", ToolParameters.of("path", "src", "pattern", "**/*.ts"));

        assertEquals(1, glob.getCalls().size());
        assertTrue(second.isSuccess());
        assertEquals(first.getData(), second.getData());
        assertEquals(1, session.getSearchCache().getStats().hits());
        assertEquals(2, session.getRecoveryEngine().getHistory().size());
        assertEquals(2, session.getIterationGuard().getIterations());
    }

    @Test
    void shouldNotCacheFailedGrep() {
        StubTool grep = new StubTool("grep", (params, ctx) -> CompletableFuture
                .completedFuture(ToolResult.failure(ErrorKind.NO_MATCHES.name(), "No matches for foo")));
        registry.register(grep);
        OrchestrationSession session = factory.create();

        session.executeTool("grep", ToolParameters.of("pattern", "foo"));
        session.executeTool("grep", ToolParameters.of("pattern", "foo"));

        assertEquals(2, grep.getCalls().size());
        assertEquals(0, session.getGrepCache().size());
        List<ActionHistoryEntry> history = session.getRecoveryEngine().getHistory();
        assertFalse(history.get(0).success());
        assertEquals(ErrorKind.NO_MATCHES, history.get(0).error().type());
        assertEquals(2, session.getRecoveryEngine().getFailureCount());
    }

    @Test
    void shouldNotCacheReads() {
        StubTool read = StubTool.returning("read_file", "content");
        registry.register(read);
        OrchestrationSession session = factory.create();

        session.executeTool("read_file", ToolParameters.of("path", "a.ts"));
        session.executeTool("read_file", ToolParameters.of("path", "a.ts"));

        assertEquals(2, read.getCalls().size());
    }

    @Test
    void shouldReportExhaustionOnLoop() {
        registry.register(StubTool.returning("read_file", "content"));
        OrchestrationSession session = factory.create();

        for (int i = 0; i < 3; i++) {
            session.executeTool("read_file", ToolParameters.of("path", "a.ts"));
        }

        assertTrue(session.isExhausted());
        String report = session.buildExhaustionReport();
        assertTrue(report.contains("- Called read_file 3 times"));
        assertTrue(report.contains("Loop detected"));
    }

    @Test
    void shouldReportExhaustionOnIterationLimit() {
        registry.register(StubTool.returning("glob", List.of()));
        OrchestrationSession session = factory.create();

        for (int i = 0; i < 16; i++) {
            session.executeTool("glob", ToolParameters.of("pattern", "*." + i));
        }

        assertTrue(session.isExhausted());
        assertTrue(session.buildExhaustionReport().contains("Iteration limit reached"));

        session.startNewTurn();

        assertEquals(0, session.getIterationGuard().getIterations());
        assertFalse(session.getIterationGuard().isLimitReached());
    }

    @Test
    void shouldRecordUnknownToolAsFailure() {
        OrchestrationSession session = factory.create();

        ToolResult result = session.executeTool("missing", ToolParameters.empty());

        assertTrue(result.hasErrorCode(ToolErrorCode.TOOL_NOT_FOUND));
        assertEquals(1, session.getRecoveryEngine().getFailureCount());
        assertEquals(ErrorKind.UNKNOWN, session.getRecoveryEngine().getHistory().get(0).error().type());
    }

    @Test
    void shouldReturnNotFoundForBlankOrMissingToolName() {
        registry.register(StubTool.returning("glob", List.of()));
        OrchestrationSession session = factory.create();

        ToolResult blank = session.executeTool("", ToolParameters.empty());
        ToolResult missing = session.executeTool(null, ToolParameters.of("pattern", "*.ts"));

        assertTrue(blank.hasErrorCode(ToolErrorCode.TOOL_NOT_FOUND));
        assertTrue(missing.hasErrorCode(ToolErrorCode.TOOL_NOT_FOUND));
        assertEquals(2, session.getRecoveryEngine().getFailureCount());
        assertEquals(OrchestrationSession.UNNAMED_TOOL,
                session.getRecoveryEngine().getHistory().get(0).action().tool());
        assertEquals(2, session.getIterationGuard().getIterations());
        assertEquals(0, session.getSearchCache().size());
    }

    @Test
    void shouldReturnCopyOnCacheHit() {
        registry.register(StubTool.returning("grep", List.of("a.ts:1: foo")));
        OrchestrationSession session = factory.create();

        ToolResult first = session.executeTool("grep", ToolParameters.of("pattern", "foo"));
        ToolResult second = session.executeTool("grep", ToolParameters.of("pattern", "foo"));
        ToolResult stored = session.getGrepCache().get("grep:{\"pattern\":\"foo\"}").orElseThrow();

        assertNotSame(stored, second);
        assertSame(first, stored);
        assertEquals(first.getData(), second.getData());
        assertNotNull(second.getMetadata());
        assertTrue(second.getMetadata().getExecutionTimeMs() >= 0);
    }

    @Test
    void shouldMapToolErrorsToErrorKinds() {
        assertEquals(ErrorInfo.of(ErrorKind.TIMEOUT, "slow"),
                OrchestrationSession.toErrorInfo(ToolResult.failure(ToolErrorCode.TIMEOUT, "slow")));
        assertEquals(ErrorKind.FILE_NOT_FOUND,
                OrchestrationSession.toErrorInfo(ToolResult.failure("FILE_NOT_FOUND", "gone")).type());
        assertEquals(ErrorKind.UNKNOWN,
                OrchestrationSession.toErrorInfo(ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, "x")).type());
        assertEquals(ErrorKind.UNKNOWN,
                OrchestrationSession.toErrorInfo(ToolResult.builder().success(false).build()).type());
    }

    @Test
    void shouldUseConfiguredClassifier() {
        StaticListableBeanFactory beans = new StaticListableBeanFactory(
                Map.<String, Object>of("classifier", (IntentClassifierPort) message -> "debug"));
        OrchestrationSessionFactory classifying = new OrchestrationSessionFactory(properties,
                Clock.fixed(NOW, ZoneOffset.UTC), new ToolExecutionService(registry,
                        ToolExecutionContext.builder().build(), properties),
                beans.getBeanProvider(IntentClassifierPort.class));

        OrchestrationSession session = classifying.create();

        assertEquals("debug", session.getTaskPlanner().understand("fix it").intent());
    }
}
