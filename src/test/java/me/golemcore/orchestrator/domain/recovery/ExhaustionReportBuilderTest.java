package me.golemcore.orchestrator.domain.recovery;

import me.golemcore.orchestrator.domain.model.Action;
import me.golemcore.orchestrator.domain.model.ActionHistoryEntry;
import me.golemcore.orchestrator.domain.model.ErrorInfo;
import me.golemcore.orchestrator.domain.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExhaustionReportBuilderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void shouldReportLoopWithCountsAndGrepSuggestion() {
        ErrorRecoveryEngine engine = new ErrorRecoveryEngine(Clock.fixed(NOW, ZoneOffset.UTC));
        Action read = Action.of("read_file", Map.of("path", "a.ts"));
        engine.recordAction(read);
        engine.recordAction(read);
        engine.recordAction(read);

        String report = ExhaustionReportBuilder.build(engine);

        assertTrue(report.startsWith("I attempted to complete your request but encountered difficulties:"));
        assertTrue(report.contains("- Called read_file 3 times"));
        assertTrue(report.contains(ExhaustionReportBuilder.LOOP_ISSUE));
        assertTrue(report.contains("Try using grep"));
        assertTrue(report.endsWith("Would you like me to try that, or would you prefer to provide more guidance?"));
    }

    @Test
    void shouldReportLimitAndOnlyLastThreeFailures() {
        List<ActionHistoryEntry> history = List.of(
                failed("grep", "first"),
                failed("grep", "second"),
                failed("glob", "third"),
                failed("grep", "fourth"));

        String report = ExhaustionReportBuilder.build(history, false);

        assertTrue(report.contains(ExhaustionReportBuilder.LIMIT_ISSUE));
        assertFalse(report.contains("failed: first"));
        assertTrue(report.contains("- glob failed: third"));
        assertTrue(report.contains("- grep failed: fourth"));
        assertTrue(report.contains("Try reading the full file"));
    }

    @Test
    void shouldSummarizeInFirstUseOrder() {
        List<ActionHistoryEntry> history = List.of(
                succeeded("glob"), succeeded("read_file"), succeeded("glob"));

        assertEquals("- Called glob 2 times\n- Called read_file", ExhaustionReportBuilder.summarizeToolCalls(history));
        assertEquals("- No tool calls were made", ExhaustionReportBuilder.summarizeToolCalls(List.of()));
    }

    @Test
    void shouldPickSuggestionByLastTool() {
        assertEquals("Try a different approach or ask for clarification", ExhaustionReportBuilder.suggest(List.of()));
        assertTrue(ExhaustionReportBuilder.suggest(List.of(succeeded("edit_file"))).startsWith("Re-read the file"));
        assertTrue(ExhaustionReportBuilder.suggest(List.of(succeeded("bash"))).startsWith("Let me know"));
    }

    private static ActionHistoryEntry succeeded(String tool) {
        return ActionHistoryEntry.succeeded(Action.of(tool), NOW);
    }

    private static ActionHistoryEntry failed(String tool, String message) {
        return ActionHistoryEntry.failed(Action.of(tool), NOW, ErrorInfo.of(ErrorKind.NO_MATCHES, message));
    }
}
