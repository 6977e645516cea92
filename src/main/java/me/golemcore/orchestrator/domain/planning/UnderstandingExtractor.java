package me.golemcore.orchestrator.domain.planning;

import me.golemcore.orchestrator.domain.model.Understanding;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical heuristics that pull entities, constraints and success criteria out
 * of a user request. No language understanding is involved; the patterns only
 * recognize common phrasings.
 */
final class UnderstandingExtractor {

    private static final Pattern FILE_PATTERN = Pattern
            .compile("(?:^|[\\s,(\"'`])([a-zA-Z0-9_\\-./]+\\.[a-zA-Z]{2,4})(?=[\\s,.;:!?)\"'`]|$)");

    private static final Pattern NAMED_CLASS_PATTERN = Pattern
            .compile("\\b(?:(?i:the)\\s+)?([A-Z][a-zA-Z0-9]+)\\s+(?i:class|component|model)\\b");

    private static final Pattern PASCAL_CASE_PATTERN = Pattern.compile("\\b([A-Z][a-z]+(?:[A-Z][a-z]+)+)\\b");

    private static final Pattern FUNCTION_PATTERN = Pattern
            .compile("\\b([a-z][a-zA-Z0-9_]*)(?:\\s*\\(|\\s+function\\b)");

    private static final Set<String> FUNCTION_STOP_WORDS = Set.of("the", "a", "an", "this", "that");

    private static final List<Pattern> CONSTRAINT_PATTERNS = List.of(
            Pattern.compile("\\bwithout\\s+(?:breaking|changing|modifying)\\s+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bmust\\s+(?:not|keep|maintain)\\s+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdon't\\s+([^.]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpreserve\\s+([^.]+)", Pattern.CASE_INSENSITIVE));

    private UnderstandingExtractor() {
    }

    static Understanding.Entities extractEntities(String message) {
        Set<String> files = new LinkedHashSet<>();
        Matcher fileMatcher = FILE_PATTERN.matcher(message);
        while (fileMatcher.find()) {
            files.add(fileMatcher.group(1));
        }

        Set<String> classes = new LinkedHashSet<>();
        Matcher classMatcher = NAMED_CLASS_PATTERN.matcher(message);
        while (classMatcher.find()) {
            classes.add(classMatcher.group(1));
        }
        Matcher pascalMatcher = PASCAL_CASE_PATTERN.matcher(message);
        while (pascalMatcher.find()) {
            classes.add(pascalMatcher.group(1));
        }

        Set<String> functions = new LinkedHashSet<>();
        Matcher functionMatcher = FUNCTION_PATTERN.matcher(message);
        while (functionMatcher.find()) {
            String name = functionMatcher.group(1);
            if (!FUNCTION_STOP_WORDS.contains(name)) {
                functions.add(name);
            }
        }

        return new Understanding.Entities(new ArrayList<>(files), new ArrayList<>(classes),
                new ArrayList<>(functions));
    }

    static List<String> extractConstraints(String message) {
        Set<String> constraints = new LinkedHashSet<>();
        for (Pattern pattern : CONSTRAINT_PATTERNS) {
            Matcher matcher = pattern.matcher(message);
            while (matcher.find()) {
                constraints.add(matcher.group().trim());
            }
        }
        return new ArrayList<>(constraints);
    }

    static List<String> extractSuccessCriteria(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        List<String> criteria = new ArrayList<>();
        if (lower.contains("tests pass")) {
            criteria.add("tests pass");
        }
        if (lower.contains("no errors")) {
            criteria.add("no errors");
        }
        if (lower.contains("compile") || lower.contains("build")) {
            criteria.add("builds successfully");
        }
        if (lower.contains("works") || lower.contains("working")) {
            criteria.add("feature works as expected");
        }
        return criteria;
    }
}
