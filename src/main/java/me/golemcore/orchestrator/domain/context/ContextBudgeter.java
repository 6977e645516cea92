package me.golemcore.orchestrator.domain.context;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ContextItem;
import me.golemcore.orchestrator.domain.model.ContextTier;
import me.golemcore.orchestrator.domain.model.ContextType;
import me.golemcore.orchestrator.domain.model.ContextUsageStats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Selects which context fragments are sent to the language model within a
 * token budget.
 *
 * <p>
 * Items are tiered by their relation to the current task and selected greedily,
 * highest tier and most recently used first. A High-tier item that no longer
 * fits is truncated to the remaining budget when more than the truncation
 * threshold remains; lower-tier items that do not fit are dropped. The total
 * of the selected items never exceeds the budget.
 *
 * <p>
 * Token counts are a cheap heuristic, not a tokenizer: only their ordering and
 * approximate size are meaningful.
 *
 * <p>
 * Returned items are copies; mutating them has no effect on the budgeter.
 */
@Slf4j
public class ContextBudgeter {

    static final String TRUNCATION_MARKER = "... (truncated)";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int CHARS_PER_TOKEN = 4;
    private static final int SOURCE_MATCH_SCORE = 10;
    private static final int CONTENT_MATCH_SCORE = 5;
    private static final int TIER_SCORE = 100;
    private static final double MAX_RECENCY_PENALTY = 10.0;

    private static final Comparator<ContextItem> BY_RECENCY = Comparator
            .comparing(ContextItem::getLastAccessed, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private static final Comparator<ContextItem> BY_SCORE = Comparator
            .comparing(ContextItem::getRelevanceScore, Comparator.<Double>reverseOrder());

    private final Clock clock;
    private final int defaultBudget;
    private final int truncationThreshold;

    private final List<ContextItem> items = new ArrayList<>();
    private final List<String> filesUsed = new ArrayList<>();
    private final List<Integer> tokenUsage = new ArrayList<>();
    private int totalTurns;
    private int budget;

    public ContextBudgeter(Clock clock, int defaultBudget, int truncationThreshold) {
        if (defaultBudget < 0) {
            throw new IllegalArgumentException("Token budget must not be negative: " + defaultBudget);
        }
        this.clock = clock;
        this.defaultBudget = defaultBudget;
        this.truncationThreshold = truncationThreshold;
        this.budget = defaultBudget;
    }

    // ==================== Budget ====================

    public synchronized void setBudget(int budget) {
        if (budget < 0) {
            throw new IllegalArgumentException("Token budget must not be negative: " + budget);
        }
        this.budget = budget;
    }

    public synchronized int getBudget() {
        return budget;
    }

    /**
     * Heuristic token estimate: {@code max(1, ceil((words + chars / 4) / 2))},
     * and 0 for empty text.
     */
    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        long words = Arrays.stream(WHITESPACE.split(text)).filter(word -> !word.isEmpty()).count();
        double chars = text.length();
        return Math.max(1, (int) Math.ceil((words + chars / CHARS_PER_TOKEN) / 2));
    }

    public ContextTier classifyTier(ContextType type) {
        return ContextTier.forType(type);
    }

    // ==================== Items ====================

    /**
     * Stores a copy of the item with its tokens and tier derived from content
     * and type. A missing access time defaults to now.
     */
    public synchronized void addContext(ContextItem item) {
        ContextType type = item.getType() != null ? item.getType() : ContextType.OTHER;
        ContextItem stored = item.toBuilder()
                .content(item.getContent() != null ? item.getContent() : "")
                .type(type)
                .tokens(countTokens(item.getContent()))
                .tier(classifyTier(type))
                .lastAccessed(item.getLastAccessed() != null ? item.getLastAccessed() : clock.instant())
                .build();
        items.add(stored);
        log.debug("[Context] Added {} ({}, {} tokens)", stored.getSource(), stored.getTier(), stored.getTokens());
    }

    public synchronized List<ContextItem> getContext() {
        List<ContextItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparing((ContextItem item) -> item.getTier().getWeight()).reversed()
                .thenComparing(BY_RECENCY));

        List<ContextItem> selected = new ArrayList<>();
        int total = 0;
        for (ContextItem item : sorted) {
            if (total + item.getTokens() <= budget) {
                selected.add(item.toBuilder().build());
                total += item.getTokens();
                continue;
            }
            if (item.getTier() == ContextTier.HIGH) {
                int remaining = budget - total;
                if (remaining > truncationThreshold) {
                    selected.add(item.toBuilder()
                            .content(truncateToTokens(item.getContent(), remaining))
                            .tokens(remaining)
                            .build());
                    log.debug("[Context] Truncated {} to {} tokens", item.getSource(), remaining);
                }
                break;
            }
        }
        return selected;
    }

    public synchronized int getTotalTokens() {
        return getContext().stream().mapToInt(ContextItem::getTokens).sum();
    }

    /**
     * Renders the selected context as {@code === source ===} blocks.
     */
    public synchronized String getContextForAgent() {
        return getContext().stream()
                .map(item -> "=== " + item.getSource() + " ===\n" + item.getContent())
                .collect(Collectors.joining("\n\n"));
    }

    // ==================== Ranking ====================

    public synchronized List<ContextItem> rankByRelevance(String query) {
        List<String> words = queryWords(query);
        List<ContextItem> ranked = new ArrayList<>(items.size());
        for (ContextItem item : items) {
            ranked.add(item.toBuilder().relevanceScore((double) keywordScore(item, words)).build());
        }
        ranked.sort(BY_SCORE);
        return ranked;
    }

    public synchronized List<ContextItem> rankByRecency() {
        List<ContextItem> ranked = new ArrayList<>(items.size());
        for (ContextItem item : items) {
            ranked.add(item.toBuilder().build());
        }
        ranked.sort(BY_RECENCY);
        return ranked;
    }

    /**
     * Scores items by tier, keyword matches and a small penalty of one point
     * per minute since last access, capped at ten. Equal scores keep insertion
     * order.
     */
    public synchronized List<ContextItem> rankCombined(String query) {
        List<String> words = queryWords(query);
        Instant now = clock.instant();
        List<ContextItem> ranked = new ArrayList<>(items.size());
        for (ContextItem item : items) {
            double score = (double) item.getTier().getWeight() * TIER_SCORE + keywordScore(item, words);
            double minutes = Duration.between(item.getLastAccessed(), now).toMillis() / 60_000.0;
            score -= Math.min(MAX_RECENCY_PENALTY, Math.max(0.0, minutes));
            ranked.add(item.toBuilder().relevanceScore(score).build());
        }
        ranked.sort(BY_SCORE);
        return ranked;
    }

    // ==================== Usage ====================

    /**
     * Refreshes the access time of the first item with this source and records
     * the turn in the usage statistics. Selection is not otherwise affected.
     */
    public synchronized void markUsed(String source) {
        for (ContextItem item : items) {
            if (item.getSource() != null && item.getSource().equals(source)) {
                item.setLastAccessed(clock.instant());
                break;
            }
        }
        if (!filesUsed.contains(source)) {
            filesUsed.add(source);
        }
        totalTurns++;
        tokenUsage.add(getTotalTokens());
    }

    public synchronized ContextUsageStats getUsageStats() {
        return new ContextUsageStats(filesUsed, totalTurns, tokenUsage);
    }

    public synchronized void clear() {
        items.clear();
    }

    public synchronized void reset() {
        items.clear();
        budget = defaultBudget;
        filesUsed.clear();
        tokenUsage.clear();
        totalTurns = 0;
    }

    private static String truncateToTokens(String content, int maxTokens) {
        int maxChars = maxTokens * CHARS_PER_TOKEN;
        if (content.length() <= maxChars) {
            return content;
        }
        return content.substring(0, maxChars) + TRUNCATION_MARKER;
    }

    private static List<String> queryWords(String query) {
        if (query == null) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(query.toLowerCase(Locale.ROOT)))
                .filter(word -> !word.isEmpty())
                .toList();
    }

    private static int keywordScore(ContextItem item, List<String> words) {
        String source = item.getSource() != null ? item.getSource().toLowerCase(Locale.ROOT) : "";
        String content = item.getContent().toLowerCase(Locale.ROOT);
        int score = 0;
        for (String word : words) {
            if (source.contains(word)) {
                score += SOURCE_MATCH_SCORE;
            }
            if (content.contains(word)) {
                score += CONTENT_MATCH_SCORE;
            }
        }
        return score;
    }
}
