package me.golemcore.orchestrator.domain.recovery;

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

import me.golemcore.orchestrator.domain.model.Action;
import me.golemcore.orchestrator.domain.model.LoopType;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Detects unproductive patterns in the trailing window of an action log.
 *
 * <p>
 * Patterns are checked in fixed precedence:
 * <ol>
 * <li>alternation: the last 5 actions are A,B,A,B,A with A != B</li>
 * <li>repetition: the last 3 actions are identical</li>
 * <li>parameter similarity: the last 3 actions read the same file while
 * varying an offset-like parameter</li>
 * </ol>
 */
public final class LoopDetector {

    static final int REPETITION_WINDOW = 3;
    static final int ALTERNATION_WINDOW = 5;

    private static final Set<String> OFFSET_PARAMETERS = Set.of("offset", "limit", "start_line", "end_line");

    private LoopDetector() {
    }

    public static LoopType detect(List<Action> actions) {
        if (actions.size() < REPETITION_WINDOW) {
            return LoopType.NONE;
        }
        if (isAlternating(actions)) {
            return LoopType.ALTERNATION;
        }
        if (isRepeating(actions)) {
            return LoopType.REPETITION;
        }
        if (isParameterSimilar(actions)) {
            return LoopType.PARAMETER_SIMILARITY;
        }
        return LoopType.NONE;
    }

    private static boolean isAlternating(List<Action> actions) {
        if (actions.size() < ALTERNATION_WINDOW) {
            return false;
        }
        List<Action> window = tail(actions, ALTERNATION_WINDOW);
        String first = window.get(0).key();
        String second = window.get(1).key();
        if (first.equals(second)) {
            return false;
        }
        return window.get(2).key().equals(first)
                && window.get(3).key().equals(second)
                && window.get(4).key().equals(first);
    }

    private static boolean isRepeating(List<Action> actions) {
        List<Action> window = tail(actions, REPETITION_WINDOW);
        String last = window.get(window.size() - 1).key();
        return window.stream().allMatch(action -> action.key().equals(last));
    }

    private static boolean isParameterSimilar(List<Action> actions) {
        List<Action> window = tail(actions, REPETITION_WINDOW);
        String tool = window.get(0).tool();
        if (!ToolNames.READ_FILE.equals(tool) || window.stream().anyMatch(action -> !tool.equals(action.tool()))) {
            return false;
        }

        Object path = window.get(0).params().get("path");
        if (path == null || window.stream().anyMatch(action -> !path.equals(action.params().get("path")))) {
            return false;
        }

        for (String parameter : OFFSET_PARAMETERS) {
            Object firstValue = window.get(0).params().get(parameter);
            boolean varies = window.stream()
                    .anyMatch(action -> !Objects.equals(firstValue, action.params().get(parameter)));
            if (varies) {
                return true;
            }
        }
        return false;
    }

    private static List<Action> tail(List<Action> actions, int size) {
        return actions.subList(actions.size() - size, actions.size());
    }
}
