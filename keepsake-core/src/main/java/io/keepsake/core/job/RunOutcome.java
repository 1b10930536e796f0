package io.keepsake.core.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Errors of a single run, grouped by the target they were raised for. A target with an
 * empty list succeeded.
 */
public final class RunOutcome {
    private final Map<String, List<String>> errorsByTarget = new LinkedHashMap<>();

    public void record(String target, List<String> errors) {
        errorsByTarget.merge(target, List.copyOf(errors), (existing, added) -> {
            if (added.isEmpty()) {
                return existing;
            }
            List<String> combined = new ArrayList<>(existing);
            combined.addAll(added);
            return List.copyOf(combined);
        });
    }

    public boolean successful() {
        return errorsByTarget.values().stream().allMatch(List::isEmpty);
    }

    public List<String> failedTargets() {
        return errorsByTarget.entrySet().stream()
            .filter(entry -> !entry.getValue().isEmpty())
            .map(Map.Entry::getKey)
            .toList();
    }

    public int errorCount() {
        return errorsByTarget.values().stream().mapToInt(List::size).sum();
    }

    public Map<String, List<String>> errorsByTarget() {
        return Collections.unmodifiableMap(errorsByTarget);
    }

    @Override
    public String toString() {
        return "RunOutcome" + errorsByTarget;
    }
}
