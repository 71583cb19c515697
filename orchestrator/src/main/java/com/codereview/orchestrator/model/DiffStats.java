package com.codereview.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Line-level summary of the difference between the uploaded source and
 * the optimizer's fixed version.
 *
 * The common leading and trailing lines are matched first. The region in
 * between is measured with a longest-common-subsequence over lines, kept to
 * two rows of memory. When that region is too large for the quadratic pass
 * the unchanged count falls back to the number of lines the two sides share
 * regardless of order, which is an upper bound on the exact value.
 */
public record DiffStats(
        int    added,
        int    removed,
        int    unchanged,
        @JsonProperty("changed_ratio") double changedRatio
) {
    public static final DiffStats NONE = new DiffStats(0, 0, 0, 0.0);

    /** Largest middle region (lines x lines) compared exactly. */
    static final long MAX_EXACT_CELLS = 25_000_000L;

    public static DiffStats between(String original, String fixed) {
        List<String> a = lines(original);
        List<String> b = lines(fixed);

        int limit  = Math.min(a.size(), b.size());
        int prefix = 0;
        while (prefix < limit && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < limit - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }
        List<String> midA = a.subList(prefix, a.size() - suffix);
        List<String> midB = b.subList(prefix, b.size() - suffix);

        int common = (long) midA.size() * midB.size() > MAX_EXACT_CELLS
                ? sharedLines(midA, midB)
                : lcsLength(midA, midB);

        int unchanged = prefix + suffix + common;
        int removed   = a.size() - unchanged;
        int added     = b.size() - unchanged;
        int total     = Math.max(a.size(), b.size());
        double ratio  = total == 0 ? 0.0 : (double) Math.max(added, removed) / total;
        return new DiffStats(added, removed, unchanged, Math.round(ratio * 1000) / 1000.0);
    }

    private static int lcsLength(List<String> a, List<String> b) {
        int[] next = new int[b.size() + 1];
        int[] curr = new int[b.size() + 1];
        for (int i = a.size() - 1; i >= 0; i--) {
            curr[b.size()] = 0;
            for (int j = b.size() - 1; j >= 0; j--) {
                curr[j] = a.get(i).equals(b.get(j))
                        ? next[j + 1] + 1
                        : Math.max(next[j], curr[j + 1]);
            }
            int[] swap = next;
            next = curr;
            curr = swap;
        }
        return next[0];
    }

    private static int sharedLines(List<String> a, List<String> b) {
        Map<String, Integer> counts = new HashMap<>();
        for (String line : a) {
            counts.merge(line, 1, Integer::sum);
        }
        int shared = 0;
        for (String line : b) {
            Integer left = counts.get(line);
            if (left != null && left > 0) {
                counts.put(line, left - 1);
                shared++;
            }
        }
        return shared;
    }

    private static List<String> lines(String text) {
        if (text == null || text.isEmpty()) return List.of();
        return text.lines().toList();
    }
}
