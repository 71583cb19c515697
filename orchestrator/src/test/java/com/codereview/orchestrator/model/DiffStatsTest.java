package com.codereview.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DiffStatsTest {

    @Test
    void between_identicalText_noChanges() {
        DiffStats stats = DiffStats.between("a\nb\nc", "a\nb\nc");

        assertThat(stats).isEqualTo(new DiffStats(0, 0, 3, 0.0));
    }

    @Test
    void between_oneLineReplaced_countsAddAndRemove() {
        DiffStats stats = DiffStats.between("a\nb\nc", "a\nB\nc");

        assertThat(stats.added()).isEqualTo(1);
        assertThat(stats.removed()).isEqualTo(1);
        assertThat(stats.unchanged()).isEqualTo(2);
        assertThat(stats.changedRatio()).isEqualTo(0.333);
    }

    @Test
    void between_linesInserted_onlyAdds() {
        DiffStats stats = DiffStats.between("a\nc", "a\nb\nc\nd");

        assertThat(stats.added()).isEqualTo(2);
        assertThat(stats.removed()).isZero();
        assertThat(stats.unchanged()).isEqualTo(2);
    }

    @Test
    void between_emptyOriginal_everythingAdded() {
        assertThat(DiffStats.between("", "x\ny")).isEqualTo(new DiffStats(2, 0, 0, 1.0));
        assertThat(DiffStats.between(null, null)).isEqualTo(DiffStats.NONE);
    }

    @Test
    void between_linesReorderedInMiddle_matchesLongestCommonSubsequence() {
        DiffStats stats = DiffStats.between("h\na\nb\nc\nt", "h\nc\na\nb\nt");

        assertThat(stats.unchanged()).isEqualTo(4);
        assertThat(stats.added()).isEqualTo(1);
        assertThat(stats.removed()).isEqualTo(1);
    }

    @Test
    void between_largeFileWithOneEdit_exactAfterTrimmingCommonEnds() {
        String original = numbered(100_000, -1);
        String fixed    = numbered(100_000, 50_000);

        DiffStats stats = DiffStats.between(original, fixed);

        assertThat(stats).isEqualTo(new DiffStats(1, 1, 99_999, 0.0));
    }

    @Test
    void between_largeFileWithScatteredEdits_staysBoundedAndCountsEdits() {
        String original = numbered(20_000, -1);
        StringBuilder fixed = new StringBuilder();
        for (int i = 0; i < 20_000; i++) {
            fixed.append(i % 100 == 50 ? "edited " : "line ").append(i).append('\n');
        }

        DiffStats stats = DiffStats.between(original, fixed.toString());

        assertThat(stats.added()).isEqualTo(200);
        assertThat(stats.removed()).isEqualTo(200);
        assertThat(stats.unchanged()).isEqualTo(19_800);
        assertThat(stats.changedRatio()).isEqualTo(0.01);
    }

    private static String numbered(int count, int editedLine) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < count; i++) {
            text.append(i == editedLine ? "edited " : "line ").append(i).append('\n');
        }
        return text.toString();
    }
}
