package com.codereview.orchestrator.stage.impl;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured pieces out of free-form model replies:
 *   1. fenced code blocks: the optimizer's fixed source
 *   2. <result> tags     : an optional explicit final answer
 *   3. quality scores    : the reviewer's 0–10 rating
 */
public class ResponseParser {

    // Matches ```lang ... ``` or ``` ... ``` (language label optional)
    private static final Pattern CODE_BLOCK = Pattern.compile(
            "```[\\w+#.-]*[ \\t]*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // "QUALITY_SCORE: 7.5", "Quality score = 8/10", "\"quality_score\": 6"
    private static final Pattern QUALITY_SCORE = Pattern.compile(
            "quality[ _]score\"?\\s*[:=]\\s*(\\d+(?:\\.\\d+)?)",
            Pattern.CASE_INSENSITIVE
    );

    public static final double MAX_SCORE = 10.0;

    private ResponseParser() {}

    /** The first fenced code block, stripped of surrounding blank lines. */
    public static Optional<String> extractCodeBlock(String response) {
        if (response == null) return Optional.empty();
        Matcher m = CODE_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** Content of the first {@code <result>...</result>} tag. */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** The first quality score in the reply, clamped to [0, 10]. */
    public static OptionalDouble extractQualityScore(String response) {
        if (response == null) return OptionalDouble.empty();
        Matcher m = QUALITY_SCORE.matcher(response);
        if (!m.find()) return OptionalDouble.empty();
        double score = Double.parseDouble(m.group(1));
        return OptionalDouble.of(Math.max(0.0, Math.min(MAX_SCORE, score)));
    }

    /** The reply with its first code block removed; used as the optimizer's summary. */
    public static String withoutCodeBlock(String response) {
        if (response == null) return "";
        return CODE_BLOCK.matcher(response).replaceFirst("").strip();
    }
}
