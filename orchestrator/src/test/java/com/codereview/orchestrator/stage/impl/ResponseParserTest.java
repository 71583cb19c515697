package com.codereview.orchestrator.stage.impl;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseParser is pure string handling, so no context and no mocks.
 */
class ResponseParserTest {

    // ------------------------------------------------------------------
    // extractCodeBlock
    // ------------------------------------------------------------------

    @Test
    void extractCodeBlock_withLanguageFence_returnsCode() {
        String response = """
                Here is the corrected file.
                ```python
                import os
                print(os.listdir('.'))
                ```
                """;
        Optional<String> code = ResponseParser.extractCodeBlock(response);
        assertThat(code).contains("import os\nprint(os.listdir('.'))");
    }

    @Test
    void extractCodeBlock_withUnlabelledFence_returnsCode() {
        String response = """
                ```
                x = 1 + 1
                ```
                """;
        assertThat(ResponseParser.extractCodeBlock(response)).contains("x = 1 + 1");
    }

    @Test
    void extractCodeBlock_withCppLabel_returnsCode() {
        String response = "```c++\nint main() { return 0; }\n```";
        assertThat(ResponseParser.extractCodeBlock(response)).contains("int main() { return 0; }");
    }

    @Test
    void extractCodeBlock_withMultipleFences_returnsFirst() {
        String response = """
                ```js
                first();
                ```
                ```js
                second();
                ```
                """;
        assertThat(ResponseParser.extractCodeBlock(response)).contains("first();");
    }

    @Test
    void extractCodeBlock_withNoFence_returnsEmpty() {
        assertThat(ResponseParser.extractCodeBlock("Nothing to change.")).isEmpty();
        assertThat(ResponseParser.extractCodeBlock(null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // extractResult
    // ------------------------------------------------------------------

    @Test
    void extractResult_withTag_returnsInnerText() {
        String response = "thinking...\n<result>\n  Two bugs found.\n</result>\ntrailing";
        assertThat(ResponseParser.extractResult(response)).contains("Two bugs found.");
    }

    @Test
    void extractResult_withoutTag_returnsEmpty() {
        assertThat(ResponseParser.extractResult("plain review text")).isEmpty();
    }

    // ------------------------------------------------------------------
    // extractQualityScore
    // ------------------------------------------------------------------

    @Test
    void extractQualityScore_upperCaseLine_parsed() {
        assertThat(ResponseParser.extractQualityScore("Summary...\nQUALITY_SCORE: 7.5\n"))
                .hasValue(7.5);
    }

    @Test
    void extractQualityScore_jsonStyleAndSpaces_parsed() {
        assertThat(ResponseParser.extractQualityScore("{\"quality_score\": 6}")).hasValue(6.0);
        assertThat(ResponseParser.extractQualityScore("Quality score = 8")).hasValue(8.0);
    }

    @Test
    void extractQualityScore_outOfRange_clampedToTen() {
        assertThat(ResponseParser.extractQualityScore("QUALITY_SCORE: 42")).hasValue(10.0);
    }

    @Test
    void extractQualityScore_missing_returnsEmpty() {
        assertThat(ResponseParser.extractQualityScore("looks fine")).isEmpty();
    }

    // ------------------------------------------------------------------
    // withoutCodeBlock
    // ------------------------------------------------------------------

    @Test
    void withoutCodeBlock_keepsSurroundingProse() {
        String response = "Renamed variables.\n```py\nx = 1\n```\nAdded docstring.";
        String summary = ResponseParser.withoutCodeBlock(response);
        assertThat(summary).contains("Renamed variables.").contains("Added docstring.");
        assertThat(summary).doesNotContain("x = 1");
    }
}
