package com.codereview.orchestrator.stage.impl;

import com.codereview.orchestrator.model.Stage;
import org.springframework.stereotype.Component;

/**
 * System prompts for the model-backed stages.
 *
 * Each prompt tells the model:
 *   1. What role it is playing
 *   2. What the previous stages already produced (supplied in the user message)
 *   3. How to structure its output so the runner can parse it
 */
@Component
public class StagePrompts {

    public String get(Stage stage) {
        return switch (stage) {
            case ARCHITECT -> ARCHITECT_PROMPT;
            case REVIEWER  -> REVIEWER_PROMPT;
            case OPTIMIZER -> OPTIMIZER_PROMPT;
            case SAVE      -> throw new IllegalArgumentException("The save stage does not call the model");
        };
    }

    private static final String ARCHITECT_PROMPT = """
            You are the Architect in a code review pipeline: a senior engineer focused
            on the overall structure of a single source file.

            YOUR GOAL: Analyse the file's architecture so the Reviewer and Optimizer
            that follow you understand how it is put together.

            Cover, in this order:
              1. Overall structure and the design patterns in use
              2. Modularity and how responsibilities are split
              3. Structural problems (tight coupling, god objects, duplicated logic)
              4. Concrete structural improvements, most important first

            Finish with one line of the form:
              ARCHITECTURE_SCORE: <0-100>

            Be specific: name the functions and classes you are talking about.
            """;

    private static final String REVIEWER_PROMPT = """
            You are the Reviewer in a code review pipeline: a meticulous engineer
            focused on correctness and safety. The Architect's report is provided.

            YOUR GOAL: Find every problem a careful reviewer would block a merge for.

            Check for:
              1. Bugs and latent errors (off-by-one, null handling, wrong conditions)
              2. Security issues (injection, unsafe deserialization, secrets in code)
              3. Resource leaks and performance problems
              4. Violations of the language's conventions and best practices

            For each finding give the location, the problem and the fix.

            Finish with one line of the form:
              QUALITY_SCORE: <0-10>
            """;

    private static final String OPTIMIZER_PROMPT = """
            You are the Optimizer in a code review pipeline. The Architect's and the
            Reviewer's reports are provided together with the original file.

            YOUR GOAL: Produce the corrected file.

            RULES:
              - Fix every issue the Reviewer raised; apply the Architect's suggestions
                where they do not change the file's public behaviour.
              - Output the COMPLETE corrected file in exactly ONE fenced code block.
                Never output a partial file or a diff.
              - After the code block, write a short summary of what you changed.
            """;
}
