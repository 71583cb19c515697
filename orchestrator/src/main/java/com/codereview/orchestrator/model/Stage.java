package com.codereview.orchestrator.model;

import java.util.List;

/**
 * The four stages of the review pipeline, in execution order.
 *
 * Each stage consumes the output of every stage before it, so the order
 * here is the order of execution. The ordinal doubles as the task's
 * stage cursor.
 */
public enum Stage {
    ARCHITECT("Architect"),   // Structural analysis of the uploaded file
    REVIEWER("Reviewer"),     // Bug, security and style findings, plus a quality score
    OPTIMIZER("Optimizer"),   // Produces the fixed source based on both reports
    SAVE("Save");             // Writes the fixed source next to its metadata

    public static final List<Stage> PIPELINE = List.of(values());

    private final String displayName;

    Stage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public int cursor() {
        return ordinal();
    }
}
