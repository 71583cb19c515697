package com.codereview.orchestrator.stage;

import com.codereview.orchestrator.model.Stage;

/**
 * A stage failed. Carries the stage so the failure can be attributed in the
 * task's terminal error and in the failure notification.
 */
public class StageException extends RuntimeException {

    private final Stage stage;

    public StageException(Stage stage, String message) {
        super(stage.displayName() + " stage failed: " + message);
        this.stage = stage;
    }

    public StageException(Stage stage, Throwable cause) {
        super(stage.displayName() + " stage failed: " + describe(cause), cause);
        this.stage = stage;
    }

    public Stage getStage() { return stage; }

    private static String describe(Throwable cause) {
        String msg = cause.getMessage();
        return msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg;
    }
}
