package com.codereview.orchestrator.stage;

import com.codereview.orchestrator.model.Stage;

/**
 * Performs the work of one pipeline stage.
 *
 * Runners are stateless with respect to the orchestrator: everything they
 * need arrives in the {@link StageContext}. Exactly one runner is registered
 * per {@link Stage}; see {@link StageRunnerRegistry}.
 *
 * Retry policy, if any, belongs inside the runner. The orchestrator treats
 * any exception as a final failure of the stage.
 */
public interface StageRunner {

    Stage stage();

    StageResult run(StageContext context) throws Exception;
}
