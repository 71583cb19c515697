package com.codereview.orchestrator.stage.impl;

import com.codereview.orchestrator.llm.ChatClient;
import com.codereview.orchestrator.model.Stage;
import com.codereview.orchestrator.stage.StageContext;
import com.codereview.orchestrator.stage.StageResult;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Produces the fixed file. The reply must contain the whole file in one
 * fenced block; a reply without one fails the stage, since there is nothing
 * for the save stage to write.
 */
@Component
public class OptimizerStage extends LlmStageRunner {

    public OptimizerStage(ChatClient chat, StagePrompts prompts) {
        super(chat, prompts);
    }

    @Override
    public Stage stage() {
        return Stage.OPTIMIZER;
    }

    @Override
    protected String userMessage(StageContext context) {
        return priorReport(context, Stage.ARCHITECT)
                + priorReport(context, Stage.REVIEWER)
                + "Produce the corrected version of this file.\n\n" + sourceBlock(context);
    }

    @Override
    protected StageResult toResult(String reply, StageContext context) {
        String fixed = ResponseParser.extractCodeBlock(reply)
                .orElseThrow(() -> new IllegalStateException("reply contained no fenced code block"));
        String summary = ResponseParser.withoutCodeBlock(reply);
        return new StageResult(summary.isEmpty() ? "Code optimized" : summary, fixed,
                Map.of("line_count", fixed.lines().count()));
    }
}
