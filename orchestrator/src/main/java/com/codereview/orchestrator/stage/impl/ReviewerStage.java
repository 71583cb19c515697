package com.codereview.orchestrator.stage.impl;

import com.codereview.orchestrator.llm.ChatClient;
import com.codereview.orchestrator.model.Stage;
import com.codereview.orchestrator.stage.StageContext;
import com.codereview.orchestrator.stage.StageResult;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Bug, security and style review. The reply's QUALITY_SCORE line becomes
 * the {@code quality_score} metric; a reply without one scores 0.
 */
@Component
public class ReviewerStage extends LlmStageRunner {

    public ReviewerStage(ChatClient chat, StagePrompts prompts) {
        super(chat, prompts);
    }

    @Override
    public Stage stage() {
        return Stage.REVIEWER;
    }

    @Override
    protected String userMessage(StageContext context) {
        return priorReport(context, Stage.ARCHITECT)
                + "Review this file.\n\n" + sourceBlock(context);
    }

    @Override
    protected StageResult toResult(String reply, StageContext context) {
        double score = ResponseParser.extractQualityScore(reply).orElse(0.0);
        String report = ResponseParser.extractResult(reply).orElse(reply.strip());
        return new StageResult(report, null, Map.of(StageResult.QUALITY_SCORE, score));
    }
}
