package com.codereview.orchestrator.stage.impl;

import com.codereview.orchestrator.llm.ChatClient;
import com.codereview.orchestrator.model.Stage;
import com.codereview.orchestrator.stage.StageContext;
import com.codereview.orchestrator.stage.StageResult;
import org.springframework.stereotype.Component;

/** Structural analysis of the uploaded file. */
@Component
public class ArchitectStage extends LlmStageRunner {

    public ArchitectStage(ChatClient chat, StagePrompts prompts) {
        super(chat, prompts);
    }

    @Override
    public Stage stage() {
        return Stage.ARCHITECT;
    }

    @Override
    protected String userMessage(StageContext context) {
        return "Analyse the architecture of this file.\n\n" + sourceBlock(context);
    }

    @Override
    protected StageResult toResult(String reply, StageContext context) {
        return StageResult.of(ResponseParser.extractResult(reply).orElse(reply.strip()));
    }
}
