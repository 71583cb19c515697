package com.codereview.orchestrator.stage.impl;

import com.codereview.orchestrator.llm.ChatClient;
import com.codereview.orchestrator.model.Stage;
import com.codereview.orchestrator.stage.StageContext;
import com.codereview.orchestrator.stage.StageResult;
import com.codereview.orchestrator.stage.StageRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for stages that are one round-trip to the chat model: build the user
 * message from the context, send it with the stage's system prompt, and
 * turn the reply into a {@link StageResult}.
 */
public abstract class LlmStageRunner implements StageRunner {

    private static final Logger log = LoggerFactory.getLogger(LlmStageRunner.class);

    private final ChatClient   chat;
    private final StagePrompts prompts;

    protected LlmStageRunner(ChatClient chat, StagePrompts prompts) {
        this.chat    = chat;
        this.prompts = prompts;
    }

    @Override
    public StageResult run(StageContext context) throws Exception {
        String reply = chat.complete(prompts.get(stage()), userMessage(context));
        log.info("{} stage received {} chars for task {}", stage().displayName(),
                reply == null ? 0 : reply.length(), context.taskId());
        if (reply == null || reply.isBlank()) {
            throw new IllegalStateException("model returned an empty reply");
        }
        return toResult(reply, context);
    }

    protected abstract String userMessage(StageContext context);

    protected abstract StageResult toResult(String reply, StageContext context);

    /** The uploaded file, fenced, with its name. */
    protected static String sourceBlock(StageContext context) {
        return "File: " + context.fileName() + "\n```\n" + context.originalContent() + "\n```\n";
    }

    /** A previous stage's report under a heading, or nothing if that stage has not run. */
    protected static String priorReport(StageContext context, Stage stage) {
        String report = context.report(stage);
        if (report.isBlank()) return "";
        return "=== " + stage.displayName().toUpperCase() + " REPORT ===\n" + report + "\n=== END ===\n\n";
    }
}
