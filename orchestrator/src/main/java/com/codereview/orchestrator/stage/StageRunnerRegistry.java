package com.codereview.orchestrator.stage;

import com.codereview.orchestrator.model.Stage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static dispatch table from {@link Stage} to its {@link StageRunner}.
 *
 * Every {@code StageRunner} bean is collected at startup via constructor
 * injection. The table is checked once: a stage without a runner, or a
 * stage claimed by two runners, is a wiring error and fails startup.
 *
 * <p>Every execution is timed and counted:
 * <pre>
 *   codereview.stage.calls{stage, status="success|error"}
 *   codereview.stage.duration{stage}
 * </pre>
 */
@Component
public class StageRunnerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRunnerRegistry.class);

    private final Map<Stage, StageRunner> runners = new EnumMap<>(Stage.class);
    private final MeterRegistry meterRegistry;

    public StageRunnerRegistry(List<StageRunner> allRunners, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (StageRunner runner : allRunners) {
            StageRunner previous = runners.putIfAbsent(runner.stage(), runner);
            if (previous != null) {
                throw new IllegalStateException("Stage " + runner.stage() + " has two runners: "
                        + previous.getClass().getSimpleName() + " and " + runner.getClass().getSimpleName());
            }
            log.info("Registered runner {} for stage {}", runner.getClass().getSimpleName(), runner.stage());
        }
        for (Stage stage : Stage.PIPELINE) {
            if (!runners.containsKey(stage)) {
                throw new IllegalStateException("No runner registered for stage " + stage);
            }
        }
    }

    public StageRunner get(Stage stage) {
        return runners.get(stage);
    }

    /**
     * Run the stage's runner.
     *
     * @throws StageException wrapping whatever the runner threw
     */
    public StageResult execute(Stage stage, StageContext context) {
        StageRunner runner = runners.get(stage);
        String stageTag = stage.name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            StageResult result = runner.run(context);
            if (result == null) {
                throw new StageException(stage, "runner returned no result");
            }
            return result;
        } catch (StageException e) {
            status = "error";
            throw e;
        } catch (InterruptedException e) {
            status = "error";
            Thread.currentThread().interrupt();
            throw new StageException(stage, e);
        } catch (Exception e) {
            status = "error";
            throw new StageException(stage, e);
        } catch (Error e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("codereview.stage.duration", "stage", stageTag));
            meterRegistry.counter("codereview.stage.calls", "stage", stageTag, "status", status).increment();
        }
    }
}
