package com.gdin.inspection.gsw.pipeline.context;

import com.gdin.inspection.gsw.pipeline.BatchPipeline;
import com.gdin.inspection.gsw.pipeline.StepOutput;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs steps in order, timing each. A throwing step ends the run; its error is the last result.
 */
@Slf4j
public class RunBatchPipeline<C> {

    public List<StepResult> run(BatchPipeline<C> pipeline, C input, BatchRunContext context) {
        long start = System.nanoTime();
        List<StepResult> results = new ArrayList<>();
        String last = "<startup>";

        try {
            for (BatchPipeline.Step<C> step : pipeline) {
                last = step.getName();
                long t0 = System.nanoTime();

                StepOutput out = step.getFn().run(input, context);

                double sec = (System.nanoTime() - t0) / 1_000_000_000.0;
                context.getStats().getStepSeconds().put(last, sec);

                results.add(StepResult.builder()
                        .step(last)
                        .result(out == null ? null : out.getResult())
                        .build());

                if (out != null && out.isStop()) {
                    log.info("batch pipeline halted by step request: {}", last);
                    break;
                }
            }
        } catch (Exception e) {
            log.error("error running step {}: {}", last, e.getMessage());
            results.add(StepResult.builder()
                    .step(last)
                    .error(e)
                    .build());
        }
        context.getStats().setTotalSeconds((System.nanoTime() - start) / 1_000_000_000.0);
        return results;
    }
}
