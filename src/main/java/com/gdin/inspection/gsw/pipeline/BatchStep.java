package com.gdin.inspection.gsw.pipeline;

import com.gdin.inspection.gsw.pipeline.context.BatchRunContext;

@FunctionalInterface
public interface BatchStep<C> {
    StepOutput run(C input, BatchRunContext context) throws Exception;
}
