package com.gdin.inspection.gsw.pipeline.context;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StepResult {
    String step;
    Object result;
    /** set when the step threw; the run stops there */
    Exception error;

    public boolean failed() {
        return error != null;
    }
}
