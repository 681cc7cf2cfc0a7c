package com.gdin.inspection.gsw.pipeline;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StepOutput {
    Object result;
    /** skip the remaining steps */
    @Builder.Default
    boolean stop = false;

    public static StepOutput of(Object result) {
        return StepOutput.builder().result(result).build();
    }
}
