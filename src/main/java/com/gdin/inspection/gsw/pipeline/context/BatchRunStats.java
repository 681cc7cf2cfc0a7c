package com.gdin.inspection.gsw.pipeline.context;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@ToString
public class BatchRunStats {

    /** step name -> seconds, in execution order */
    private final Map<String, Double> stepSeconds = Collections.synchronizedMap(new LinkedHashMap<>());

    @Setter
    private double totalSeconds;
}
