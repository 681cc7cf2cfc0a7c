package com.gdin.inspection.gsw.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateValue {
    private String value;
    private FuzzyDate date;
    /** case the value was asserted in */
    private String caseId;
    /** optional extraction confidence, only consulted by HIGHER_CONFIDENCE overlay */
    private Double confidence;

    public boolean hasTimestamp() {
        return date != null && date.isParsed();
    }
}
