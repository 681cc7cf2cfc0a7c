package com.gdin.inspection.gsw.extraction;

import lombok.Value;

@Value
public class SourceDocument {
    String caseId;
    String text;
}
