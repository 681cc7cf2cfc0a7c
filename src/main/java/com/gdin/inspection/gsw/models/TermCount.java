package com.gdin.inspection.gsw.models;

import lombok.Value;

@Value
public class TermCount {
    TermKind kind;
    String term;
    long count;
}
