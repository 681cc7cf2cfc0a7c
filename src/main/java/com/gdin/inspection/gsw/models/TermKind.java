package com.gdin.inspection.gsw.models;

public enum TermKind {
    ROLE,
    VERB,
    STATE_KEY
}
