package com.gdin.inspection.gsw.mode;

public enum RunMode {
    /** commits are persisted and the cursor advances */
    PRODUCTION,
    /** identical merge logic on a throw-away copy; nothing is written */
    CALIBRATION
}
