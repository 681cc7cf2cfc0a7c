package com.gdin.inspection.gsw.state;

import lombok.Value;

/** documents {@code [from, to)} */
@Value
public class IndexRange {
    int from;
    int to;

    public int size() {
        return to - from;
    }
}
