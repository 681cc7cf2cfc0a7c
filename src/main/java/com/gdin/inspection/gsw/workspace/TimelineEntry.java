package com.gdin.inspection.gsw.workspace;

import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.FuzzyDate;
import lombok.Value;

@Value
public class TimelineEntry {

    Event event;

    /** name of the temporal marker entity the event points at */
    String when;

    FuzzyDate date;
}
