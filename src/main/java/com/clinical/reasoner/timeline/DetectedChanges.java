package com.clinical.reasoner.timeline;

import com.clinical.reasoner.model.ChangeEvent;
import com.clinical.reasoner.model.Diagnostic;

import java.util.List;

/**
 * Ordered change events for every drug in a timeline, plus dose comparisons that could not be resolved
 */
public final class DetectedChanges {

    private final List<ChangeEvent> events;
    private final List<Diagnostic> diagnostics;

    public DetectedChanges(List<ChangeEvent> events, List<Diagnostic> diagnostics) {
        this.events = List.copyOf(events);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return All events, including continued ones, ordered by date then drug
     */
    public List<ChangeEvent> getEvents() {
        return events;
    }

    public List<ChangeEvent> getVisibleEvents() {
        return events.stream().filter(ChangeEvent::isVisible).toList();
    }

    public List<ChangeEvent> getEvents(String drugIdentity) {
        return events.stream().filter(e -> e.getDrugIdentity().equals(drugIdentity)).toList();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
