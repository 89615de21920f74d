package com.complexity.analyzer.model;

import java.util.List;

/**
 * A recurrence extracted from a program, with its display form and the facts behind it.
 */
public class RecurrenceRelation {

    private final String identifier;
    private final String recurrenceText;
    private final String baseCase;
    private final List<String> notes;
    private final Recurrence recurrence;
    private final LoopStatistics statistics;

    public RecurrenceRelation(String identifier, Recurrence recurrence, String baseCase, List<String> notes,
                              LoopStatistics statistics) {
        this.identifier = identifier;
        this.recurrence = recurrence;
        this.recurrenceText = recurrence.toString();
        this.baseCase = baseCase;
        this.notes = List.copyOf(notes);
        this.statistics = statistics;
    }

    /**
     * @return the name of the procedure the recurrence describes
     */
    public String getIdentifier() {
        return identifier;
    }

    public String getRecurrenceText() {
        return recurrenceText;
    }

    public String getBaseCase() {
        return baseCase;
    }

    public List<String> getNotes() {
        return notes;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public LoopStatistics getStatistics() {
        return statistics;
    }
}
