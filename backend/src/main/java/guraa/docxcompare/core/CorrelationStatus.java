package guraa.docxcompare.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Relationship of an atom between the two document versions.
 * <p>
 * Statuses move forward through the pipeline phases only: correlation assigns
 * EQUAL, DELETED or INSERTED, move detection refines DELETED and INSERTED into
 * the moved statuses, and format detection refines EQUAL into FORMAT_CHANGED.
 */
public enum CorrelationStatus {
    UNKNOWN,
    EQUAL,
    DELETED,
    INSERTED,
    MOVED_SOURCE,
    MOVED_DESTINATION,
    FORMAT_CHANGED;

    private static final Map<CorrelationStatus, Set<CorrelationStatus>> TRANSITIONS =
            new EnumMap<>(CorrelationStatus.class);

    static {
        TRANSITIONS.put(UNKNOWN, EnumSet.of(EQUAL, DELETED, INSERTED));
        TRANSITIONS.put(EQUAL, EnumSet.of(FORMAT_CHANGED));
        TRANSITIONS.put(DELETED, EnumSet.of(MOVED_SOURCE));
        TRANSITIONS.put(INSERTED, EnumSet.of(MOVED_DESTINATION));
        TRANSITIONS.put(MOVED_SOURCE, EnumSet.noneOf(CorrelationStatus.class));
        TRANSITIONS.put(MOVED_DESTINATION, EnumSet.noneOf(CorrelationStatus.class));
        TRANSITIONS.put(FORMAT_CHANGED, EnumSet.noneOf(CorrelationStatus.class));
    }

    public boolean canTransitionTo(CorrelationStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<CorrelationStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /**
     * Statuses a pre-existing revision wrapper can seed before correlation runs.
     */
    public boolean isRevisionSeed() {
        return this == INSERTED || this == DELETED || this == MOVED_SOURCE || this == MOVED_DESTINATION;
    }

    public boolean isDeletion() {
        return this == DELETED || this == MOVED_SOURCE;
    }

    public boolean isInsertion() {
        return this == INSERTED || this == MOVED_DESTINATION;
    }
}
