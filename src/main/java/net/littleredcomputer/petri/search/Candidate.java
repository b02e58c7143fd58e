package net.littleredcomputer.petri.search;

import java.util.Arrays;

/**
 * An assignment of the decision variables found by {@link CandidateSearch#solve()},
 * together with its objective value (0 when solving for feasibility only).
 */
public final class Candidate {
    private final boolean[] assignment;
    private final long objectiveValue;

    Candidate(boolean[] assignment, long objectiveValue) {
        this.assignment = assignment;
        this.objectiveValue = objectiveValue;
    }

    public boolean[] assignment() { return assignment.clone(); }
    public long objectiveValue() { return objectiveValue; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Candidate)) return false;
        Candidate c = (Candidate) o;
        return objectiveValue == c.objectiveValue && Arrays.equals(assignment, c.assignment);
    }

    @Override
    public int hashCode() { return 31 * Arrays.hashCode(assignment) + Long.hashCode(objectiveValue); }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (boolean b : assignment) s.append(b ? '1' : '0');
        return s.append(" (").append(objectiveValue).append(')').toString();
    }
}
