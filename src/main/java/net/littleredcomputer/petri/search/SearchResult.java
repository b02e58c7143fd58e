package net.littleredcomputer.petri.search;

import net.littleredcomputer.petri.Marking;

import java.time.Duration;

/**
 * A reachable marking accepted by the {@link HybridAnalyzer}.
 */
public final class SearchResult {
    private final Marking marking;
    private final long objectiveValue;
    private final long attempts;
    private final Duration elapsed;

    SearchResult(Marking marking, long objectiveValue, long attempts, Duration elapsed) {
        this.marking = marking;
        this.objectiveValue = objectiveValue;
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public Marking marking() { return marking; }
    public long objectiveValue() { return objectiveValue; }

    /** @return the number of candidates proposed, the accepted one included */
    public long attempts() { return attempts; }

    /** @return time spent in the refinement loop, not counting the reachable set computation */
    public Duration elapsed() { return elapsed; }

    @Override
    public String toString() {
        return String.format("%s objective=%d attempts=%d", marking, objectiveValue, attempts);
    }
}
