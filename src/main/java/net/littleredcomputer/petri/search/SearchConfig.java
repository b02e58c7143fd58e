package net.littleredcomputer.petri.search;

/**
 * Settings for the pseudo-boolean candidate generator.
 */
public final class SearchConfig {
    public static final SearchConfig DEFAULT = new SearchConfig(true, 0);

    private final boolean lexicographicTieBreak;
    private final int timeoutSeconds;

    private SearchConfig(boolean lexicographicTieBreak, int timeoutSeconds) {
        if (timeoutSeconds < 0) throw new IllegalArgumentException("timeout must be non-negative");
        this.lexicographicTieBreak = lexicographicTieBreak;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * When set, candidates of equal objective value are ordered by preferring to mark places
     * that come earlier in the place order, so that every solve has a unique optimum.
     */
    public boolean lexicographicTieBreak() { return lexicographicTieBreak; }

    /** Per-solve time limit in seconds; 0 means none. */
    public int timeoutSeconds() { return timeoutSeconds; }

    public SearchConfig withLexicographicTieBreak(boolean b) { return new SearchConfig(b, timeoutSeconds); }
    public SearchConfig withTimeoutSeconds(int seconds) { return new SearchConfig(lexicographicTieBreak, seconds); }

    @Override
    public String toString() {
        return "SearchConfig[tieBreak=" + lexicographicTieBreak + ", timeout=" + timeoutSeconds + "s]";
    }
}
