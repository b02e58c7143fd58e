package net.littleredcomputer.petri.search;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.petri.Marking;
import net.littleredcomputer.petri.PetriNet;
import net.littleredcomputer.petri.Transition;
import net.littleredcomputer.petri.symbolic.SymbolicConfig;
import net.littleredcomputer.petri.symbolic.SymbolicReachability;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Searches the reachable markings of a net by alternating between a candidate generator and
 * the symbolic reachable set. Each round asks the {@link CandidateSearch} for its best
 * assignment; if the reachable set contains it the search is over, otherwise the assignment
 * is cut off and the generator asked again. Every cut removes exactly one point, so the loop
 * ends after at most 2^|places| rounds.
 * <p>
 * The reachable set is computed on the first call to {@link #findDeadlock()} or
 * {@link #optimize(Map)} and reused afterwards.
 */
public class HybridAnalyzer {
    private static final Logger log = LogManager.getFormatterLogger(HybridAnalyzer.class);

    public enum State {
        UNINITIALIZED,
        READY,
    }

    private final PetriNet net;
    private final SymbolicReachability symbolic;
    private final SearchConfig searchConfig;
    private State state = State.UNINITIALIZED;
    private long maxAttempts = Long.MAX_VALUE;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;

    public HybridAnalyzer(PetriNet net) {
        this(net, SymbolicConfig.DEFAULT, SearchConfig.DEFAULT);
    }

    public HybridAnalyzer(PetriNet net, SymbolicConfig symbolicConfig, SearchConfig searchConfig) {
        this.net = net;
        this.symbolic = new SymbolicReachability(net, symbolicConfig);
        this.searchConfig = searchConfig;
    }

    public State state() { return state; }
    public SymbolicReachability symbolic() { return symbolic; }

    /**
     * Bound the number of candidates a single search may propose. The bound guards callers
     * against the exponential worst case; a search that hits it throws.
     */
    public HybridAnalyzer setMaxAttempts(long maxAttempts) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be positive");
        this.maxAttempts = maxAttempts;
        return this;
    }

    public HybridAnalyzer setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    private void ensureReady() {
        if (state == State.UNINITIALIZED) {
            symbolic.computeReachable();
            state = State.READY;
        }
    }

    private CandidateSearch newSearch() {
        return new CandidateSearch(symbolic.placeOrder(), searchConfig);
    }

    /**
     * Look for a reachable marking in which no transition is enabled.
     * @return a dead reachable marking, or empty if there is none
     */
    public Optional<SearchResult> findDeadlock() {
        ensureReady();
        Optional<Transition> always = net.alwaysEnabledTransition();
        if (always.isPresent()) {
            log.info("transition %s has an empty preset and is always enabled: no dead marking", always.get());
            return Optional.empty();
        }
        CandidateSearch search = newSearch()
                .addStructuralDeadlockConstraints(net)
                .maximizeMarkedPlaces();
        return refine("deadlock", search);
    }

    /**
     * Find a reachable marking maximizing Σ weights(p) over its marked places p. Unknown
     * places in weights are ignored; if no weight names a place, the number of marked places
     * is maximized instead.
     * @return an optimal reachable marking. Only cuts restrict the candidates here, so the
     * search stops at the latest when it proposes the initial marking.
     */
    public Optional<SearchResult> optimize(Map<String, Integer> weights) {
        ensureReady();
        CandidateSearch search = newSearch();
        if (weights.keySet().stream().anyMatch(net::hasPlace)) {
            search.setObjective(weights);
        } else {
            log.info("no objective weight names a place; maximizing the number of marked places");
            search.maximizeMarkedPlaces();
        }
        return refine("optimize", search);
    }

    private Optional<SearchResult> refine(String task, CandidateSearch search) {
        Stopwatch sw = Stopwatch.createStarted();
        lastLogTime = Instant.now();
        long attempts = 0;
        while (true) {
            if (attempts >= maxAttempts) {
                throw new IllegalStateException(String.format("%s: no answer after %d candidates", task, attempts));
            }
            ++attempts;
            Optional<Candidate> next = search.solve();
            if (!next.isPresent()) {
                log.info("%s: candidates exhausted after %d attempts in %s", task, attempts, sw);
                return Optional.empty();
            }
            Candidate c = next.get();
            boolean[] x = c.assignment();
            if (symbolic.isReachable(x)) {
                Marking m = Marking.fromAssignment(symbolic.placeOrder(), x);
                log.info("%s: accepted %s (objective %d) at attempt %d in %s", task, m, c.objectiveValue(), attempts, sw);
                return Optional.of(new SearchResult(m, c.objectiveValue(), attempts, sw.elapsed()));
            }
            search.exclude(x);
            maybeReportProgress(task, attempts, c, sw);
        }
    }

    private void maybeReportProgress(String task, long attempts, Candidate c, Stopwatch sw) {
        Instant now = Instant.now();
        if (Duration.between(lastLogTime, now).compareTo(logInterval) < 0) return;
        log.info(() -> new FormattedMessage("%s: %d candidates rejected %s, last %s", task, attempts, sw, c));
        lastLogTime = now;
    }
}
