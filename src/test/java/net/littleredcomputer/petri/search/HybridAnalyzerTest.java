package net.littleredcomputer.petri.search;

import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.petri.ExplicitReachability;
import net.littleredcomputer.petri.Marking;
import net.littleredcomputer.petri.PetriNet;
import net.littleredcomputer.petri.Place;
import net.littleredcomputer.petri.TestNets;
import net.littleredcomputer.petri.symbolic.SymbolicConfig;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.SortedSet;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresent;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class HybridAnalyzerTest {

    private static long value(Marking m, Map<String, Integer> weights) {
        return m.places().stream().mapToLong(p -> weights.getOrDefault(p, 0)).sum();
    }

    @Test
    public void scenarioADeadlock() {
        Optional<SearchResult> r = new HybridAnalyzer(TestNets.scenarioA()).findDeadlock();
        assertThat(r, isPresent());
        assertThat(r.get().marking(), is(Marking.of("p1")));
    }

    @Test
    public void scenarioBOptimize() {
        Optional<SearchResult> r = new HybridAnalyzer(TestNets.scenarioA()).optimize(ImmutableMap.of("p0", 1, "p1", 5));
        assertThat(r, isPresent());
        assertThat(r.get().marking(), is(Marking.of("p1")));
        assertThat(r.get().objectiveValue(), is(5L));
        assertThat(r.get().attempts(), is(2L));
    }

    @Test
    public void mutexDeadlock() {
        HybridAnalyzer h = new HybridAnalyzer(TestNets.mutexDeadlock());
        Optional<SearchResult> r = h.findDeadlock();
        assertThat(r, isPresent());
        assertThat(r.get().marking(), is(Marking.of("a1", "b1")));
        assertThat(r.get().attempts(), greaterThan(1L));
    }

    @Test
    public void philosophers() {
        PetriNet net = TestNets.philosophers(3);
        SearchResult r = new HybridAnalyzer(net).findDeadlock().get();
        assertThat(ExplicitReachability.deadMarkings(net), hasItem(r.marking()));
    }

    @Test
    public void liveNetsHaveNoDeadlock() {
        assertThat(new HybridAnalyzer(TestNets.ring(4)).findDeadlock(), isEmpty());
        assertThat(new HybridAnalyzer(TestNets.toggles(3)).findDeadlock(), isEmpty());
    }

    @Test
    public void emptyPresetMeansNoDeadlock() {
        HybridAnalyzer h = new HybridAnalyzer(TestNets.alwaysEnabled());
        assertThat(h.findDeadlock(), isEmpty());
        assertThat(h.state(), is(HybridAnalyzer.State.READY));
    }

    @Test
    public void reachableSetIsComputedOnce() {
        HybridAnalyzer h = new HybridAnalyzer(TestNets.mutexDeadlock());
        assertThat(h.state(), is(HybridAnalyzer.State.UNINITIALIZED));
        assertThat(h.symbolic().isComputed(), is(false));
        h.findDeadlock();
        assertThat(h.state(), is(HybridAnalyzer.State.READY));
        int iterations = h.symbolic().iterations();
        h.optimize(ImmutableMap.of("r1", 1));
        assertThat(h.symbolic().iterations(), is(iterations));
    }

    @Test
    public void deadlockAgreesWithBfs() {
        for (long seed = 1; seed <= 15; ++seed) {
            PetriNet net = TestNets.random(7, 5, seed);
            SortedSet<Marking> dead = ExplicitReachability.deadMarkings(net);
            Optional<SearchResult> r = new HybridAnalyzer(net).findDeadlock();
            if (dead.isEmpty()) {
                assertThat("seed " + seed, r, isEmpty());
            } else {
                assertThat("seed " + seed, r, isPresent());
                assertThat("seed " + seed, dead, hasItem(r.get().marking()));
            }
        }
    }

    @Test
    public void optimizeAgreesWithBruteForce() {
        Random random = new Random(3);
        for (long seed = 1; seed <= 15; ++seed) {
            PetriNet net = TestNets.random(7, 6, seed);
            Map<String, Integer> weights = new HashMap<>();
            for (Place p : net.places()) weights.put(p.id(), random.nextInt(9) - 3);
            SortedSet<Marking> reachable = ExplicitReachability.reachableMarkings(net);
            long best = reachable.stream().mapToLong(m -> value(m, weights)).max().getAsLong();
            for (boolean tieBreak : new boolean[]{true, false}) {
                SearchResult r = new HybridAnalyzer(net, SymbolicConfig.DEFAULT, SearchConfig.DEFAULT.withLexicographicTieBreak(tieBreak))
                        .optimize(weights).get();
                assertThat("seed " + seed, r.objectiveValue(), is(best));
                assertThat("seed " + seed, reachable, hasItem(r.marking()));
                assertThat(value(r.marking(), weights), is(best));
            }
        }
    }

    @Test
    public void optimizeUnderEitherVariableOrder() {
        PetriNet net = TestNets.mutexDeadlock();
        Map<String, Integer> weights = ImmutableMap.of("r1", 1, "r2", 1);
        SearchResult sorted = new HybridAnalyzer(net).optimize(weights).get();
        SearchResult declared = new HybridAnalyzer(net,
                SymbolicConfig.DEFAULT.withVariableOrder(SymbolicConfig.VariableOrder.DECLARATION),
                SearchConfig.DEFAULT).optimize(weights).get();
        assertThat(sorted.objectiveValue(), is(2L));
        assertThat(declared.objectiveValue(), is(2L));
        assertThat(sorted.marking(), is(net.initialMarking()));
        assertThat(declared.marking(), is(net.initialMarking()));
    }

    @Test
    public void unknownWeightsFallBackToMarkedPlaces() {
        SearchResult r = new HybridAnalyzer(TestNets.scenarioA()).optimize(ImmutableMap.of("nowhere", 4)).get();
        assertThat(r.marking(), is(Marking.of("p0")));
        assertThat(r.objectiveValue(), is(1L));
    }

    @Test(expected = IllegalStateException.class)
    public void attemptLimit() {
        new HybridAnalyzer(TestNets.mutexDeadlock()).setMaxAttempts(1).findDeadlock();
    }

    @Test(expected = IllegalArgumentException.class)
    public void attemptLimitMustBePositive() {
        new HybridAnalyzer(TestNets.scenarioA()).setMaxAttempts(0);
    }

    @Test
    public void emptyNet() {
        HybridAnalyzer h = new HybridAnalyzer(PetriNet.builder().build());
        SearchResult r = h.findDeadlock().get();
        assertThat(r.marking(), is(Marking.of()));
        assertThat(h.optimize(ImmutableMap.of()).get().objectiveValue(), is(0L));
    }
}
