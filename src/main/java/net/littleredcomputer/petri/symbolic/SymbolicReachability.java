package net.littleredcomputer.petri.symbolic;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.petri.Marking;
import net.littleredcomputer.petri.PetriNet;
import net.littleredcomputer.petri.Place;
import net.littleredcomputer.petri.Transition;
import net.littleredcomputer.petri.bdd.BddManager;
import net.littleredcomputer.petri.bdd.Expr;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.math.BigInteger;
import java.util.*;

/**
 * Computes the set of markings reachable from a net's initial marking as a single BDD.
 * <p>
 * Each place p has a current-state variable "cur:p" and a next-state variable "next:p",
 * declared as adjacent pairs in the order given by the {@link SymbolicConfig}. The prefixes
 * keep the names distinct for any place ids. The transition relation
 * T(x, x') is the disjunction over transitions of enabling condition and frame rule; the
 * reachable set is the least fixed point of R = init ∨ image(R), where image(R) is
 * (∃x. R(x) ∧ T(x, x'))[x' := x]. The result is cached on first use.
 */
public class SymbolicReachability {
    private static final Logger log = LogManager.getFormatterLogger(SymbolicReachability.class);

    /** Observes each iterate of the fixed-point computation. */
    public interface IterationListener {
        void iterate(int iteration, int reachable);
    }

    private final PetriNet net;
    private final SymbolicConfig config;
    private final BddManager bdd = new BddManager();
    private final ImmutableList<String> placeOrder;
    private final ImmutableMap<String, Integer> placeIndex;
    private final int[] current;  // variable of the i-th place
    private final int[] next;
    private final BitSet currentVars = new BitSet();
    private final int[] nextToCurrent;

    private int transitionRelation = -1;
    private int reachable = -1;
    private int iterations = 0;
    private IterationListener listener = (i, r) -> {};

    public SymbolicReachability(PetriNet net) {
        this(net, SymbolicConfig.DEFAULT);
    }

    public SymbolicReachability(PetriNet net, SymbolicConfig config) {
        this.net = net;
        this.config = config;
        Collection<Place> places = config.variableOrder() == SymbolicConfig.VariableOrder.DECLARATION
                ? net.placesInDeclarationOrder()
                : net.places();
        placeOrder = places.stream().map(Place::id).collect(ImmutableList.toImmutableList());
        ImmutableMap.Builder<String, Integer> index = ImmutableMap.builder();
        current = new int[placeOrder.size()];
        next = new int[placeOrder.size()];
        for (int i = 0; i < placeOrder.size(); ++i) {
            String p = placeOrder.get(i);
            index.put(p, i);
            current[i] = bdd.declare("cur:" + p);
            next[i] = bdd.declare("next:" + p);
            currentVars.set(current[i]);
        }
        placeIndex = index.build();
        nextToCurrent = new int[bdd.variableCount()];
        Arrays.fill(nextToCurrent, -1);
        for (int i = 0; i < next.length; ++i) nextToCurrent[next[i]] = current[i];
    }

    public PetriNet net() { return net; }
    public SymbolicConfig config() { return config; }
    public BddManager manager() { return bdd; }

    /** The place order shared by the BDD variables and any assignment passed to this engine. */
    public List<String> placeOrder() { return placeOrder; }

    public int currentVariable(String place) { return current[indexOf(place)]; }
    public int nextVariable(String place) { return next[indexOf(place)]; }

    private int indexOf(String place) {
        Integer i = placeIndex.get(place);
        if (i == null) throw new IllegalArgumentException("unknown place: " + place);
        return i;
    }

    public void setIterationListener(IterationListener listener) { this.listener = listener; }

    public int encodeInitial() {
        List<Expr> literals = new ArrayList<>();
        for (int i = 0; i < placeOrder.size(); ++i) {
            literals.add(Expr.literal(current[i], net.place(placeOrder.get(i)).isInitiallyMarked()));
        }
        return bdd.build(Expr.and(literals));
    }

    /** The frame-rule expression for one transition; see the class comment. */
    Expr transitionExpr(Transition t) {
        SortedSet<String> pre = net.preset(t);
        SortedSet<String> post = net.postset(t);
        List<Expr> conjuncts = new ArrayList<>();
        for (String p : pre) conjuncts.add(Expr.var(current[indexOf(p)]));
        for (int i = 0; i < placeOrder.size(); ++i) {
            String p = placeOrder.get(i);
            boolean in = pre.contains(p), out = post.contains(p);
            if (out) conjuncts.add(Expr.var(next[i]));  // produced, or passes through
            else if (in) conjuncts.add(Expr.not(Expr.var(next[i])));  // consumed
            else conjuncts.add(Expr.iff(Expr.var(current[i]), Expr.var(next[i])));  // untouched
        }
        return Expr.and(conjuncts);
    }

    public int encodeTransitionRelation() {
        if (transitionRelation < 0) {
            Stopwatch sw = Stopwatch.createStarted();
            List<Expr> disjuncts = new ArrayList<>();
            for (Transition t : net.transitions()) disjuncts.add(transitionExpr(t));
            transitionRelation = bdd.build(Expr.or(disjuncts));
            log.debug("transition relation: %d nodes in %s", bdd.size(transitionRelation), sw);
        }
        return transitionRelation;
    }

    /** Successors of the markings in r, as a formula over the current-state variables. */
    public int image(int r) {
        return bdd.rename(bdd.andExists(r, encodeTransitionRelation(), currentVars), nextToCurrent);
    }

    public boolean isComputed() { return reachable >= 0; }

    public int computeReachable() {
        if (reachable >= 0) return reachable;
        Stopwatch sw = Stopwatch.createStarted();
        int r = encodeInitial();
        encodeTransitionRelation();
        iterations = 0;
        while (true) {
            ++iterations;
            listener.iterate(iterations, r);
            int rNext = bdd.or(r, image(r));
            // Canonical nodes: equal handles iff equal sets.
            if (rNext == r) break;
            r = rNext;
            final int it = iterations, rr = r;
            log.debug(() -> new FormattedMessage("iteration %d: %s markings, %d nodes", it, count(rr), bdd.size(rr)));
        }
        reachable = r;
        log.info("reachable set: %s markings after %d iterations, %d BDD nodes (%d allocated) in %s",
                count(r), iterations, bdd.size(r), bdd.nodeCount(), sw);
        return reachable;
    }

    /** @return the number of image steps taken by the fixed-point computation so far */
    public int iterations() { return iterations; }

    /** @return the number of markings (assignments to the current-state variables) satisfying f */
    public BigInteger count(int f) { return bdd.satCount(f, currentVars); }

    public BigInteger reachableCount() { return count(computeReachable()); }

    public boolean intersects(int f, int g) { return !bdd.isFalse(bdd.and(f, g)); }

    /** The formula satisfied by exactly one marking, given as an assignment in {@link #placeOrder()}. */
    public int markingFormula(boolean[] assignment) {
        if (assignment.length != current.length) throw new IllegalArgumentException("assignment length does not match place count");
        return bdd.cube(current, assignment);
    }

    public int markingFormula(Marking m) {
        for (String p : m.places()) indexOf(p);
        return markingFormula(m.toAssignment(placeOrder));
    }

    public boolean isReachable(boolean[] assignment) {
        return intersects(markingFormula(assignment), computeReachable());
    }

    public boolean isReachable(Marking m) {
        return intersects(markingFormula(m), computeReachable());
    }

    /** The markings satisfying f, in ascending order. */
    public SortedSet<Marking> markings(int f) {
        SortedSet<Marking> ms = new TreeSet<>();
        bdd.forEachSat(f, currentVars, s -> {
            List<String> marked = new ArrayList<>();
            for (int i = 0; i < current.length; ++i) if (s.get(current[i])) marked.add(placeOrder.get(i));
            ms.add(Marking.of(marked));
        });
        return ms;
    }

    public SortedSet<Marking> reachableMarkings() { return markings(computeReachable()); }

    /** Reachable markings in which no transition is enabled. */
    public int deadMarkings() {
        int enabled = BddManager.FALSE;
        for (Transition t : net.transitions()) {
            List<Expr> pre = new ArrayList<>();
            for (String p : net.preset(t)) pre.add(Expr.var(current[indexOf(p)]));
            enabled = bdd.or(enabled, bdd.build(Expr.and(pre)));
        }
        return bdd.and(computeReachable(), bdd.not(enabled));
    }
}
