package net.littleredcomputer.petri.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.petri.PetriNet;
import net.littleredcomputer.petri.Transition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sat4j.core.Vec;
import org.sat4j.core.VecInt;
import org.sat4j.pb.IPBSolver;
import org.sat4j.pb.ObjectiveFunction;
import org.sat4j.pb.OptToPBSATAdapter;
import org.sat4j.pb.PseudoOptDecorator;
import org.sat4j.pb.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.IProblem;
import org.sat4j.specs.TimeoutException;

import java.math.BigInteger;
import java.util.*;

/**
 * A 0/1 integer program with one decision variable per place, solved with the SAT4J
 * pseudo-boolean engine. Candidates are proposed by {@link #solve()} and rejected ones are
 * cut off with {@link #exclude(boolean[])}.
 * <p>
 * The model is kept as a list of constraints and a fresh solver is loaded from it on every
 * call to solve(), so each result depends on the constraint set alone.
 */
public class CandidateSearch {
    private static final Logger log = LogManager.getFormatterLogger(CandidateSearch.class);

    private final ImmutableList<String> places;
    private final ImmutableMap<String, Integer> index;
    private final SearchConfig config;
    private final List<LinearConstraint> constraints = new ArrayList<>();
    private long[] weights = null;  // null: feasibility only
    private int cutCount = 0;
    private long solveCount = 0;

    /**
     * @param places the places, in the order shared with the symbolic engine; variable i
     *               stands for places.get(i)
     */
    public CandidateSearch(List<String> places, SearchConfig config) {
        this.places = ImmutableList.copyOf(places);
        this.config = config;
        ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
        for (int i = 0; i < places.size(); ++i) b.put(places.get(i), i);
        index = b.build();  // throws on duplicate places
    }

    public List<String> places() { return places; }
    public int variableCount() { return places.size(); }
    public int constraintCount() { return constraints.size(); }
    public int cutCount() { return cutCount; }
    public long solveCount() { return solveCount; }
    public boolean hasObjective() { return weights != null; }

    private int indexOf(String place) {
        Integer i = index.get(place);
        if (i == null) throw new IllegalArgumentException("unknown place: " + place);
        return i;
    }

    /**
     * For each transition with a nonempty preset, require at least one preset place to be
     * unmarked: Σ_{p ∈ pre(t)} x_p ≤ |pre(t)| - 1. A transition with an empty preset cannot
     * be disabled and contributes nothing.
     */
    public CandidateSearch addStructuralDeadlockConstraints(PetriNet net) {
        for (Transition t : net.transitions()) {
            SortedSet<String> pre = net.preset(t);
            if (pre.isEmpty()) continue;
            int[] vars = pre.stream().mapToInt(this::indexOf).toArray();
            int[] ones = new int[vars.length];
            Arrays.fill(ones, 1);
            constraints.add(new LinearConstraint(vars, ones, pre.size() - 1));
        }
        return this;
    }

    /** Add Σ coefficients(p)·x_p ≤ bound. */
    public CandidateSearch addAtMost(Map<String, Integer> coefficients, int bound) {
        int[] vars = new int[coefficients.size()];
        int[] coeffs = new int[coefficients.size()];
        int i = 0;
        for (Map.Entry<String, Integer> e : coefficients.entrySet()) {
            vars[i] = indexOf(e.getKey());
            coeffs[i] = e.getValue();
            ++i;
        }
        constraints.add(new LinearConstraint(vars, coeffs, bound));
        return this;
    }

    /**
     * Maximize Σ weights(p)·x_p. Places not mentioned have weight 0; names that are not places
     * are ignored.
     */
    public CandidateSearch setObjective(Map<String, Integer> objective) {
        weights = new long[places.size()];
        objective.forEach((p, w) -> {
            Integer i = index.get(p);
            if (i == null) log.debug("objective mentions unknown place %s; ignored", p);
            else weights[i] = w;
        });
        return this;
    }

    /** Maximize the number of marked places. */
    public CandidateSearch maximizeMarkedPlaces() {
        weights = new long[places.size()];
        Arrays.fill(weights, 1);
        return this;
    }

    public CandidateSearch clearObjective() {
        weights = null;
        return this;
    }

    /**
     * Add the no-good cut Σ_{a_i = 1} x_i − Σ_{a_i = 0} x_i ≤ |{i : a_i = 1}| − 1, which every
     * 0/1 point except a itself satisfies.
     */
    public void exclude(boolean[] assignment) {
        if (assignment.length != places.size()) throw new IllegalArgumentException("assignment length does not match variable count");
        int[] vars = new int[assignment.length];
        int[] coeffs = new int[assignment.length];
        int ones = 0;
        for (int i = 0; i < assignment.length; ++i) {
            vars[i] = i;
            if (assignment[i]) {
                coeffs[i] = 1;
                ++ones;
            } else {
                coeffs[i] = -1;
            }
        }
        constraints.add(new LinearConstraint(vars, coeffs, ones - 1));
        ++cutCount;
    }

    /** @return whether x satisfies every constraint added so far */
    public boolean isFeasible(boolean[] x) {
        if (x.length != places.size()) throw new IllegalArgumentException("assignment length does not match variable count");
        return constraints.stream().allMatch(c -> c.isSatisfiedBy(x));
    }

    /** @return the objective value of x; 0 without an objective */
    public long objectiveValue(boolean[] x) {
        if (weights == null) return 0;
        long v = 0;
        for (int i = 0; i < x.length; ++i) if (x[i]) v += weights[i];
        return v;
    }

    /**
     * The coefficients minimized by sat4j: the negated weights, scaled so that a tie-breaking
     * term preferring earlier places can sit below the least significant unit of the weight.
     */
    private ObjectiveFunction objectiveFunction() {
        if (weights == null) return null;
        final int n = weights.length;
        VecInt vars = new VecInt();
        Vec<BigInteger> coeffs = new Vec<>();
        for (int i = 0; i < n; ++i) {
            BigInteger c = BigInteger.valueOf(weights[i]);
            if (config.lexicographicTieBreak()) c = c.shiftLeft(n).add(BigInteger.ONE.shiftLeft(n - 1 - i));
            if (c.signum() == 0) continue;
            vars.push(i + 1);
            coeffs.push(c.negate());
        }
        return vars.isEmpty() ? null : new ObjectiveFunction(vars, coeffs);
    }

    /**
     * Find an assignment satisfying every constraint, optimal for the objective if there is
     * one.
     * @return the candidate, or empty if the constraints are infeasible
     * @throws IllegalStateException if the configured time limit expires
     */
    public Optional<Candidate> solve() {
        ++solveCount;
        final int n = places.size();
        if (n == 0) {
            boolean[] empty = new boolean[0];
            return isFeasible(empty) ? Optional.of(new Candidate(empty, 0)) : Optional.empty();
        }
        IPBSolver solver = SolverFactory.newDefault();
        solver.newVar(n);
        if (config.timeoutSeconds() > 0) solver.setTimeout(config.timeoutSeconds());
        try {
            for (LinearConstraint c : constraints) c.addTo(solver);
        } catch (ContradictionException e) {
            log.debug("constraints contradictory at load time: %s", e.getMessage());
            return Optional.empty();
        }
        IProblem problem = solver;
        OptToPBSATAdapter optimizer = null;
        ObjectiveFunction objective = objectiveFunction();
        if (objective != null) {
            solver.setObjectiveFunction(objective);
            optimizer = new OptToPBSATAdapter(new PseudoOptDecorator(solver));
            problem = optimizer;
        }
        try {
            if (!problem.isSatisfiable()) return Optional.empty();
        } catch (TimeoutException e) {
            throw timedOut(e);
        }
        // On timeout the adapter reports the best model found so far instead of throwing.
        if (optimizer != null && !optimizer.isOptimal()) throw timedOut(null);
        boolean[] x = new boolean[n];
        for (int literal : problem.model()) {
            if (literal > 0 && literal <= n) x[literal - 1] = true;
        }
        return Optional.of(new Candidate(x, objectiveValue(x)));
    }

    private IllegalStateException timedOut(TimeoutException cause) {
        return new IllegalStateException(String.format("solver gave up after %d seconds (%d constraints)",
                config.timeoutSeconds(), constraints.size()), cause);
    }
}
