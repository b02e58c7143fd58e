package net.littleredcomputer.petri.search;

import org.sat4j.core.VecInt;
import org.sat4j.pb.IPBSolver;
import org.sat4j.specs.ContradictionException;

import java.util.Arrays;

/**
 * Σ coefficients[i]·x[variables[i]] ≤ bound over 0/1 variables (zero-based).
 */
final class LinearConstraint {
    private final int[] variables;
    private final int[] coefficients;
    private final int bound;

    LinearConstraint(int[] variables, int[] coefficients, int bound) {
        if (variables.length != coefficients.length) throw new IllegalArgumentException("variables and coefficients differ in length");
        this.variables = variables.clone();
        this.coefficients = coefficients.clone();
        this.bound = bound;
    }

    /** @return whether the 0/1 point x satisfies this constraint */
    boolean isSatisfiedBy(boolean[] x) {
        long sum = 0;
        for (int i = 0; i < variables.length; ++i) if (x[variables[i]]) sum += coefficients[i];
        return sum <= bound;
    }

    /**
     * Post the constraint to a sat4j solver (whose variables are one-based). A negative
     * coefficient c on x is rewritten as |c| on ¬x, moving |c| to the bound, so sat4j only
     * sees non-negative coefficients.
     * @throws ContradictionException if the solver finds the constraint unsatisfiable outright
     */
    void addTo(IPBSolver solver) throws ContradictionException {
        int degree = bound;
        VecInt literals = new VecInt();
        VecInt coeffs = new VecInt();
        for (int i = 0; i < variables.length; ++i) {
            final int c = coefficients[i];
            if (c == 0) continue;
            final int v = variables[i] + 1;
            if (c > 0) {
                literals.push(v);
                coeffs.push(c);
            } else {
                literals.push(-v);
                coeffs.push(-c);
                degree -= c;
            }
        }
        if (literals.isEmpty()) {
            if (degree < 0) throw new ContradictionException("0 <= " + degree);
            return;
        }
        if (degree < 0) throw new ContradictionException("non-negative sum bounded by " + degree);
        solver.addAtMost(literals, coeffs, degree);
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < variables.length; ++i) {
            if (i > 0) s.append(coefficients[i] < 0 ? " - " : " + ");
            else if (coefficients[i] < 0) s.append('-');
            int c = Math.abs(coefficients[i]);
            if (c != 1) s.append(c);
            s.append('x').append(variables[i]);
        }
        if (variables.length == 0) s.append('0');
        return s.append(" <= ").append(bound).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof LinearConstraint)) return false;
        LinearConstraint c = (LinearConstraint) o;
        return bound == c.bound && Arrays.equals(variables, c.variables) && Arrays.equals(coefficients, c.coefficients);
    }

    @Override
    public int hashCode() { return 31 * (31 * Arrays.hashCode(variables) + Arrays.hashCode(coefficients)) + bound; }
}
