package net.littleredcomputer.petri.bdd;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;

/**
 * A propositional formula over the variables of a {@link BddManager}, kept as a tree of
 * typed connectives. {@link BddManager#build(Expr)} compiles it to a BDD.
 */
public abstract class Expr {
    public static final Expr TRUE = new Const(true);
    public static final Expr FALSE = new Const(false);

    private Expr() {}

    abstract int compile(BddManager m);

    public static Expr var(int v) {
        if (v < 0) throw new IllegalArgumentException("negative variable index " + v);
        return new Var(v);
    }

    public static Expr not(Expr e) { return new Not(e); }
    public static Expr iff(Expr a, Expr b) { return new Iff(a, b); }

    public static Expr and(Expr... es) { return and(ImmutableList.copyOf(es)); }
    public static Expr and(Collection<Expr> es) { return new Nary(true, es); }
    public static Expr or(Expr... es) { return or(ImmutableList.copyOf(es)); }
    public static Expr or(Collection<Expr> es) { return new Nary(false, es); }

    /** @return v if value, else ¬v */
    public static Expr literal(int v, boolean value) { return value ? var(v) : not(var(v)); }

    private static final class Const extends Expr {
        final boolean value;
        Const(boolean value) { this.value = value; }
        @Override int compile(BddManager m) { return value ? BddManager.TRUE : BddManager.FALSE; }
        @Override public String toString() { return value ? "T" : "F"; }
    }

    private static final class Var extends Expr {
        final int v;
        Var(int v) { this.v = v; }
        @Override int compile(BddManager m) { return m.var(v); }
        @Override public String toString() { return "x" + v; }
    }

    private static final class Not extends Expr {
        final Expr e;
        Not(Expr e) { this.e = e; }
        @Override int compile(BddManager m) { return m.not(e.compile(m)); }
        @Override public String toString() { return "~" + e; }
    }

    private static final class Iff extends Expr {
        final Expr a, b;
        Iff(Expr a, Expr b) { this.a = a; this.b = b; }
        @Override int compile(BddManager m) { return m.iff(a.compile(m), b.compile(m)); }
        @Override public String toString() { return "(" + a + " <-> " + b + ")"; }
    }

    private static final class Nary extends Expr {
        final boolean conjunction;
        final List<Expr> es;
        Nary(boolean conjunction, Collection<Expr> es) {
            this.conjunction = conjunction;
            this.es = ImmutableList.copyOf(es);
        }

        @Override
        int compile(BddManager m) {
            // Right to left, stopping at the absorbing constant.
            int r = conjunction ? BddManager.TRUE : BddManager.FALSE;
            for (int i = es.size() - 1; i >= 0; --i) {
                int f = es.get(i).compile(m);
                r = conjunction ? m.and(f, r) : m.or(f, r);
                if (r == (conjunction ? BddManager.FALSE : BddManager.TRUE)) break;
            }
            return r;
        }

        @Override
        public String toString() {
            if (es.isEmpty()) return conjunction ? "T" : "F";
            return "(" + Joiner.on(conjunction ? " & " : " | ").join(es) + ")";
        }
    }
}
