package net.littleredcomputer.petri.bdd;

import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class BddManagerTest {
    private BddManager m;
    private int a, b, c, d;

    @Before
    public void setUp() {
        m = new BddManager();
        a = m.declare("a");
        b = m.declare("b");
        c = m.declare("c");
        d = m.declare("d");
    }

    private static BitSet vars(int... vs) {
        BitSet s = new BitSet();
        for (int v : vs) s.set(v);
        return s;
    }

    @Test
    public void declaration() {
        assertThat(m.variableCount(), is(4));
        assertThat(m.variable("c"), is(c));
        assertThat(m.variableName(d), is("d"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void redeclaration() {
        m.declare("b");
    }

    @Test
    public void canonicity() {
        int ab = m.and(m.var(a), m.var(b));
        assertThat(m.and(m.var(b), m.var(a)), is(ab));
        assertThat(m.not(m.or(m.nvar(a), m.nvar(b))), is(ab));
        assertThat(m.or(m.var(c), m.nvar(c)), is(BddManager.TRUE));
        assertThat(m.and(m.var(c), m.nvar(c)), is(BddManager.FALSE));
        assertThat(m.not(m.not(ab)), is(ab));
        assertThat(m.xor(ab, ab), is(BddManager.FALSE));
        assertThat(m.ite(m.var(a), m.var(b), BddManager.FALSE), is(ab));
        assertThat(m.topVariable(ab), is(a));
        assertThat(m.low(ab), is(BddManager.FALSE));
        assertThat(m.high(ab), is(m.var(b)));
    }

    @Test
    public void entailment() {
        int ab = m.and(m.var(a), m.var(b));
        assertThat(m.entails(ab, m.var(a)), is(true));
        assertThat(m.entails(m.var(a), ab), is(false));
        assertThat(m.implies(ab, m.var(b)), is(BddManager.TRUE));
    }

    @Test
    public void expressions() {
        assertThat(m.build(Expr.iff(Expr.var(a), Expr.var(b))), is(m.iff(m.var(a), m.var(b))));
        assertThat(m.build(Expr.and()), is(BddManager.TRUE));
        assertThat(m.build(Expr.or()), is(BddManager.FALSE));
        assertThat(m.build(Expr.and(Expr.literal(a, true), Expr.literal(c, false))), is(m.and(m.var(a), m.nvar(c))));
        assertThat(m.build(Expr.or(Expr.var(d), Expr.TRUE, Expr.var(a))), is(BddManager.TRUE));
        assertThat(Expr.and(Expr.var(0), Expr.not(Expr.var(1))).toString(), is("(x0 & ~x1)"));
    }

    @Test
    public void cube() {
        int expected = m.and(m.var(c), m.nvar(a));
        assertThat(m.cube(new int[]{c, a}, new boolean[]{true, false}), is(expected));
        assertThat(m.cube(new int[0], new boolean[0]), is(BddManager.TRUE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void cubeRejectsRepeatedVariable() {
        m.cube(new int[]{a, a}, new boolean[]{true, true});
    }

    @Test
    public void quantification() {
        int f = m.and(m.var(a), m.or(m.var(b), m.var(c)));
        assertThat(m.exists(f, vars(a)), is(m.or(m.var(b), m.var(c))));
        assertThat(m.exists(f, vars(b, c)), is(m.var(a)));
        assertThat(m.exists(f, vars(a, b, c)), is(BddManager.TRUE));
        assertThat(m.exists(f, vars(d)), is(f));
        assertThat(m.exists(BddManager.FALSE, vars(a)), is(BddManager.FALSE));
    }

    @Test
    public void relationalProductMatchesConjunctionThenQuantification() {
        Random r = new Random(7);
        List<Integer> fs = new ArrayList<>();
        for (int i = 0; i < 20; ++i) fs.add(randomFunction(r, 3));
        for (int f : fs) {
            for (int g : fs) {
                for (BitSet q : new BitSet[]{vars(), vars(a), vars(b, d), vars(a, b, c, d)}) {
                    assertThat(m.andExists(f, g, q), is(m.exists(m.and(f, g), q)));
                }
            }
        }
    }

    private int randomFunction(Random r, int depth) {
        if (depth == 0) {
            int v = r.nextInt(4);
            return r.nextBoolean() ? m.var(v) : m.nvar(v);
        }
        int x = randomFunction(r, depth - 1), y = randomFunction(r, depth - 1);
        switch (r.nextInt(3)) {
            case 0: return m.and(x, y);
            case 1: return m.or(x, y);
            default: return m.xor(x, y);
        }
    }

    @Test
    public void rename() {
        int f = m.and(m.var(b), m.nvar(d));
        int[] mapping = {-1, a, -1, c};
        assertThat(m.rename(f, mapping), is(m.and(m.var(a), m.nvar(c))));
        // Renaming downward past an unrenamed variable still yields a canonical node.
        int g = m.and(m.var(a), m.var(b));
        assertThat(m.rename(g, new int[]{d}), is(m.and(m.var(d), m.var(b))));
    }

    @Test
    public void support() {
        int f = m.or(m.and(m.var(a), m.var(c)), m.var(d));
        assertThat(m.support(f), is(vars(a, c, d)));
        assertThat(m.support(BddManager.TRUE).isEmpty(), is(true));
    }

    @Test
    public void satCount() {
        int f = m.or(m.var(a), m.var(b));
        assertThat(m.satCount(f, vars(a, b)), is(BigInteger.valueOf(3)));
        assertThat(m.satCount(f, vars(a, b, c)), is(BigInteger.valueOf(6)));
        assertThat(m.satCount(f, vars(a, b, c, d)), is(BigInteger.valueOf(12)));
        assertThat(m.satCount(m.var(d), vars(a, b, c, d)), is(BigInteger.valueOf(8)));
        assertThat(m.satCount(BddManager.TRUE, vars()), is(BigInteger.ONE));
        assertThat(m.satCount(BddManager.FALSE, vars(a)), is(BigInteger.ZERO));
    }

    @Test(expected = IllegalArgumentException.class)
    public void satCountRejectsForeignSupport() {
        m.satCount(m.var(c), vars(a, b));
    }

    @Test
    public void enumeration() {
        int f = m.xor(m.var(a), m.var(c));
        List<BitSet> sats = new ArrayList<>();
        m.forEachSat(f, vars(a, b, c), s -> sats.add((BitSet) s.clone()));
        assertThat(sats, contains(vars(c), vars(b, c), vars(a), vars(a, b)));
    }

    @Test
    public void anySat() {
        assertThat(m.anySat(BddManager.FALSE), isEmpty());
        assertThat(m.anySat(m.and(m.var(b), m.nvar(c))), isPresentAndIs(vars(b)));
    }

    @Test
    public void size() {
        assertThat(m.size(BddManager.TRUE), is(0));
        assertThat(m.size(m.var(a)), is(1));
        int parity = m.xor(m.xor(m.var(a), m.var(b)), m.xor(m.var(c), m.var(d)));
        assertThat(m.size(parity), is(7));
        m.clearCaches();
        assertThat(m.xor(m.xor(m.var(a), m.var(b)), m.xor(m.var(c), m.var(d))), is(parity));
    }
}
