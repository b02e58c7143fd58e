package net.littleredcomputer.petri.bdd;

import com.google.common.base.Preconditions;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TLongIntHashMap;

import java.math.BigInteger;
import java.util.*;
import java.util.function.Consumer;

/**
 * A reduced ordered binary decision diagram package. Nodes live in an arena of parallel int
 * lists and are referred to by index; node 0 is the constant false and node 1 the constant
 * true. Every node is interned through a per-variable unique table keyed by its (low, high)
 * children, so two handles denote the same boolean function iff they are equal ints.
 * <p>
 * Variables are ordered by declaration and never reordered. Nodes are never freed. Instances
 * are not thread safe.
 */
public class BddManager {
    public static final int FALSE = 0;
    public static final int TRUE = 1;

    private static final int TERMINAL = Integer.MAX_VALUE;  // level of the two constants
    private static final int ABSENT = -1;
    private static final float LOAD_FACTOR = 0.5f;

    private final TIntArrayList level = new TIntArrayList();
    private final TIntArrayList low = new TIntArrayList();
    private final TIntArrayList high = new TIntArrayList();
    private final List<TLongIntHashMap> unique = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> nameIndex = new HashMap<>();

    private final TLongIntHashMap andCache = newPairCache();
    private final TLongIntHashMap orCache = newPairCache();
    private final TLongIntHashMap xorCache = newPairCache();
    private final TIntIntHashMap notCache = newUnaryCache();

    public BddManager() {
        for (int t = FALSE; t <= TRUE; ++t) {
            level.add(TERMINAL);
            low.add(t);
            high.add(t);
        }
    }

    private static TLongIntHashMap newPairCache() {
        return new TLongIntHashMap(1024, LOAD_FACTOR, Long.MIN_VALUE, ABSENT);
    }

    private static TIntIntHashMap newUnaryCache() {
        return new TIntIntHashMap(1024, LOAD_FACTOR, Integer.MIN_VALUE, ABSENT);
    }

    private static long pair(int a, int b) {
        return ((long) a << 32) | (b & 0xffffffffL);
    }

    /**
     * Declare a new variable, placed below every variable declared before it.
     * @return the variable's index
     */
    public int declare(String name) {
        if (nameIndex.containsKey(name)) throw new IllegalArgumentException("variable already declared: " + name);
        int v = names.size();
        names.add(name);
        nameIndex.put(name, v);
        unique.add(new TLongIntHashMap(64, LOAD_FACTOR, Long.MIN_VALUE, ABSENT));
        return v;
    }

    public int variable(String name) {
        Integer v = nameIndex.get(name);
        if (v == null) throw new IllegalArgumentException("undeclared variable: " + name);
        return v;
    }

    public String variableName(int v) { return names.get(v); }
    public int variableCount() { return names.size(); }

    /** @return number of nodes in the arena, constants included */
    public int nodeCount() { return level.size(); }

    /** The variable tested at the root of f; undefined for the constants. */
    public int topVariable(int f) {
        Preconditions.checkArgument(f > TRUE, "constant has no top variable");
        return level.get(f);
    }

    public int low(int f) { return low.get(f); }
    public int high(int f) { return high.get(f); }

    public boolean isFalse(int f) { return f == FALSE; }
    public boolean isTrue(int f) { return f == TRUE; }

    private int mk(int v, int lo, int hi) {
        if (lo == hi) return lo;
        TLongIntHashMap table = unique.get(v);
        long key = pair(lo, hi);
        int n = table.get(key);
        if (n != ABSENT) return n;
        n = level.size();
        level.add(v);
        low.add(lo);
        high.add(hi);
        table.put(key, n);
        return n;
    }

    private void checkVariable(int v) {
        if (v < 0 || v >= names.size()) throw new IllegalArgumentException("no such variable: " + v);
    }

    public int var(int v) {
        checkVariable(v);
        return mk(v, FALSE, TRUE);
    }

    public int nvar(int v) {
        checkVariable(v);
        return mk(v, TRUE, FALSE);
    }

    public int build(Expr e) { return e.compile(this); }

    public int not(int f) {
        if (f == FALSE) return TRUE;
        if (f == TRUE) return FALSE;
        int r = notCache.get(f);
        if (r != ABSENT) return r;
        r = mk(level.get(f), not(low.get(f)), not(high.get(f)));
        notCache.put(f, r);
        return r;
    }

    public int and(int f, int g) {
        if (f == FALSE || g == FALSE) return FALSE;
        if (f == TRUE || f == g) return g;
        if (g == TRUE) return f;
        if (f > g) { int t = f; f = g; g = t; }
        long key = pair(f, g);
        int r = andCache.get(key);
        if (r != ABSENT) return r;
        final int vf = level.get(f), vg = level.get(g);
        final int v = Math.min(vf, vg);
        int lo = and(vf == v ? low.get(f) : f, vg == v ? low.get(g) : g);
        int hi = and(vf == v ? high.get(f) : f, vg == v ? high.get(g) : g);
        r = mk(v, lo, hi);
        andCache.put(key, r);
        return r;
    }

    public int or(int f, int g) {
        if (f == TRUE || g == TRUE) return TRUE;
        if (f == FALSE || f == g) return g;
        if (g == FALSE) return f;
        if (f > g) { int t = f; f = g; g = t; }
        long key = pair(f, g);
        int r = orCache.get(key);
        if (r != ABSENT) return r;
        final int vf = level.get(f), vg = level.get(g);
        final int v = Math.min(vf, vg);
        int lo = or(vf == v ? low.get(f) : f, vg == v ? low.get(g) : g);
        int hi = or(vf == v ? high.get(f) : f, vg == v ? high.get(g) : g);
        r = mk(v, lo, hi);
        orCache.put(key, r);
        return r;
    }

    public int xor(int f, int g) {
        if (f == g) return FALSE;
        if (f == FALSE) return g;
        if (g == FALSE) return f;
        if (f == TRUE) return not(g);
        if (g == TRUE) return not(f);
        if (f > g) { int t = f; f = g; g = t; }
        long key = pair(f, g);
        int r = xorCache.get(key);
        if (r != ABSENT) return r;
        final int vf = level.get(f), vg = level.get(g);
        final int v = Math.min(vf, vg);
        int lo = xor(vf == v ? low.get(f) : f, vg == v ? low.get(g) : g);
        int hi = xor(vf == v ? high.get(f) : f, vg == v ? high.get(g) : g);
        r = mk(v, lo, hi);
        xorCache.put(key, r);
        return r;
    }

    public int iff(int f, int g) { return not(xor(f, g)); }
    public int implies(int f, int g) { return or(not(f), g); }
    public int ite(int f, int g, int h) { return or(and(f, g), and(not(f), h)); }

    /** @return true iff every assignment satisfying f also satisfies g */
    public boolean entails(int f, int g) { return and(f, not(g)) == FALSE; }

    /**
     * The conjunction of literals fixing each of vars[i] to values[i].
     */
    public int cube(int[] vars, boolean[] values) {
        Preconditions.checkArgument(vars.length == values.length, "vars and values differ in length");
        Integer[] order = new Integer[vars.length];
        for (int i = 0; i < order.length; ++i) {
            checkVariable(vars[i]);
            order[i] = i;
        }
        Arrays.sort(order, (i, j) -> Integer.compare(vars[j], vars[i]));  // deepest first
        int r = TRUE;
        int previous = TERMINAL;
        for (int i : order) {
            final int v = vars[i];
            if (v == previous) throw new IllegalArgumentException("variable repeated in cube: " + v);
            r = values[i] ? mk(v, FALSE, r) : mk(v, r, FALSE);
            previous = v;
        }
        return r;
    }

    /** Existentially quantify the variables in vars out of f. */
    public int exists(int f, BitSet vars) {
        return exists(f, vars, newUnaryCache());
    }

    private int exists(int f, BitSet vars, TIntIntHashMap memo) {
        if (f <= TRUE) return f;
        final int v = level.get(f);
        if (vars.nextSetBit(v) < 0) return f;  // nothing to quantify at or below v
        int r = memo.get(f);
        if (r != ABSENT) return r;
        int lo = exists(low.get(f), vars, memo);
        if (vars.get(v)) {
            r = lo == TRUE ? TRUE : or(lo, exists(high.get(f), vars, memo));
        } else {
            r = mk(v, lo, exists(high.get(f), vars, memo));
        }
        memo.put(f, r);
        return r;
    }

    /**
     * The relational product ∃vars. f ∧ g, computed without building f ∧ g in full.
     */
    public int andExists(int f, int g, BitSet vars) {
        return andExists(f, g, vars, newPairCache(), newUnaryCache());
    }

    private int andExists(int f, int g, BitSet vars, TLongIntHashMap memo, TIntIntHashMap existsMemo) {
        if (f == FALSE || g == FALSE) return FALSE;
        if (f == TRUE && g == TRUE) return TRUE;
        if (f == TRUE || f == g) return exists(g, vars, existsMemo);
        if (g == TRUE) return exists(f, vars, existsMemo);
        if (f > g) { int t = f; f = g; g = t; }
        long key = pair(f, g);
        int r = memo.get(key);
        if (r != ABSENT) return r;
        final int vf = level.get(f), vg = level.get(g);
        final int v = Math.min(vf, vg);
        final int f0 = vf == v ? low.get(f) : f, f1 = vf == v ? high.get(f) : f;
        final int g0 = vg == v ? low.get(g) : g, g1 = vg == v ? high.get(g) : g;
        int lo = andExists(f0, g0, vars, memo, existsMemo);
        if (vars.get(v)) {
            r = lo == TRUE ? TRUE : or(lo, andExists(f1, g1, vars, memo, existsMemo));
        } else {
            r = mk(v, lo, andExists(f1, g1, vars, memo, existsMemo));
        }
        memo.put(key, r);
        return r;
    }

    /**
     * Substitute variables: every occurrence of variable v in f is replaced by mapping[v].
     * Variables beyond the end of mapping, or mapped to a negative value, are left alone. The
     * mapping must be injective on the support of f.
     */
    public int rename(int f, int[] mapping) {
        return rename(f, mapping, newUnaryCache());
    }

    private int rename(int f, int[] mapping, TIntIntHashMap memo) {
        if (f <= TRUE) return f;
        int r = memo.get(f);
        if (r != ABSENT) return r;
        final int v = level.get(f);
        final int nv = v < mapping.length && mapping[v] >= 0 ? mapping[v] : v;
        checkVariable(nv);
        int lo = rename(low.get(f), mapping, memo);
        int hi = rename(high.get(f), mapping, memo);
        if (nv < level.get(lo) && nv < level.get(hi)) {
            r = mk(nv, lo, hi);
        } else {
            r = ite(var(nv), hi, lo);
        }
        memo.put(f, r);
        return r;
    }

    /** @return the set of variables f depends on */
    public BitSet support(int f) {
        BitSet s = new BitSet();
        visit(f, n -> s.set(level.get(n)));
        return s;
    }

    /** @return the number of internal nodes reachable from f */
    public int size(int f) {
        int[] count = {0};
        visit(f, n -> ++count[0]);
        return count[0];
    }

    private void visit(int f, Consumer<Integer> action) {
        BitSet seen = new BitSet();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(f);
        while (!stack.isEmpty()) {
            int n = stack.pop();
            if (n <= TRUE || seen.get(n)) continue;
            seen.set(n);
            action.accept(n);
            stack.push(low.get(n));
            stack.push(high.get(n));
        }
    }

    /**
     * Count the assignments to vars satisfying f.
     * @throws IllegalArgumentException if f depends on a variable outside vars
     */
    public BigInteger satCount(int f, BitSet vars) {
        int[] rank = ranks(f, vars);
        final int k = vars.cardinality();
        TIntObjectHashMap<BigInteger> memo = new TIntObjectHashMap<>();
        return satCount(f, rank, k, memo).shiftLeft(rankOf(f, rank, k));
    }

    private int rankOf(int f, int[] rank, int k) {
        return f <= TRUE ? k : rank[level.get(f)];
    }

    private BigInteger satCount(int f, int[] rank, int k, TIntObjectHashMap<BigInteger> memo) {
        if (f == FALSE) return BigInteger.ZERO;
        if (f == TRUE) return BigInteger.ONE;
        BigInteger c = memo.get(f);
        if (c != null) return c;
        final int r = rank[level.get(f)];
        final int lo = low.get(f), hi = high.get(f);
        c = satCount(lo, rank, k, memo).shiftLeft(rankOf(lo, rank, k) - r - 1)
                .add(satCount(hi, rank, k, memo).shiftLeft(rankOf(hi, rank, k) - r - 1));
        memo.put(f, c);
        return c;
    }

    /** Position of each variable of vars in variable order; checks the support of f. */
    private int[] ranks(int f, BitSet vars) {
        int[] rank = new int[names.size()];
        Arrays.fill(rank, -1);
        int i = 0;
        for (int v = vars.nextSetBit(0); v >= 0; v = vars.nextSetBit(v + 1)) {
            checkVariable(v);
            rank[v] = i++;
        }
        BitSet support = support(f);
        support.andNot(vars);
        if (!support.isEmpty()) {
            throw new IllegalArgumentException("formula depends on variables outside the counted set: " + support);
        }
        return rank;
    }

    /**
     * Call action with every assignment to vars satisfying f, each given as the set of
     * variables assigned true, in increasing binary order (first variable most significant).
     * The BitSet passed to the action is reused between calls.
     */
    public void forEachSat(int f, BitSet vars, Consumer<BitSet> action) {
        ranks(f, vars);
        int[] order = vars.stream().toArray();
        forEachSat(f, order, 0, new BitSet(), action);
    }

    private void forEachSat(int f, int[] order, int i, BitSet current, Consumer<BitSet> action) {
        if (f == FALSE) return;
        if (i == order.length) {
            action.accept(current);
            return;
        }
        final int v = order[i];
        final boolean tested = f > TRUE && level.get(f) == v;
        current.clear(v);
        forEachSat(tested ? low.get(f) : f, order, i + 1, current, action);
        current.set(v);
        forEachSat(tested ? high.get(f) : f, order, i + 1, current, action);
        current.clear(v);
    }

    /** @return some satisfying assignment of f (variables not mentioned are false), or empty */
    public Optional<BitSet> anySat(int f) {
        if (f == FALSE) return Optional.empty();
        BitSet s = new BitSet();
        while (f > TRUE) {
            if (low.get(f) != FALSE) {
                f = low.get(f);
            } else {
                s.set(level.get(f));
                f = high.get(f);
            }
        }
        return Optional.of(s);
    }

    public void clearCaches() {
        andCache.clear();
        orCache.clear();
        xorCache.clear();
        notCache.clear();
    }

    @Override
    public String toString() {
        return String.format("BddManager[%d variables, %d nodes]", names.size(), level.size());
    }
}
