package net.littleredcomputer.petri;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * A 1-safe marking: the set of places currently holding a token.
 */
public final class Marking implements Comparable<Marking> {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private final ImmutableSortedSet<String> marked;

    private Marking(ImmutableSortedSet<String> marked) {
        this.marked = marked;
    }

    public static Marking of(String... places) { return new Marking(ImmutableSortedSet.copyOf(places)); }
    public static Marking of(Iterable<String> places) { return new Marking(ImmutableSortedSet.copyOf(places)); }
    public static Marking of(Iterator<String> places) { return new Marking(ImmutableSortedSet.copyOf(places)); }

    /**
     * Interpret an assignment of booleans to places.
     * @param places the place order in which the assignment is given
     * @param assignment assignment[i] tells whether places.get(i) is marked
     */
    public static Marking fromAssignment(List<String> places, boolean[] assignment) {
        if (places.size() != assignment.length) throw new IllegalArgumentException("assignment length does not match place count");
        ImmutableSortedSet.Builder<String> b = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i < assignment.length; ++i) if (assignment[i]) b.add(places.get(i));
        return new Marking(b.build());
    }

    public boolean[] toAssignment(List<String> places) {
        boolean[] a = new boolean[places.size()];
        for (int i = 0; i < a.length; ++i) a[i] = marked.contains(places.get(i));
        return a;
    }

    public SortedSet<String> places() { return marked; }
    public boolean isMarked(String place) { return marked.contains(place); }
    public int size() { return marked.size(); }

    public boolean isEnabled(PetriNet net, Transition t) {
        return marked.containsAll(net.preset(t));
    }

    /** Fire t, which must be enabled: (m \ preset(t)) ∪ postset(t). */
    public Marking fire(PetriNet net, Transition t) {
        if (!isEnabled(net, t)) throw new IllegalArgumentException("transition " + t + " is not enabled in " + this);
        Set<String> after = Sets.union(Sets.difference(marked, net.preset(t)), net.postset(t));
        return new Marking(ImmutableSortedSet.copyOf(after));
    }

    public List<Transition> enabledTransitions(PetriNet net) {
        return net.transitions().stream().filter(t -> isEnabled(net, t)).collect(Collectors.toList());
    }

    public boolean isDead(PetriNet net) {
        return net.transitions().stream().noneMatch(t -> isEnabled(net, t));
    }

    @Override
    public int compareTo(Marking o) {
        Iterator<String> i = marked.iterator();
        Iterator<String> j = o.marked.iterator();
        while (i.hasNext() && j.hasNext()) {
            int c = i.next().compareTo(j.next());
            if (c != 0) return c;
        }
        return Boolean.compare(i.hasNext(), j.hasNext());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Marking && marked.equals(((Marking) o).marked));
    }

    @Override
    public int hashCode() { return marked.hashCode(); }

    @Override
    public String toString() { return "{" + commaJoiner.join(marked) + "}"; }
}
