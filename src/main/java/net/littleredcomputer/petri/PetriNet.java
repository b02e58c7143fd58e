package net.littleredcomputer.petri;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * An immutable place/transition net. Places and transitions iterate in the sorted order of
 * their identifiers; presets and postsets are derived once from the arcs at construction.
 */
public class PetriNet {
    private static final Logger log = LogManager.getFormatterLogger(PetriNet.class);

    private final ImmutableMap<String, Place> places;  // declaration order
    private final ImmutableMap<String, Transition> transitions;  // declaration order
    private final ImmutableList<Arc> arcs;
    private final ImmutableSortedMap<String, Place> sortedPlaces;
    private final ImmutableSortedMap<String, Transition> sortedTransitions;
    private final ImmutableMap<String, ImmutableSortedSet<String>> presets;
    private final ImmutableMap<String, ImmutableSortedSet<String>> postsets;

    private PetriNet(Builder b) {
        places = ImmutableMap.copyOf(b.places);
        transitions = ImmutableMap.copyOf(b.transitions);
        arcs = ImmutableList.copyOf(b.arcs);
        sortedPlaces = ImmutableSortedMap.copyOf(places);
        sortedTransitions = ImmutableSortedMap.copyOf(transitions);

        Map<String, SortedSet<String>> pre = new HashMap<>();
        Map<String, SortedSet<String>> post = new HashMap<>();
        for (String t : transitions.keySet()) {
            pre.put(t, new TreeSet<>());
            post.put(t, new TreeSet<>());
        }
        for (Arc a : arcs) {
            if (places.containsKey(a.source())) pre.get(a.target()).add(a.source());
            else post.get(a.source()).add(a.target());
        }
        ImmutableMap.Builder<String, ImmutableSortedSet<String>> preB = ImmutableMap.builder();
        ImmutableMap.Builder<String, ImmutableSortedSet<String>> postB = ImmutableMap.builder();
        for (String t : transitions.keySet()) {
            preB.put(t, ImmutableSortedSet.copyOf(pre.get(t)));
            postB.put(t, ImmutableSortedSet.copyOf(post.get(t)));
        }
        presets = preB.build();
        postsets = postB.build();
    }

    public static Builder builder() { return new Builder(); }

    /** @return places sorted by identifier */
    public Collection<Place> places() { return sortedPlaces.values(); }

    /** @return places in the order in which they were declared */
    public Collection<Place> placesInDeclarationOrder() { return places.values(); }

    /** @return transitions sorted by identifier */
    public Collection<Transition> transitions() { return sortedTransitions.values(); }

    public List<Arc> arcs() { return arcs; }

    public boolean hasPlace(String id) { return places.containsKey(id); }
    public boolean hasTransition(String id) { return transitions.containsKey(id); }

    public Place place(String id) {
        Place p = places.get(id);
        if (p == null) throw new IllegalArgumentException("unknown place: " + id);
        return p;
    }

    public Transition transition(String id) {
        Transition t = transitions.get(id);
        if (t == null) throw new IllegalArgumentException("unknown transition: " + id);
        return t;
    }

    public SortedSet<String> preset(String transition) {
        ImmutableSortedSet<String> s = presets.get(transition);
        if (s == null) throw new IllegalArgumentException("unknown transition: " + transition);
        return s;
    }

    public SortedSet<String> postset(String transition) {
        ImmutableSortedSet<String> s = postsets.get(transition);
        if (s == null) throw new IllegalArgumentException("unknown transition: " + transition);
        return s;
    }

    public SortedSet<String> preset(Transition t) { return preset(t.id()); }
    public SortedSet<String> postset(Transition t) { return postset(t.id()); }

    /**
     * Transitions with an empty preset are enabled in every marking; a net containing one
     * can never be dead.
     */
    public Optional<Transition> alwaysEnabledTransition() {
        return transitions().stream().filter(t -> presets.get(t.id()).isEmpty()).findFirst();
    }

    public Marking initialMarking() {
        return Marking.of(places().stream().filter(Place::isInitiallyMarked).map(Place::id).iterator());
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Number of places      : %d%n", places.size()));
        sb.append(String.format("Number of transitions : %d%n", transitions.size()));
        sb.append(String.format("Number of arcs        : %d%n", arcs.size()));
        sb.append(String.format("%nPlaces:%n"));
        for (Place p : places.values()) {
            sb.append(String.format("  - %-10s | name=%s | initial_marking=%d%n", p.id(), p.name().orElse("-"), p.initialMarking()));
        }
        sb.append(String.format("%nTransitions:%n"));
        for (Transition t : transitions.values()) {
            sb.append(String.format("  - %-10s | name=%s%n", t.id(), t.name().orElse("-")));
        }
        sb.append(String.format("%nArcs:%n"));
        for (Arc a : arcs) {
            sb.append(String.format("  - %-10s : %s -> %s%n", a.id(), a.source(), a.target()));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("PetriNet[%d places, %d transitions, %d arcs]", places.size(), transitions.size(), arcs.size());
    }

    /**
     * Accumulates the elements of a net. Problems are collected rather than thrown, so that
     * {@link #build()} can report all of them at once.
     */
    public static class Builder {
        private final Map<String, Place> places = new LinkedHashMap<>();
        private final Map<String, Transition> transitions = new LinkedHashMap<>();
        private final List<Arc> arcs = new ArrayList<>();
        private final Set<String> arcIds = new HashSet<>();
        private final List<String> errors = new ArrayList<>();

        private Builder() {}

        public Builder addPlace(String id, String name, int initialMarking) {
            if (places.containsKey(id)) {
                errors.add("Duplicate place id: " + id);
                return this;
            }
            if (initialMarking < 0) {
                errors.add(String.format("initialMarking of place %s is negative: %d", id, initialMarking));
            }
            places.put(id, new Place(id, name, initialMarking));
            return this;
        }

        public Builder addPlace(String id, int initialMarking) { return addPlace(id, null, initialMarking); }
        public Builder addPlace(String id) { return addPlace(id, null, 0); }

        public Builder addTransition(String id, String name) {
            if (transitions.containsKey(id)) {
                errors.add("Duplicate transition id: " + id);
                return this;
            }
            transitions.put(id, new Transition(id, name));
            return this;
        }

        public Builder addTransition(String id) { return addTransition(id, null); }

        public Builder addArc(String id, String source, String target) {
            if (!arcIds.add(id)) errors.add("Duplicate arc id: " + id);
            arcs.add(new Arc(id, source, target));
            return this;
        }

        /** Adds an arc with a generated identifier. */
        public Builder addArc(String source, String target) {
            String id;
            int k = arcs.size();
            do id = "a" + k++; while (arcIds.contains(id));
            return addArc(id, source, target);
        }

        /**
         * Convenience for tests and small models: a transition together with its input and
         * output places, which must already have been added.
         */
        public Builder addTransition(String id, Collection<String> preset, Collection<String> postset) {
            addTransition(id);
            for (String p : preset) addArc(p, id);
            for (String p : postset) addArc(id, p);
            return this;
        }

        /** Records a problem found outside the builder (e.g. by a file reader). */
        public Builder reportError(String error) {
            errors.add(error);
            return this;
        }

        public PetriNet build() {
            List<String> problems = new ArrayList<>(errors);
            for (String t : transitions.keySet()) {
                if (places.containsKey(t)) problems.add("Duplicate id between place and transition: " + t);
            }
            for (Arc a : arcs) {
                String s = nodeType(a.source());
                String t = nodeType(a.target());
                if (s == null) {
                    problems.add(String.format("Arc %s refers to non-existing source node '%s'.", a.id(), a.source()));
                }
                if (t == null) {
                    problems.add(String.format("Arc %s refers to non-existing target node '%s'.", a.id(), a.target()));
                }
                if (s != null && s.equals(t)) {
                    problems.add(String.format("Arc %s connects two %ss (%s -> %s), which is not valid in a Petri net.",
                            a.id(), s, a.source(), a.target()));
                }
            }
            if (!problems.isEmpty()) throw new InvalidNetException(problems);
            for (Place p : places.values()) {
                if (p.initialMarking() > 1) {
                    log.warn("place %s holds %d tokens initially; treating it as marked (1-safe encoding)", p.id(), p.initialMarking());
                }
            }
            return new PetriNet(this);
        }

        private String nodeType(String id) {
            // An id shared by a place and a transition is already an error; call it a place.
            if (places.containsKey(id)) return "place";
            if (transitions.containsKey(id)) return "transition";
            return null;
        }
    }
}
