package net.littleredcomputer.petri;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Breadth-first enumeration of the reachable markings, one marking at a time. Exponential
 * in the worst case; meant for small nets and for checking the symbolic engine.
 */
public class ExplicitReachability {
    private static final Logger log = LogManager.getFormatterLogger(ExplicitReachability.class);

    private ExplicitReachability() {}

    public static SortedSet<Marking> reachableMarkings(PetriNet net) {
        Stopwatch sw = Stopwatch.createStarted();
        Marking initial = net.initialMarking();
        Set<Marking> visited = new HashSet<>();
        Queue<Marking> queue = new ArrayDeque<>();
        visited.add(initial);
        queue.add(initial);
        while (!queue.isEmpty()) {
            Marking m = queue.remove();
            for (Transition t : net.transitions()) {
                if (!m.isEnabled(net, t)) continue;
                Marking n = m.fire(net, t);
                if (visited.add(n)) queue.add(n);
            }
        }
        log.debug("bfs: %d markings in %s", visited.size(), sw);
        return ImmutableSortedSet.copyOf(visited);
    }

    public static SortedSet<Marking> deadMarkings(PetriNet net) {
        return reachableMarkings(net).stream()
                .filter(m -> m.isDead(net))
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
