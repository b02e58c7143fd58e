package net.littleredcomputer.petri;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MarkingTest {
    private final PetriNet mutex = TestNets.mutexDeadlock();

    @Test
    public void firing() {
        Marking m = mutex.initialMarking();
        Marking n = m.fire(mutex, mutex.transition("ta1"));
        assertThat(n, is(Marking.of("a1", "b0", "r2")));
        assertThat(n.fire(mutex, mutex.transition("ta2")), is(m));
    }

    @Test
    public void passThroughPlaceStaysMarked() {
        PetriNet net = PetriNet.builder()
                .addPlace("p", 1)
                .addPlace("q")
                .addTransition("t", ImmutableList.of("p"), ImmutableList.of("p", "q"))
                .build();
        assertThat(net.initialMarking().fire(net, net.transition("t")), is(Marking.of("p", "q")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void firingDisabledTransitionThrows() {
        mutex.initialMarking().fire(mutex, mutex.transition("ta2"));
    }

    @Test
    public void enabledAndDead() {
        List<String> enabled = mutex.initialMarking().enabledTransitions(mutex).stream()
                .map(Transition::id).collect(Collectors.toList());
        assertThat(enabled, contains("ta1", "tb1"));
        assertThat(Marking.of("a1", "b1").isDead(mutex), is(true));
        assertThat(mutex.initialMarking().isDead(mutex), is(false));
    }

    @Test
    public void assignments() {
        List<String> order = ImmutableList.of("a", "b", "c");
        Marking m = Marking.fromAssignment(order, new boolean[]{true, false, true});
        assertThat(m, is(Marking.of("c", "a")));
        assertThat(m.toAssignment(order), is(new boolean[]{true, false, true}));
        assertThat(m.toString(), is("{a, c}"));
        assertThat(Marking.of().toString(), is("{}"));
    }

    @Test
    public void ordering() {
        assertThat(ImmutableList.of(Marking.of("b"), Marking.of("a", "c"), Marking.of(), Marking.of("a")).stream()
                        .sorted().map(Marking::toString).collect(Collectors.toList()),
                contains("{}", "{a}", "{a, c}", "{b}"));
    }
}
