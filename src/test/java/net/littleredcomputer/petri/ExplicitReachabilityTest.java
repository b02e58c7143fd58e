package net.littleredcomputer.petri;

import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ExplicitReachabilityTest {

    @Test
    public void scenarioA() {
        PetriNet net = TestNets.scenarioA();
        assertThat(ExplicitReachability.reachableMarkings(net), contains(Marking.of("p0"), Marking.of("p1")));
        assertThat(ExplicitReachability.deadMarkings(net), contains(Marking.of("p1")));
    }

    @Test
    public void mutex() {
        PetriNet net = TestNets.mutexDeadlock();
        assertThat(ExplicitReachability.reachableMarkings(net), hasSize(4));
        assertThat(ExplicitReachability.deadMarkings(net), contains(Marking.of("a1", "b1")));
    }

    @Test
    public void ring() {
        assertThat(ExplicitReachability.reachableMarkings(TestNets.ring(7)), hasSize(7));
        assertThat(ExplicitReachability.deadMarkings(TestNets.ring(7)), empty());
    }

    @Test
    public void toggles() {
        assertThat(ExplicitReachability.reachableMarkings(TestNets.toggles(5)), hasSize(32));
    }

    @Test
    public void philosophers() {
        PetriNet net = TestNets.philosophers(3);
        assertThat(ExplicitReachability.deadMarkings(net), contains(Marking.of("left0", "left1", "left2")));
    }

    @Test
    public void noTransitions() {
        PetriNet net = PetriNet.builder().addPlace("p", 1).addPlace("q").build();
        assertThat(ExplicitReachability.reachableMarkings(net), contains(Marking.of("p")));
        assertThat(ExplicitReachability.deadMarkings(net), contains(Marking.of("p")));
    }
}
