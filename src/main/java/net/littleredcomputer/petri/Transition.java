package net.littleredcomputer.petri;

import java.util.Objects;
import java.util.Optional;

public final class Transition {
    private final String id;
    private final String name;

    Transition(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String id() { return id; }
    public Optional<String> name() { return Optional.ofNullable(name); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition t = (Transition) o;
        return id.equals(t.id) && Objects.equals(name, t.name);
    }

    @Override
    public int hashCode() { return Objects.hash(id, name); }

    @Override
    public String toString() { return id; }
}
