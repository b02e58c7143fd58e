package net.littleredcomputer.petri;

import java.util.Objects;
import java.util.Optional;

/**
 * A place of a Petri net. The symbolic and search engines only distinguish marked from
 * unmarked, so any positive initial token count reads as "initially marked".
 */
public final class Place {
    private final String id;
    private final String name;
    private final int initialMarking;

    Place(String id, String name, int initialMarking) {
        this.id = id;
        this.name = name;
        this.initialMarking = initialMarking;
    }

    public String id() { return id; }
    public Optional<String> name() { return Optional.ofNullable(name); }
    public int initialMarking() { return initialMarking; }
    public boolean isInitiallyMarked() { return initialMarking > 0; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Place)) return false;
        Place p = (Place) o;
        return initialMarking == p.initialMarking && id.equals(p.id) && Objects.equals(name, p.name);
    }

    @Override
    public int hashCode() { return Objects.hash(id, name, initialMarking); }

    @Override
    public String toString() { return id; }
}
