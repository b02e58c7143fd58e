package net.littleredcomputer.petri;

import java.util.Objects;

/** A directed arc. A valid net only has place-to-transition and transition-to-place arcs. */
public final class Arc {
    private final String id;
    private final String source;
    private final String target;

    Arc(String id, String source, String target) {
        this.id = id;
        this.source = source;
        this.target = target;
    }

    public String id() { return id; }
    public String source() { return source; }
    public String target() { return target; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arc)) return false;
        Arc a = (Arc) o;
        return id.equals(a.id) && source.equals(a.source) && target.equals(a.target);
    }

    @Override
    public int hashCode() { return Objects.hash(id, source, target); }

    @Override
    public String toString() { return id + ": " + source + " -> " + target; }
}
