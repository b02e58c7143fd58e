package net.littleredcomputer.petri;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when a net description violates the structural rules of a Petri net. Every
 * violation found is reported, not only the first.
 */
public class InvalidNetException extends IllegalArgumentException {
    private final ImmutableList<String> errors;

    public InvalidNetException(List<String> errors) {
        super(Joiner.on('\n').join(errors));
        this.errors = ImmutableList.copyOf(errors);
    }

    public InvalidNetException(String error, Throwable cause) {
        super(error, cause);
        this.errors = ImmutableList.of(error);
    }

    public List<String> errors() { return errors; }
}
