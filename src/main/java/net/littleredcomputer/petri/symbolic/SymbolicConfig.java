package net.littleredcomputer.petri.symbolic;

/**
 * Settings fixed when a {@link SymbolicReachability} engine is constructed.
 */
public final class SymbolicConfig {
    /**
     * How place variables are laid out in the BDD variable order. Either way each place's
     * next-state variable immediately follows its current-state variable. Order affects BDD
     * size and running time, never the set computed.
     */
    public enum VariableOrder {
        /** Places sorted by identifier. */
        SORTED_BY_ID,
        /** Places in the order the net declared them. */
        DECLARATION,
    }

    public static final SymbolicConfig DEFAULT = new SymbolicConfig(VariableOrder.SORTED_BY_ID);

    private final VariableOrder variableOrder;

    private SymbolicConfig(VariableOrder variableOrder) {
        this.variableOrder = variableOrder;
    }

    public VariableOrder variableOrder() { return variableOrder; }

    public SymbolicConfig withVariableOrder(VariableOrder order) {
        return new SymbolicConfig(order);
    }

    @Override
    public String toString() { return "SymbolicConfig[order=" + variableOrder + "]"; }
}
