package net.langexplorer.expanders;

import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.util.grammar.Grammar;

public enum ExpanderType {

    UNIFORM("montecarlo"),
    WEIGHTED("weightedmontecarlo"),
    LEARNED("learned");

    private final String label;

    private ExpanderType(String label) {
        this.label = label;
    }

    public String toString() {
        return label;
    }

    public <T extends BinarySerializable, I> Expander<T, I> create(
            long seed, ExpansionPolicy<T, I> policy) {
        switch (this) {
            case UNIFORM:
                return new UniformRandomExpander<T, I>(seed);
            case WEIGHTED:
                return new WeightedRandomExpander<T, I>(seed);
            case LEARNED:
                if (policy == null)
                    throw new IllegalArgumentException(
                        "Learned expanders require a policy");
                return new LearnedExpander<T, I>(policy, seed);
            default:
                throw new AssertionError("Unknown expander type " + name());
        }
    }
    public <T extends BinarySerializable, I> Expander<T, I> create(
            long seed) {
        return create(seed, null);
    }

    /**
     * A factory creating expanders of this type; policy may be null unless
     * this is LEARNED.
     */
    public <T extends BinarySerializable, I> ExpanderFactory<T, I> factory(
            final ExpansionPolicy<T, I> policy) {
        if (this == LEARNED && policy == null)
            throw new IllegalArgumentException(
                "Learned expanders require a policy");
        return new ExpanderFactory<T, I>() {
            public Expander<T, I> create(Grammar<T, I> grammar, long seed) {
                return ExpanderType.this.create(seed, policy);
            }
        };
    }
    public <T extends BinarySerializable, I> ExpanderFactory<T, I>
            factory() {
        return factory(null);
    }

    public static ExpanderType fromLabel(String label) {
        for (ExpanderType t : values()) {
            if (t.label.equalsIgnoreCase(label) ||
                    t.name().equalsIgnoreCase(label))
                return t;
        }
        throw new IllegalArgumentException("Unknown expander type: " +
                                           label);
    }

}
