package work.lcod.state.values;

/**
 * Implemented by flag-style enumerations that persist as their numeric value instead of their name.
 */
public interface NumericValue {
    long numericValue();
}
