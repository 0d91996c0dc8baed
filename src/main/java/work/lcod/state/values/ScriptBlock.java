package work.lcod.state.values;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Executable code block carried as source text.
 *
 * <p>Blocks read back from a capability file never have an evaluator bound, so {@link #invoke()}
 * on them returns the source text. Only blocks built in process with {@link #of(String, Supplier)}
 * produce a computed result.
 */
public final class ScriptBlock {
    private final String source;
    private final Supplier<Object> evaluator;

    private ScriptBlock(String source, Supplier<Object> evaluator) {
        this.source = Objects.requireNonNull(source, "source");
        this.evaluator = evaluator;
    }

    public static ScriptBlock of(String source) {
        return new ScriptBlock(source, null);
    }

    public static ScriptBlock of(String source, Supplier<Object> evaluator) {
        return new ScriptBlock(source, Objects.requireNonNull(evaluator, "evaluator"));
    }

    public String source() {
        return source;
    }

    public boolean isBound() {
        return evaluator != null;
    }

    public Object invoke() {
        return evaluator == null ? source : evaluator.get();
    }

    /**
     * True when the last source line holds a {@code #} comment that would swallow a closing brace
     * written on the same line.
     */
    public boolean endsInComment() {
        int lastBreak = Math.max(source.lastIndexOf('\n'), source.lastIndexOf('\r'));
        return source.indexOf('#', lastBreak + 1) >= 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ScriptBlock that && source.equals(that.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
