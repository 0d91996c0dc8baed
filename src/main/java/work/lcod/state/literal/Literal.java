package work.lcod.state.literal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.state.values.ScriptBlock;

/**
 * Literal value read from capability-file text. Every variant is plain data: turning it into a
 * Java value with {@link #toValue()} never evaluates code.
 */
public interface Literal {
    /**
     * Plain Java value: {@code String}, {@code Number}, {@code Boolean}, {@code null},
     * {@code LinkedHashMap}, {@code ArrayList}, {@link ScriptBlock}, or the result of a known cast.
     */
    Object toValue();

    record StringLiteral(String text) implements Literal {
        public StringLiteral {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Object toValue() {
            return text;
        }
    }

    record NumberLiteral(Number number) implements Literal {
        public NumberLiteral {
            Objects.requireNonNull(number, "number");
        }

        @Override
        public Object toValue() {
            return number;
        }
    }

    record BooleanLiteral(boolean value) implements Literal {
        @Override
        public Object toValue() {
            return value;
        }
    }

    record NullLiteral() implements Literal {
        public static final NullLiteral INSTANCE = new NullLiteral();

        @Override
        public Object toValue() {
            return null;
        }
    }

    /**
     * Map literal; entries keep source order.
     */
    record MapLiteral(Map<String, Literal> entries) implements Literal {
        public MapLiteral {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public Object toValue() {
            var map = new LinkedHashMap<String, Object>();
            entries.forEach((key, literal) -> map.put(key, literal.toValue()));
            return map;
        }
    }

    record CollectionLiteral(List<Literal> elements) implements Literal {
        public CollectionLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public Object toValue() {
            var list = new ArrayList<Object>(elements.size());
            for (Literal element : elements) {
                list.add(element.toValue());
            }
            return list;
        }
    }

    /**
     * Code block body, without the enclosing braces.
     */
    record CodeBlockLiteral(String source) implements Literal {
        public CodeBlockLiteral {
            Objects.requireNonNull(source, "source");
        }

        @Override
        public Object toValue() {
            return ScriptBlock.of(source);
        }
    }

    /**
     * Literal behind a {@code [type]} cast. Known casts convert the value; unknown ones leave it as is.
     */
    record TypedLiteral(String typeName, Literal inner) implements Literal {
        public TypedLiteral {
            Objects.requireNonNull(typeName, "typeName");
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public Object toValue() {
            return LiteralCasts.apply(typeName, inner.toValue());
        }
    }
}
