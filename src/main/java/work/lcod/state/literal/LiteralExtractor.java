package work.lcod.state.literal;

import java.util.ArrayList;
import java.util.List;
import work.lcod.state.literal.Literal.CollectionLiteral;

/**
 * Reads literal values back out of capability-file text without evaluating anything.
 *
 * <p>The text is read as the argument list of a command that is never run: each argument is
 * parsed into a {@link Literal} tree. A collection argument contributes one literal per element,
 * any other argument contributes itself.
 */
public final class LiteralExtractor {

    /**
     * @throws MalformedLiteralException when the text does not parse; no literals are returned
     * @throws UnsupportedArgumentShapeException when an argument is not a literal (variable
     *     reference, sub-expression, command, expandable string)
     */
    public List<Literal> extractArguments(String text) {
        List<Literal> arguments = new LiteralParser(text).parseArguments();
        var literals = new ArrayList<Literal>();
        for (Literal argument : arguments) {
            if (argument instanceof CollectionLiteral collection) {
                literals.addAll(collection.elements());
            } else {
                literals.add(argument);
            }
        }
        return literals;
    }

    public List<Object> extractValues(String text) {
        var values = new ArrayList<Object>();
        for (Literal literal : extractArguments(text)) {
            values.add(literal.toValue());
        }
        return values;
    }

    /**
     * Parses text holding exactly one expression, the inverse of a single serializer call.
     */
    public Literal extract(String text) {
        return new LiteralParser(text).parseSingle();
    }

    public Object extractValue(String text) {
        return extract(text).toValue();
    }
}
