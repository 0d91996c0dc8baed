package work.lcod.state.literal;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.state.literal.Literal.BooleanLiteral;
import work.lcod.state.literal.Literal.CodeBlockLiteral;
import work.lcod.state.literal.Literal.CollectionLiteral;
import work.lcod.state.literal.Literal.MapLiteral;
import work.lcod.state.literal.Literal.NullLiteral;
import work.lcod.state.literal.Literal.NumberLiteral;
import work.lcod.state.literal.Literal.StringLiteral;
import work.lcod.state.literal.Literal.TypedLiteral;

/**
 * Recursive-descent parser for the literal subset of the capability-file language. It builds
 * {@link Literal} trees only; anything that would need evaluation raises
 * {@link UnsupportedArgumentShapeException}, anything that does not parse raises
 * {@link MalformedLiteralException}.
 *
 * <p>Top-level text is read in argument mode, as the argument list of a command: arguments are
 * separated by whitespace and bare words are strings. Nested values are read in expression mode.
 */
final class LiteralParser {
    private static final Pattern NUMBER = Pattern.compile(
        "[+-]?(?:0[xX][0-9a-fA-F]+|(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?)[dDlL]?"
    );
    private static final Pattern BARE_KEY = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_.\\-]*");
    private static final String WORD_STOP = " \t\r\n,;(){}'\"#|&<>";

    private final String text;
    private int pos;

    LiteralParser(String text) {
        this.text = text == null ? "" : text;
    }

    List<Literal> parseArguments() {
        var arguments = new ArrayList<Literal>();
        skipTrivia(true);
        while (!atEnd()) {
            arguments.add(parseCommaList(true));
            skipTrivia(true);
        }
        return arguments;
    }

    Literal parseSingle() {
        skipTrivia(true);
        if (atEnd()) {
            throw malformed("Expected a value");
        }
        Literal value = parseCommaList(false);
        skipTrivia(true);
        if (!atEnd()) {
            throw malformed("Unexpected text after value");
        }
        return value;
    }

    /**
     * Comma expression: {@code a, b, c} builds a collection, a leading comma builds a singleton.
     */
    private Literal parseCommaList(boolean argumentMode) {
        skipTrivia(false);
        Literal first = peek() == ',' ? parseUnaryComma(argumentMode) : parseUnary(argumentMode);
        skipTrivia(false);
        if (peek() != ',') {
            return first;
        }
        var elements = new ArrayList<Literal>();
        elements.add(first);
        while (peek() == ',') {
            pos++;
            skipTrivia(true);
            elements.add(parseUnary(argumentMode));
            skipTrivia(false);
        }
        return new CollectionLiteral(elements);
    }

    private Literal parseUnaryComma(boolean argumentMode) {
        pos++;
        skipTrivia(true);
        return new CollectionLiteral(List.of(parseUnary(argumentMode)));
    }

    private Literal parseUnary(boolean argumentMode) {
        skipTrivia(false);
        if (atEnd()) {
            throw malformed("Expected a value");
        }
        char ch = peek();
        if (ch == '[') {
            return parseCast(argumentMode);
        }
        if (ch == '\'') {
            return new StringLiteral(parseSingleQuoted());
        }
        if (ch == '"') {
            return new StringLiteral(parseDoubleQuoted());
        }
        if (ch == '@') {
            char next = peekAt(1);
            if (next == '\'' || next == '"') {
                return new StringLiteral(parseHereString());
            }
            if (next == '{') {
                return parseMap();
            }
            if (next == '(') {
                return parseArrayExpression();
            }
            throw malformed("Unexpected '@'");
        }
        if (ch == '(') {
            return parseGroup();
        }
        if (ch == '{') {
            return parseCodeBlock();
        }
        if (ch == '$') {
            return parseVariable();
        }
        Literal number = tryParseNumber();
        if (number != null) {
            return number;
        }
        if (ch == ',' || ch == ';' || ch == ')' || ch == '}' || ch == '=') {
            throw malformed("Unexpected '" + ch + "'");
        }
        int start = pos;
        String word = readWord();
        if (word.isEmpty()) {
            throw malformed("Unexpected '" + ch + "'");
        }
        if (argumentMode) {
            return new StringLiteral(word);
        }
        throw new UnsupportedArgumentShapeException("command", word, start);
    }

    private Literal parseCast(boolean argumentMode) {
        int start = pos;
        int depth = 0;
        int end = -1;
        for (int i = pos; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '[') {
                depth++;
            } else if (ch == ']') {
                depth--;
                if (depth == 0) {
                    end = i;
                    break;
                }
            } else if (ch == '\n' || ch == '\r') {
                break;
            }
        }
        if (end < 0) {
            throw malformed("Unterminated type name");
        }
        String typeName = text.substring(start + 1, end).trim();
        if (typeName.isEmpty() || !Character.isLetter(typeName.charAt(0))) {
            throw malformed("Invalid type name '" + typeName + "'");
        }
        pos = end + 1;
        return new TypedLiteral(typeName, parseUnary(argumentMode));
    }

    private String parseSingleQuoted() {
        int start = pos;
        pos++;
        var builder = new StringBuilder();
        while (!atEnd()) {
            char ch = text.charAt(pos);
            if (ch == '\'') {
                if (peekAt(1) == '\'') {
                    builder.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                return builder.toString();
            }
            builder.append(ch);
            pos++;
        }
        throw new MalformedLiteralException("Unterminated string", start);
    }

    private String parseDoubleQuoted() {
        int start = pos;
        pos++;
        var builder = new StringBuilder();
        while (!atEnd()) {
            char ch = text.charAt(pos);
            if (ch == '"') {
                if (peekAt(1) == '"') {
                    builder.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return builder.toString();
            }
            appendExpandableChar(builder, start);
        }
        throw new MalformedLiteralException("Unterminated string", start);
    }

    /**
     * Appends the character at {@code pos} of a double-quoted body, resolving backtick escapes.
     */
    private void appendExpandableChar(StringBuilder builder, int stringStart) {
        char ch = text.charAt(pos);
        if (ch == '`') {
            if (pos + 1 >= text.length()) {
                throw new MalformedLiteralException("Dangling escape", pos);
            }
            char escaped = text.charAt(pos + 1);
            pos += 2;
            switch (escaped) {
                case '0' -> builder.append('\0');
                case 'a' -> builder.append('\u0007');
                case 'b' -> builder.append('\b');
                case 'e' -> builder.append('\u001b');
                case 'f' -> builder.append('\f');
                case 'n' -> builder.append('\n');
                case 'r' -> builder.append('\r');
                case 't' -> builder.append('\t');
                case 'v' -> builder.append('\u000B');
                case 'u' -> builder.appendCodePoint(readUnicodeEscape());
                default -> builder.append(escaped);
            }
            return;
        }
        if (ch == '$') {
            char next = peekAt(1);
            if (Character.isLetter(next) || next == '_' || next == '{' || next == '(' || next == '?' || next == '^' || next == ':') {
                throw new UnsupportedArgumentShapeException("expandable string", excerpt(stringStart), stringStart);
            }
        }
        builder.append(ch);
        pos++;
    }

    private int readUnicodeEscape() {
        if (peek() != '{') {
            throw malformed("Expected '{' in unicode escape");
        }
        int close = text.indexOf('}', pos);
        if (close < 0) {
            throw malformed("Unterminated unicode escape");
        }
        String hex = text.substring(pos + 1, close);
        int codePoint;
        try {
            codePoint = Integer.parseInt(hex, 16);
        } catch (NumberFormatException ex) {
            throw malformed("Invalid unicode escape '" + hex + "'");
        }
        if (!Character.isValidCodePoint(codePoint)) {
            throw malformed("Invalid unicode escape '" + hex + "'");
        }
        pos = close + 1;
        return codePoint;
    }

    private String parseHereString() {
        int start = pos;
        char quote = text.charAt(pos + 1);
        pos += 2;
        while (peek() == ' ' || peek() == '\t') {
            pos++;
        }
        if (!consumeNewline()) {
            throw malformed("Here-string header must end the line");
        }
        int contentStart = pos;
        String terminator = quote + "@";
        int end = -1;
        for (int i = contentStart; i <= text.length() - 2; i++) {
            if (text.startsWith(terminator, i) && (i == contentStart || text.charAt(i - 1) == '\n' || text.charAt(i - 1) == '\r')) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            throw new MalformedLiteralException("Unterminated here-string", start);
        }
        int contentEnd = end;
        if (contentEnd > contentStart && text.charAt(contentEnd - 1) == '\n') {
            contentEnd--;
        }
        if (contentEnd > contentStart && text.charAt(contentEnd - 1) == '\r') {
            contentEnd--;
        }
        String raw = text.substring(contentStart, Math.max(contentStart, contentEnd));
        pos = end + 2;
        if (quote == '\'') {
            return raw;
        }
        var nested = new LiteralParser(raw);
        var builder = new StringBuilder();
        while (!nested.atEnd()) {
            nested.appendExpandableChar(builder, 0);
        }
        return builder.toString();
    }

    private Literal parseMap() {
        int start = pos;
        pos += 2;
        var entries = new LinkedHashMap<String, Literal>();
        while (true) {
            skipSeparators();
            if (atEnd()) {
                throw new MalformedLiteralException("Unterminated map", start);
            }
            if (peek() == '}') {
                pos++;
                return new MapLiteral(entries);
            }
            int keyStart = pos;
            String key = parseKey();
            skipTrivia(false);
            if (peek() != '=') {
                throw malformed("Expected '=' after key '" + key + "'");
            }
            pos++;
            skipTrivia(true);
            Literal value = parseCommaList(false);
            if (entries.containsKey(key)) {
                throw new MalformedLiteralException("Duplicate key '" + key + "'", keyStart);
            }
            entries.put(key, value);
            skipTrivia(false);
            char next = peek();
            if (!atEnd() && next != ';' && next != '\n' && next != '\r' && next != '}') {
                throw malformed("Expected ';' or a line break between map entries");
            }
        }
    }

    private String parseKey() {
        char ch = peek();
        if (ch == '\'') {
            return parseSingleQuoted();
        }
        if (ch == '"') {
            return parseDoubleQuoted();
        }
        if (ch == '$') {
            Literal variable = parseVariable();
            return String.valueOf(variable.toValue());
        }
        Literal number = tryParseNumber();
        if (number != null) {
            return String.valueOf(number.toValue());
        }
        Matcher matcher = BARE_KEY.matcher(text).region(pos, text.length());
        if (matcher.lookingAt()) {
            pos = matcher.end();
            return matcher.group();
        }
        throw malformed("Expected a map key");
    }

    private Literal parseArrayExpression() {
        int start = pos;
        pos += 2;
        var elements = new ArrayList<Literal>();
        while (true) {
            skipSeparators();
            if (atEnd()) {
                throw new MalformedLiteralException("Unterminated array", start);
            }
            if (peek() == ')') {
                pos++;
                return new CollectionLiteral(elements);
            }
            Literal statement = parseCommaList(false);
            if (statement instanceof CollectionLiteral collection) {
                elements.addAll(collection.elements());
            } else {
                elements.add(statement);
            }
            skipTrivia(false);
            char next = peek();
            if (!atEnd() && next != ';' && next != '\n' && next != '\r' && next != ')') {
                throw malformed("Expected ';' or a line break between array statements");
            }
        }
    }

    private Literal parseGroup() {
        int start = pos;
        pos++;
        skipTrivia(true);
        if (peek() == ')') {
            throw malformed("Empty parentheses");
        }
        Literal inner = parseCommaList(false);
        skipTrivia(true);
        if (atEnd()) {
            throw new MalformedLiteralException("Unterminated parentheses", start);
        }
        if (peek() != ')') {
            throw malformed("Expected ')'");
        }
        pos++;
        return inner;
    }

    private Literal parseCodeBlock() {
        int start = pos;
        int end = findBlockEnd(start);
        pos = end + 1;
        // body only, the enclosing braces belong to the literal syntax
        return new CodeBlockLiteral(text.substring(start + 1, end));
    }

    /**
     * Index of the brace closing the block opened at {@code start}, skipping strings and comments.
     */
    private int findBlockEnd(int start) {
        int depth = 0;
        int i = start;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '`') {
                i += 2;
                continue;
            }
            if (ch == '#') {
                i = lineEnd(i);
                continue;
            }
            if (ch == '<' && i + 1 < text.length() && text.charAt(i + 1) == '#') {
                int close = text.indexOf("#>", i + 2);
                if (close < 0) {
                    break;
                }
                i = close + 2;
                continue;
            }
            if (ch == '@' && i + 1 < text.length() && (text.charAt(i + 1) == '\'' || text.charAt(i + 1) == '"')
                && isHereStringHeader(i)) {
                String terminator = text.charAt(i + 1) + "@";
                int close = findLineStart(terminator, i + 2);
                if (close < 0) {
                    break;
                }
                i = close + 2;
                continue;
            }
            if (ch == '\'' || ch == '"') {
                i = skipQuoted(i);
                if (i < 0) {
                    break;
                }
                continue;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        throw new MalformedLiteralException("Unterminated code block", start);
    }

    private boolean isHereStringHeader(int at) {
        int i = at + 2;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i < text.length() && (text.charAt(i) == '\n' || text.charAt(i) == '\r');
    }

    private int findLineStart(String terminator, int from) {
        int index = text.indexOf(terminator, from);
        while (index >= 0) {
            char before = text.charAt(index - 1);
            if (before == '\n' || before == '\r') {
                return index;
            }
            index = text.indexOf(terminator, index + 1);
        }
        return -1;
    }

    private int skipQuoted(int at) {
        char quote = text.charAt(at);
        int i = at + 1;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (quote == '"' && ch == '`') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return -1;
    }

    private Literal parseVariable() {
        int start = pos;
        if (peekAt(1) == '(') {
            throw new UnsupportedArgumentShapeException("sub-expression", excerpt(start), start);
        }
        pos++;
        int nameStart = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_' || peek() == ':' || peek() == '?')) {
            pos++;
        }
        String name = text.substring(nameStart, pos);
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "true" -> new BooleanLiteral(true);
            case "false" -> new BooleanLiteral(false);
            case "null" -> NullLiteral.INSTANCE;
            default -> throw new UnsupportedArgumentShapeException("variable reference", "$" + name, start);
        };
    }

    private Literal tryParseNumber() {
        Matcher matcher = NUMBER.matcher(text).region(pos, text.length());
        if (!matcher.lookingAt()) {
            return null;
        }
        int end = matcher.end();
        if (end < text.length() && WORD_STOP.indexOf(text.charAt(end)) < 0 && text.charAt(end) != ']' && text.charAt(end) != '=') {
            return null;
        }
        String token = matcher.group();
        Number number;
        try {
            number = toNumber(token);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw malformed("Invalid number '" + token + "'");
        }
        pos = end;
        return new NumberLiteral(number);
    }

    private static Number toNumber(String token) {
        String body = token;
        boolean negative = false;
        if (body.startsWith("+") || body.startsWith("-")) {
            negative = body.startsWith("-");
            body = body.substring(1);
        }
        if (body.startsWith("0x") || body.startsWith("0X")) {
            long value = Long.parseLong(body.substring(2), 16);
            value = negative ? -value : value;
            return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (Number) (int) value : (Number) value;
        }
        char suffix = Character.toLowerCase(body.charAt(body.length() - 1));
        String digits = (negative ? "-" : "") + (suffix == 'd' || suffix == 'l' ? body.substring(0, body.length() - 1) : body);
        if (suffix == 'd') {
            return new BigDecimal(digits);
        }
        if (suffix == 'l') {
            return new BigDecimal(digits).longValueExact();
        }
        if (digits.indexOf('.') >= 0 || digits.indexOf('e') >= 0 || digits.indexOf('E') >= 0) {
            return Double.parseDouble(digits);
        }
        BigInteger integer = new BigInteger(digits);
        if (integer.bitLength() < 32) {
            return integer.intValue();
        }
        if (integer.bitLength() < 64) {
            return integer.longValue();
        }
        return integer;
    }

    private String readWord() {
        int start = pos;
        while (!atEnd() && WORD_STOP.indexOf(peek()) < 0) {
            pos++;
        }
        return text.substring(start, pos);
    }

    /**
     * Skips blanks, comments and line continuations; line breaks too when {@code newlines} is set.
     */
    private void skipTrivia(boolean newlines) {
        while (!atEnd()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\f' || ch == '\u00A0') {
                pos++;
            } else if ((ch == '\n' || ch == '\r') && newlines) {
                pos++;
            } else if (ch == '`' && (peekAt(1) == '\n' || peekAt(1) == '\r')) {
                pos++;
                consumeNewline();
            } else if (ch == '#') {
                pos = lineEnd(pos);
            } else if (ch == '<' && peekAt(1) == '#') {
                int close = text.indexOf("#>", pos + 2);
                if (close < 0) {
                    throw malformed("Unterminated block comment");
                }
                pos = close + 2;
            } else {
                return;
            }
        }
    }

    private void skipSeparators() {
        while (true) {
            skipTrivia(true);
            if (peek() == ';') {
                pos++;
            } else {
                return;
            }
        }
    }

    private boolean consumeNewline() {
        if (peek() == '\r') {
            pos++;
            if (peek() == '\n') {
                pos++;
            }
            return true;
        }
        if (peek() == '\n') {
            pos++;
            return true;
        }
        return false;
    }

    private int lineEnd(int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    private String excerpt(int from) {
        int end = Math.min(text.length(), lineEnd(from));
        String fragment = text.substring(from, end);
        return fragment.length() > 40 ? fragment.substring(0, 40) + "..." : fragment;
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private char peek() {
        return atEnd() ? '\0' : text.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < text.length() ? text.charAt(index) : '\0';
    }

    private MalformedLiteralException malformed(String message) {
        return new MalformedLiteralException(message, pos);
    }
}
