package work.lcod.state.values;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;

/**
 * Secret text that never shows up in {@link #toString()} or trace output.
 */
public final class SecureValue {
    private static final String MASK = "********";

    private final char[] chars;

    private SecureValue(char[] chars) {
        this.chars = chars;
    }

    public static SecureValue of(String plain) {
        Objects.requireNonNull(plain, "plain");
        return new SecureValue(plain.toCharArray());
    }

    public static SecureValue of(char[] plain) {
        Objects.requireNonNull(plain, "plain");
        return new SecureValue(Arrays.copyOf(plain, plain.length));
    }

    public static SecureValue empty() {
        return new SecureValue(new char[0]);
    }

    /**
     * Returns the plain text. Callers own the returned string.
     */
    public String reveal() {
        return new String(chars);
    }

    public int length() {
        return chars.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SecureValue that)) {
            return false;
        }
        return MessageDigest.isEqual(
            reveal().getBytes(StandardCharsets.UTF_8),
            that.reveal().getBytes(StandardCharsets.UTF_8)
        );
    }

    @Override
    public int hashCode() {
        return chars.length;
    }

    @Override
    public String toString() {
        return MASK;
    }
}
