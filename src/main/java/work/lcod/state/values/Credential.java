package work.lcod.state.values;

import java.util.Objects;

/**
 * User name plus secret. Only the user name takes part in desired-state comparisons.
 */
public record Credential(String userName, SecureValue secret) {
    public Credential {
        Objects.requireNonNull(userName, "userName");
        secret = secret == null ? SecureValue.empty() : secret;
    }

    public static Credential of(String userName, String secret) {
        return new Credential(userName, SecureValue.of(secret));
    }
}
