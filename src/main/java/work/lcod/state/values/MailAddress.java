package work.lcod.state.values;

import java.util.Objects;

/**
 * Mail address kept as text; only checks the {@code local@domain} shape.
 */
public record MailAddress(String address) {
    public MailAddress {
        Objects.requireNonNull(address, "address");
        int at = address.indexOf('@');
        if (at <= 0 || at != address.lastIndexOf('@') || at == address.length() - 1) {
            throw new IllegalArgumentException("Not a mail address: " + address);
        }
    }

    @Override
    public String toString() {
        return address;
    }
}
