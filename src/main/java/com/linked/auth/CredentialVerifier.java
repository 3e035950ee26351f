package com.linked.auth;

import java.util.Objects;

/**
 * Holds the single administrator credential pair and compares submissions against it.
 *
 * <p>Comparison is plain {@link Objects#equals}, not constant-time: response timing can leak
 * how many leading characters matched.
 */
public class CredentialVerifier {

    private final Credentials configured;

    public CredentialVerifier(Credentials configured) {
        this.configured = Objects.requireNonNull(configured, "configured");
    }

    /**
     * Splits {@code user:pass} on the first colon, so the password may itself contain colons.
     *
     * @throws MalformedCredentialsException if there is no colon at all
     */
    public static Credentials parse(String raw) {
        if (raw == null) {
            throw new MalformedCredentialsException();
        }
        int idx = raw.indexOf(':');
        if (idx < 0) {
            throw new MalformedCredentialsException();
        }
        return new Credentials(raw.substring(0, idx), raw.substring(idx + 1));
    }

    public static boolean check(Credentials submitted, Credentials configured) {
        if (submitted == null || configured == null) {
            return false;
        }
        return Objects.equals(submitted.getUsername(), configured.getUsername())
                && Objects.equals(submitted.getPassword(), configured.getPassword());
    }

    public boolean check(Credentials submitted) {
        return check(submitted, configured);
    }
}
