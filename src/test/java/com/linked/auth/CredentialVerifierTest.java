package com.linked.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialVerifierTest {

    private final CredentialVerifier verifier = new CredentialVerifier(new Credentials("admin", "hunter2"));

    @Test
    void parseSplitsOnFirstColon() {
        Credentials credentials = CredentialVerifier.parse("admin:pa:ss");

        assertEquals("admin", credentials.getUsername());
        assertEquals("pa:ss", credentials.getPassword());
    }

    @Test
    void parseAllowsEmptyPassword() {
        assertEquals("", CredentialVerifier.parse("admin:").getPassword());
    }

    @Test
    void parseWithoutSeparatorIsMalformed() {
        assertThrows(MalformedCredentialsException.class, () -> CredentialVerifier.parse("adminhunter2"));
        assertThrows(MalformedCredentialsException.class, () -> CredentialVerifier.parse(null));
    }

    @Test
    void checkRequiresExactMatchOfBothFields() {
        assertTrue(verifier.check(new Credentials("admin", "hunter2")));

        assertFalse(verifier.check(new Credentials("admin", "hunter3")));
        assertFalse(verifier.check(new Credentials("root", "hunter2")));
        assertFalse(verifier.check(new Credentials("Admin", "hunter2")));
        assertFalse(verifier.check(new Credentials(null, null)));
        assertFalse(verifier.check(null));
    }

    @Test
    void toStringHidesPassword() {
        assertFalse(new Credentials("admin", "hunter2").toString().contains("hunter2"));
    }
}
