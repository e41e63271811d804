package com.commandhub.credentials;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * Immutable API key for one external call. The secret never appears in
 * {@link #toString()} or in the journal; only {@link #scope()} does.
 */
public final class Credential {

    public enum Kind {
        CALLER,
        DEFAULT,
        NONE
    }

    private static final Credential NONE = new Credential(null, Kind.NONE);

    private final String token;
    private final Kind kind;

    private Credential(String token, Kind kind) {
        this.token = token;
        this.kind = kind;
    }

    public static Credential caller(String token) {
        return new Credential(requireToken(token), Kind.CALLER);
    }

    public static Credential defaultKey(String token) {
        return new Credential(requireToken(token), Kind.DEFAULT);
    }

    public static Credential none() {
        return NONE;
    }

    public boolean isPresent() {
        return token != null;
    }

    /**
     * Raw secret, for the adapter only. Null for {@link Kind#NONE}.
     */
    public String token() {
        return token;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Reference recorded on Operations: {@code caller:<fingerprint>},
     * {@code default} or {@code none}.
     */
    public String scope() {
        switch (kind) {
            case CALLER:
                return "caller:" + fingerprint();
            case DEFAULT:
                return "default";
            default:
                return "none";
        }
    }

    public String fingerprint() {
        if (token == null) {
            return "";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return toHex(hash).substring(0, 8);
        } catch (Exception e) {
            return Integer.toHexString(token.hashCode());
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private static String requireToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Credential token must not be blank");
        }
        return token.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Credential)) return false;
        Credential that = (Credential) o;
        return kind == that.kind && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, kind);
    }

    @Override
    public String toString() {
        return "Credential{" + scope() + "}";
    }
}
