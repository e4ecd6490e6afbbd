package com.phillippitts.streamwatch.client;

/**
 * Resolved access credentials for one streamer: an optional session credential and the
 * region/data center it is bound to. Either value may be {@code null}.
 */
public record Credentials(String credential, String region) {

    public static final Credentials NONE = new Credentials(null, null);

    public boolean hasCredential() {
        return credential != null && !credential.isBlank();
    }

    @Override
    public String toString() {
        // Never log the credential itself
        return "Credentials[credential=" + (hasCredential() ? "***" : "none") + ", region=" + region + "]";
    }
}
