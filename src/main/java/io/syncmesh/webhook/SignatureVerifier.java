package io.syncmesh.webhook;

import io.syncmesh.util.Hashing;

public final class SignatureVerifier {
    private static final String PREFIX = "sha256=";

    private final String secret;

    public SignatureVerifier(String secret) {
        this.secret = secret == null ? "" : secret;
    }

    public boolean configured() {
        return !secret.isBlank();
    }

    public boolean verify(byte[] body, String signatureHeader) {
        if (!configured() || signatureHeader == null || signatureHeader.isBlank()) {
            return false;
        }
        String supplied = signatureHeader.trim();
        if (supplied.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            supplied = supplied.substring(PREFIX.length());
        }
        return Hashing.constantTimeHexEquals(sign(body), supplied);
    }

    public String sign(byte[] body) {
        return Hashing.hmacSha256Hex(secret, body);
    }
}
