package io.syncmesh.storage;

import java.time.Duration;

public final class Namespaces {
    public static final String SESSION = "session:";
    public static final String SUBJECT = "subject:";
    public static final String QUEUE = "queue:";
    public static final String DEAD_LETTER = "dlq:";
    public static final String DEAD_LETTERED_ID = "dlq-id:";
    public static final String IDENTITY = "identity:";
    public static final String CANONICAL = "canonical:";

    public static final Duration SESSION_TTL = Duration.ofHours(24);
    public static final Duration QUEUE_TTL = Duration.ofHours(24);
    public static final Duration DEAD_LETTER_TTL = Duration.ofDays(7);
    public static final Duration NO_EXPIRY = Duration.ZERO;

    private Namespaces() {
    }

    public static String session(String sessionId) {
        return SESSION + sessionId;
    }

    public static String subject(String subjectId) {
        return SUBJECT + subjectId;
    }

    public static String queue(String operationId) {
        return QUEUE + operationId;
    }

    public static String deadLetter(String operationId, long epochMs) {
        return DEAD_LETTER + operationId + ":" + epochMs;
    }

    public static String deadLetteredId(String operationId) {
        return DEAD_LETTERED_ID + operationId;
    }

    public static String identity(String resourceId) {
        return IDENTITY + resourceId;
    }

    public static String canonical(String identity, String resourceId) {
        return CANONICAL + identity + ":" + resourceId;
    }
}
