package com.kbase;

/**
 * Typed failure of a knowledge base operation. Callers translate {@link Kind} into their own error envelope.
 */
public class KnowledgeBaseException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        INVALID_REQUEST,
        CONFLICT,
        INTERNAL
    }

    private final Kind kind;

    public KnowledgeBaseException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public KnowledgeBaseException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static KnowledgeBaseException notFound(String message) {
        return new KnowledgeBaseException(Kind.NOT_FOUND, message);
    }

    public static KnowledgeBaseException invalid(String message) {
        return new KnowledgeBaseException(Kind.INVALID_REQUEST, message);
    }

    public static KnowledgeBaseException conflict(String message) {
        return new KnowledgeBaseException(Kind.CONFLICT, message);
    }

    public static KnowledgeBaseException internal(String message, Throwable cause) {
        return new KnowledgeBaseException(Kind.INTERNAL, message, cause);
    }
}
