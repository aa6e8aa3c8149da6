package com.productvideo.matching.vision.progress;

/**
 * Expected item count of a tracked stream. {@code PLACEHOLDER} means items arrived
 * before the batch announcement and the real count is still pending; it never
 * satisfies a completion check.
 */
public final class ExpectedCount {
    public enum Kind {
        UNKNOWN,
        PLACEHOLDER,
        KNOWN
    }

    private static final ExpectedCount UNKNOWN = new ExpectedCount(Kind.UNKNOWN, 0);
    private static final ExpectedCount PLACEHOLDER = new ExpectedCount(Kind.PLACEHOLDER, 0);

    private final Kind kind;
    private final int value;

    private ExpectedCount(Kind kind, int value) {
        this.kind = kind;
        this.value = value;
    }

    public static ExpectedCount unknown() {
        return UNKNOWN;
    }

    public static ExpectedCount placeholder() {
        return PLACEHOLDER;
    }

    public static ExpectedCount known(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("expected count must be >= 0");
        }
        return new ExpectedCount(Kind.KNOWN, value);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isKnown() {
        return kind == Kind.KNOWN;
    }

    /** The real count; only meaningful when {@link #isKnown()}. */
    public int getValue() {
        if (kind != Kind.KNOWN) {
            throw new IllegalStateException("expected count is " + kind);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExpectedCount other)) {
            return false;
        }
        return kind == other.kind && value == other.value;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + value;
    }

    @Override
    public String toString() {
        return kind == Kind.KNOWN ? String.valueOf(value) : kind.name();
    }
}
