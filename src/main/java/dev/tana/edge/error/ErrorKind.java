package dev.tana.edge.error;

import java.util.Locale;

/**
 * Failure classes surfaced by host capabilities and the dispatcher.
 *
 * <p>Guest code sees the kind as the {@code kind} property of the rethrown error, and a failed
 * invocation reports it in the {@code X-Tana-Error-Kind} header.</p>
 */
public enum ErrorKind {
    /** Bad input shape or size; never retried, never mutates state. */
    VALIDATION,
    /** A store or gas ceiling was hit. */
    LIMIT,
    /** Egress or ledger-directory I/O failed, or the egress allowlist refused the host. */
    TRANSPORT,
    /** The invocation could not be prepared (missing source, compiler, bootstrap). */
    SETUP;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Kind for a {@link #tag()} read back from the guest, or {@code null} when it names none.
     */
    public static ErrorKind fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        for (ErrorKind kind : values()) {
            if (kind.tag().equals(tag)) {
                return kind;
            }
        }
        return null;
    }
}
