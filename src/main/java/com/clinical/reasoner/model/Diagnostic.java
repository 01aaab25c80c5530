package com.clinical.reasoner.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A note returned alongside normal output describing something the engine could not resolve
 */
public final class Diagnostic {

    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::getKind)
            .thenComparing(Diagnostic::getSubject)
            .thenComparing(Diagnostic::getMessage);

    private final DiagnosticKind kind;
    private final String subject;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String subject, String message) {
        this.kind = kind;
        this.subject = subject != null ? subject : "";
        this.message = message != null ? message : "";
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    /**
     * @return Source record id for record problems, drug identity otherwise
     */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic other)) {
            return false;
        }
        return kind == other.kind && subject.equals(other.subject) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, subject, message);
    }

    @Override
    public String toString() {
        return kind + " [" + subject + "]: " + message;
    }
}
