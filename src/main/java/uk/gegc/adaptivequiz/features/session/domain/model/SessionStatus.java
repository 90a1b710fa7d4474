package uk.gegc.adaptivequiz.features.session.domain.model;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
