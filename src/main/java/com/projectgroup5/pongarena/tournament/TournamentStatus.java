package com.projectgroup5.pongarena.tournament;

public enum TournamentStatus {
    REGISTERING,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isOpen() {
        return this == REGISTERING || this == ACTIVE;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
