package com.projectgroup5.pongarena.service;

public class TournamentConflictException extends RuntimeException {
    private final TournamentErrorCode code;

    public TournamentConflictException(TournamentErrorCode code) {
        super(code.getMessage());
        this.code = code;
    }

    public TournamentErrorCode getCode() {
        return code;
    }
}
