package com.axlabs.neo.vetoshares;

/**
 * The reasons an operation on {@link VetoSharesGov} can be rejected. Every rejection happens before any state is
 * changed.
 */
public enum ErrorCode {

    NOT_A_MEMBER("Not a member"),
    NOT_YET_FULL("Not yet a full member"),
    RATE_LIMITED("Already acted in the current cooldown period"),
    ALREADY_MEMBER("Already a member"),
    HANDLE_TAKEN("Handle already taken"),
    VETO_WINDOW_CLOSED("Veto window closed"),
    INSUFFICIENT_FUNDS("Insufficient funds"),
    DUPLICATE_PROPOSAL("Proposal already exists"),
    NOT_YET_CLAIMABLE("Proposal not yet claimable"),
    PROPOSAL_NOT_FOUND("Proposal doesn't exist");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
