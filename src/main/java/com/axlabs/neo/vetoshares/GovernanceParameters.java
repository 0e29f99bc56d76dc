package com.axlabs.neo.vetoshares;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The governance parameters, keyed by name. All durations are given in seconds.
 * <p>
 * Parameters are fixed once the governance is deployed.
 */
public class GovernanceParameters {

    public static final long ONE_WEEK = 604800; // seconds
    // Upper bound for the veto window and the cooldown. Keeps time arithmetic like the end of a veto window in range.
    public static final long MAX_DURATION = 100 * 365 * 24 * 3600L; // seconds, 100 years

    // Parameter keys
    public static final String VETO_WINDOW_KEY = "veto_window"; // seconds
    public static final String COOLDOWN_KEY = "cooldown"; // seconds
    public static final String RELEASE_VETOED_HANDLES_KEY = "release_vetoed_handles"; // boolean (0/1)
    public static final String STRICT_PROPOSAL_VETO_KEY = "strict_proposal_veto"; // boolean (0/1)

    private final Map<String, Long> params = new LinkedHashMap<>();

    /**
     * Creates parameters with the default values, i.e., one week for all durations and compatibility behaviour for
     * the handle release and the proposal veto.
     */
    public GovernanceParameters() {
        params.put(VETO_WINDOW_KEY, ONE_WEEK);
        params.put(COOLDOWN_KEY, ONE_WEEK);
        params.put(RELEASE_VETOED_HANDLES_KEY, 0L);
        params.put(STRICT_PROPOSAL_VETO_KEY, 0L);
    }

    public GovernanceParameters(Map<String, Long> values) {
        this();
        values.forEach(this::set);
    }

    /**
     * Sets the parameter with {@code paramKey} to {@code value}.
     *
     * @param paramKey the parameter's key.
     * @param value    the new value.
     * @return this.
     * @throws IllegalArgumentException if the key is unknown or the value is invalid for the parameter.
     */
    public GovernanceParameters set(String paramKey, long value) {
        throwOnInvalidValue(paramKey, value);
        params.put(paramKey, value);
        return this;
    }

    private static void throwOnInvalidValue(String paramKey, long value) {
        switch (paramKey) {
            case VETO_WINDOW_KEY:
                if (value <= 0 || value > MAX_DURATION) throw invalidValue(paramKey, value);
                break;
            case COOLDOWN_KEY:
                if (value < 0 || value > MAX_DURATION) throw invalidValue(paramKey, value);
                break;
            case RELEASE_VETOED_HANDLES_KEY:
            case STRICT_PROPOSAL_VETO_KEY:
                if (value != 0 && value != 1) throw invalidValue(paramKey, value);
                break;
            default:
                throw new IllegalArgumentException("Unknown parameter '" + paramKey + "'");
        }
    }

    private static IllegalArgumentException invalidValue(String paramKey, long value) {
        return new IllegalArgumentException("Invalid value " + value + " for parameter '" + paramKey + "'");
    }

    /**
     * @param paramKey the parameter's key.
     * @return the parameter's value or null if there is no such parameter.
     */
    public Long get(String paramKey) {
        return params.get(paramKey);
    }

    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * The veto window applies to new members and to proposals. A member becomes a full member when its veto window
     * ends, and a proposal becomes claimable when its veto window ends.
     *
     * @return the length of the veto window.
     */
    public long getVetoWindow() {
        return params.get(VETO_WINDOW_KEY);
    }

    public long getCooldown() {
        return params.get(COOLDOWN_KEY);
    }

    public boolean releasesVetoedHandles() {
        return params.get(RELEASE_VETOED_HANDLES_KEY) == 1;
    }

    public boolean isProposalVetoStrict() {
        return params.get(STRICT_PROPOSAL_VETO_KEY) == 1;
    }

    @Override
    public String toString() {
        return params.toString();
    }
}
