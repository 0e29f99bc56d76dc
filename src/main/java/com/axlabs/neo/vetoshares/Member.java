package com.axlabs.neo.vetoshares;

import io.neow3j.types.Hash160;

/**
 * The record stored for every admitted member. An account is a member if and only if a record with a non-zero
 * {@link #sponsor} is stored for it.
 */
public class Member {

    /**
     * The member that admitted this member. Genesis members are their own sponsors.
     */
    public Hash160 sponsor;

    /**
     * The handle held by this member.
     */
    public Handle handle;

    /**
     * The time of admission in seconds. The member is provisional and can be vetoed until the veto window after
     * this time has passed.
     */
    public long timeJoined;

    /**
     * The time of the member's last sponsoring or proposal submission in seconds. Zero if the member never acted.
     */
    public long lastActionTime;

    public Member(Hash160 sponsor, Handle handle, long timeJoined) {
        this.sponsor = sponsor;
        this.handle = handle;
        this.timeJoined = timeJoined;
        lastActionTime = 0;
    }

    public Member(Member other) {
        sponsor = other.sponsor;
        handle = other.handle;
        timeJoined = other.timeJoined;
        lastActionTime = other.lastActionTime;
    }
}
