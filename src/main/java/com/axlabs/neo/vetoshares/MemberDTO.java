package com.axlabs.neo.vetoshares;

import io.neow3j.types.Hash160;

/**
 * Used to return all member information as one structure in getter methods.
 */
public class MemberDTO {

    public Hash160 account;
    public Hash160 sponsor;
    public Handle handle;
    public long timeJoined;
    public long lastActionTime;
    public boolean full;

    public MemberDTO() {
    }
}
