package com.axlabs.neo.vetoshares;

import io.neow3j.types.Hash160;

/**
 * One of the initial members the governance is deployed with.
 */
public class GenesisMember {

    public final Hash160 account;
    public final Handle handle;

    public GenesisMember(Hash160 account, Handle handle) {
        this.account = account;
        this.handle = handle;
    }
}
