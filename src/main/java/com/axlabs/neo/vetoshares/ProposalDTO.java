package com.axlabs.neo.vetoshares;

import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;

/**
 * Used to return all proposal information as one structure in getter methods.
 */
public class ProposalDTO {

    public Hash256 id;
    public Hash160 sponsor;
    public ProposalUrl url;
    public Hash256 digest;
    public Hash160 wallet;
    public BigInteger value;
    public long timeSubmitted;
    public long vetoWindowEnd;
    public boolean neutralized;

    public ProposalDTO() {
    }
}
