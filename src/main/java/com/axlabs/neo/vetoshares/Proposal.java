package com.axlabs.neo.vetoshares;

import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;

/**
 * The record stored for a submitted spending proposal.
 * <p>
 * Apart from {@link #value} nothing changes after submission. The value is set to zero when the proposal is vetoed
 * or claimed, after which the proposal is neutralized for good.
 */
public class Proposal {

    /**
     * The proposal's ID, i.e., the hash over its content and submission time.
     */
    public Hash256 id;

    public Hash160 sponsor;

    /**
     * The link to the off-chain proposal document.
     */
    public ProposalUrl url;

    /**
     * SHA-256 of the full proposal document.
     */
    public Hash256 digest;

    /**
     * The account the requested funds are paid out to.
     */
    public Hash160 wallet;

    /**
     * The requested amount. Zero once the proposal is vetoed or claimed.
     */
    public BigInteger value;

    /**
     * The submission time in seconds.
     */
    public long timeSubmitted;

    public Proposal(Hash256 id, Hash160 sponsor, ProposalUrl url, Hash256 digest, Hash160 wallet,
            BigInteger value, long timeSubmitted) {
        this.id = id;
        this.sponsor = sponsor;
        this.url = url;
        this.digest = digest;
        this.wallet = wallet;
        this.value = value;
        this.timeSubmitted = timeSubmitted;
    }

    public Proposal(Proposal other) {
        this(other.id, other.sponsor, other.url, other.digest, other.wallet, other.value, other.timeSubmitted);
    }

    public boolean isNeutralized() {
        return value.signum() == 0;
    }
}
