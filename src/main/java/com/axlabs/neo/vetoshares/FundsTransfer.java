package com.axlabs.neo.vetoshares;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Pays out released treasury funds to their destination.
 */
@FunctionalInterface
public interface FundsTransfer {

    /**
     * Transfers {@code amount} to {@code to}. If this method throws, the release is aborted and the treasury
     * balance stays untouched.
     *
     * @param to     the receiving wallet.
     * @param amount the amount, always positive.
     */
    void transfer(Hash160 to, BigInteger amount);

}
