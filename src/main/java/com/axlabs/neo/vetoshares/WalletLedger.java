package com.axlabs.neo.vetoshares;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records the funds paid out by the treasury per wallet, without moving any assets. Used when the treasury isn't
 * connected to an external payment system.
 */
public class WalletLedger implements FundsTransfer {

    private final Map<Hash160, BigInteger> received = new ConcurrentHashMap<>();

    @Override
    public void transfer(Hash160 to, BigInteger amount) {
        received.merge(to, amount, BigInteger::add);
    }

    /**
     * @param wallet the wallet.
     * @return the total amount paid out to the wallet.
     */
    public BigInteger getReceived(Hash160 wallet) {
        return received.getOrDefault(wallet, BigInteger.ZERO);
    }
}
