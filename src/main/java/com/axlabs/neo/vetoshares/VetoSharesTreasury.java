package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.storage.GovernanceStorage;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * The pooled funds of the governance. Donations increase the balance, released proposals decrease it.
 * <p>
 * Not thread-safe on its own. It is only used from within {@link VetoSharesGov}, which serializes access.
 */
class VetoSharesTreasury {

    private static final Logger LOG = LoggerFactory.getLogger(VetoSharesTreasury.class);

    private final GovernanceStorage storage;
    private final FundsTransfer fundsTransfer;

    VetoSharesTreasury(GovernanceStorage storage, FundsTransfer fundsTransfer) {
        this.storage = storage;
        this.fundsTransfer = fundsTransfer;
    }

    BigInteger getBalance() {
        return storage.getBalance();
    }

    void deposit(BigInteger amount) {
        storage.setBalance(storage.getBalance().add(amount));
    }

    /**
     * Transfers {@code amount} to {@code to} and deducts it from the balance. The balance is only changed after
     * the transfer went through.
     *
     * @param to     the receiver of the funds.
     * @param amount the amount to release.
     */
    void release(Hash160 to, BigInteger amount) {
        BigInteger balance = storage.getBalance();
        if (amount.compareTo(balance) > 0) {
            throw new IllegalStateException("Release of " + amount + " exceeds the treasury balance of " + balance);
        }
        fundsTransfer.transfer(to, amount);
        storage.setBalance(balance.subtract(amount));
        LOG.info("Released {} to {}. Remaining balance: {}", amount, to.toAddress(), storage.getBalance());
    }
}
