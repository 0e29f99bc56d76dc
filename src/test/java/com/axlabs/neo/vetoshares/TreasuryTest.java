package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.events.Notification;
import com.axlabs.neo.vetoshares.storage.InMemoryGovernanceStorage;
import com.axlabs.neo.vetoshares.util.RecordingListener;
import com.axlabs.neo.vetoshares.util.TestClock;
import io.neow3j.types.Hash256;
import io.neow3j.wallet.Account;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Collections;

import static com.axlabs.neo.vetoshares.util.TestHelper.GENESIS_TIME;
import static com.axlabs.neo.vetoshares.util.TestHelper.ONE_WEEK;
import static com.axlabs.neo.vetoshares.util.TestHelper.deployWithFullMembers;
import static com.axlabs.neo.vetoshares.util.TestHelper.genesis;
import static com.axlabs.neo.vetoshares.util.TestHelper.submitProposal;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TreasuryTest {

    static Account alice; // Set to be a DAO member.
    static Account bob;
    static Account eve;

    @BeforeAll
    public static void setUpAccounts() throws Throwable {
        alice = Account.create();
        bob = Account.create();
        eve = Account.create();
    }

    @Test
    public void succeed_donating() {
        TestClock clock = new TestClock(GENESIS_TIME);
        VetoSharesGov gov = deployWithFullMembers(clock, new WalletLedger(), new GovernanceParameters(), alice);
        RecordingListener listener = new RecordingListener();
        gov.addListener(listener);
        assertThat(gov.getBalance(), is(BigInteger.ZERO));

        gov.donate(eve.getScriptHash(), BigInteger.valueOf(100));
        gov.donate(bob.getScriptHash(), BigInteger.valueOf(50));

        assertThat(gov.getBalance(), is(BigInteger.valueOf(150)));
        Notification n = listener.getLast();
        assertThat(n.getEventName(), is(VetoSharesGov.NEW_DONATION));
        assertThat(n.getState().get(0), is(bob.getScriptHash()));
        assertThat(n.getState().get(1), is(BigInteger.valueOf(50)));
        assertThat(n.getTime(), is(clock.getTime()));
    }

    @Test
    public void donating_zero_is_allowed() {
        TestClock clock = new TestClock(GENESIS_TIME);
        VetoSharesGov gov = deployWithFullMembers(clock, new WalletLedger(), new GovernanceParameters(), alice);
        gov.donate(eve.getScriptHash(), BigInteger.ZERO);
        assertThat(gov.getBalance(), is(BigInteger.ZERO));
    }

    @Test
    public void fail_donating_negative_amount() {
        TestClock clock = new TestClock(GENESIS_TIME);
        VetoSharesGov gov = deployWithFullMembers(clock, new WalletLedger(), new GovernanceParameters(), alice);
        gov.donate(eve.getScriptHash(), BigInteger.TEN);
        assertThrows(IllegalArgumentException.class, () -> gov.donate(eve.getScriptHash(), BigInteger.valueOf(-1)));
        assertThat(gov.getBalance(), is(BigInteger.TEN));
    }

    @Test
    public void continue_from_stored_state() {
        TestClock clock = new TestClock(GENESIS_TIME);
        InMemoryGovernanceStorage storage = new InMemoryGovernanceStorage();
        WalletLedger wallets = new WalletLedger();
        VetoSharesGov gov = new VetoSharesGov(genesis(alice), new GovernanceParameters(), clock, storage, wallets);
        clock.fastForward(ONE_WEEK);
        gov.donate(eve.getScriptHash(), BigInteger.valueOf(100));
        Hash256 id = submitProposal(gov, alice, bob, 30, "1");

        // A second governance on the same storage ignores its genesis members.
        VetoSharesGov restarted = new VetoSharesGov(Collections.emptyList(), new GovernanceParameters(), clock,
                storage, wallets);
        assertThat(restarted.getMembersCount(), is(1));
        assertThat(restarted.getBalance(), is(BigInteger.valueOf(100)));
        assertThat(restarted.getMember(alice.getScriptHash()).lastActionTime, is(clock.getTime()));

        clock.fastForward(ONE_WEEK);
        assertThat(restarted.claimProposal(id), is(BigInteger.valueOf(30)));
        assertThat(wallets.getReceived(bob.getScriptHash()), is(BigInteger.valueOf(30)));
    }
}
