package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.events.NotificationListener;
import com.axlabs.neo.vetoshares.events.Notifications;
import com.axlabs.neo.vetoshares.storage.GovernanceStorage;
import com.axlabs.neo.vetoshares.storage.InMemoryGovernanceStorage;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * The governance of a VetoShares treasury.
 * <p>
 * Members admit new members by sponsoring them and submit proposals that request funds from the treasury. New
 * members and new proposals can be vetoed by any full member during their veto window. A proposal that survived its
 * veto window can be claimed by anyone, which pays its value out to the proposal's wallet.
 * <p>
 * All operations are linearizable. Mutating operations are executed one at a time and either complete or fail
 * without changing any state. The current time is read once per operation from the clock given on construction.
 */
public class VetoSharesGov {

    private static final Logger LOG = LoggerFactory.getLogger(VetoSharesGov.class);

    // Operations
    static final String SPONSOR_MEMBER = "sponsorMember";
    static final String VETO_MEMBER = "vetoMember";
    static final String SUBMIT_PROPOSAL = "submitProposal";
    static final String VETO_PROPOSAL = "vetoProposal";
    static final String CLAIM_PROPOSAL = "claimProposal";
    static final String DONATE = "donate";

    //region EVENTS
    public static final String NEW_MEMBER = "NewMember";
    public static final String MEMBER_VETOED = "MemberVetoed";
    public static final String NEW_PROPOSAL = "NewProposal";
    public static final String PROPOSAL_VETOED = "ProposalVetoed";
    public static final String PROPOSAL_CLAIMED = "ProposalClaimed";
    public static final String NEW_DONATION = "NewDonation";
    //endregion EVENTS

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final GovernanceParameters params;
    private final Notifications notifications;
    private final MembershipRegistry registry;
    private final ProposalLedger ledger;
    private final VetoSharesTreasury treasury;
    // Time of the operation holding the write lock, stamped on its notifications.
    private long operationTime;

    /**
     * Deploys a governance that keeps its state in memory and records released funds in the given ledger.
     *
     * @param genesisMembers the initial members.
     * @param params         the governance parameters.
     * @param clock          the clock.
     * @param walletLedger   receives the released funds.
     */
    public VetoSharesGov(List<GenesisMember> genesisMembers, GovernanceParameters params, Clock clock,
            WalletLedger walletLedger) {
        this(genesisMembers, params, clock, new InMemoryGovernanceStorage(), walletLedger);
    }

    /**
     * Deploys a governance on the given storage.
     * <p>
     * If the storage is empty, the genesis members are admitted. Each of them is its own sponsor and becomes a full
     * member once the veto window after deployment has passed. If the storage already holds members, the governance
     * continues from the stored state and the genesis members are ignored.
     *
     * @param genesisMembers the initial members.
     * @param params         the governance parameters.
     * @param clock          the clock. Time is counted in whole seconds.
     * @param storage        the storage.
     * @param fundsTransfer  pays out released funds.
     */
    public VetoSharesGov(List<GenesisMember> genesisMembers, GovernanceParameters params, Clock clock,
            GovernanceStorage storage, FundsTransfer fundsTransfer) {
        this.clock = requireNonNull(clock, "clock");
        this.params = requireNonNull(params, "params");
        requireNonNull(storage, "storage");
        notifications = new Notifications(() -> operationTime);
        AccessGuard guard = new AccessGuard(storage, params);
        treasury = new VetoSharesTreasury(storage, requireNonNull(fundsTransfer, "fundsTransfer"));
        registry = new MembershipRegistry(storage, guard, params, notifications);
        ledger = new ProposalLedger(storage, guard, params, treasury, notifications);

        if (storage.getMembersCount() == 0) {
            deploy(genesisMembers);
        } else {
            LOG.info("Continuing from stored state with {} members and {} proposals", storage.getMembersCount(),
                    storage.getProposalCount());
        }
    }

    private void deploy(List<GenesisMember> genesisMembers) {
        if (genesisMembers == null || genesisMembers.isEmpty()) {
            throw new IllegalArgumentException("At least one genesis member is required");
        }
        registry.admitGenesisMembers(genesisMembers, now());
        LOG.info("Deployed with {} genesis members and parameters {}", genesisMembers.size(), params);
    }

    /**
     * Registers a listener for the events fired by this governance. Listeners are called synchronously while the
     * firing operation still holds the governance's lock. They may query the governance but must not call its
     * mutating operations; such calls fail with an {@link IllegalStateException}.
     *
     * @param listener the listener.
     */
    public void addListener(NotificationListener listener) {
        notifications.addListener(listener);
    }

    public void removeListener(NotificationListener listener) {
        notifications.removeListener(listener);
    }

    //region SAFE METHODS

    /**
     * Gets the value of the parameter with {@code paramName}.
     *
     * @param paramName The name of the parameter.
     * @return the parameter's value or null if there is no such parameter.
     */
    public Long getParameter(String paramName) {
        return params.get(paramName);
    }

    /**
     * @return all parameters and their values.
     */
    public Map<String, Long> getParameters() {
        return params.asMap();
    }

    /**
     * Gets all information on the member {@code account}.
     *
     * @param account the account.
     * @return the member or null if the account is not a member.
     */
    public MemberDTO getMember(Hash160 account) {
        requireNonNull(account, "account");
        return read(() -> registry.getMember(account, now()));
    }

    public boolean isMember(Hash160 account) {
        requireNonNull(account, "account");
        return read(() -> registry.isMember(account));
    }

    public boolean isHandleTaken(Handle handle) {
        requireNonNull(handle, "handle");
        return read(() -> registry.isHandleTaken(handle));
    }

    /**
     * Returns all members.
     * <p>
     * The ordering of the returned list can change for consecutive calls.
     *
     * @return the members.
     */
    public List<MemberDTO> getMembers() {
        return read(() -> registry.getMembers(now()));
    }

    public int getMembersCount() {
        return read(registry::getMembersCount);
    }

    /**
     * Gets all information on the proposal with {@code id}.
     *
     * @param id The proposal's id.
     * @return the proposal or null if no proposal with that id was submitted.
     */
    public ProposalDTO getProposal(Hash256 id) {
        requireNonNull(id, "id");
        return read(() -> ledger.getProposal(id));
    }

    /**
     * Gets the number of proposals submitted so far, including the neutralized ones.
     *
     * @return the number of proposals.
     */
    public int getProposalCount() {
        return read(ledger::getProposalCount);
    }

    /**
     * Gets the proposals on the given page. Proposals are ordered by submission.
     *
     * @param page         The page.
     * @param itemsPerPage The number of proposals per page.
     * @return the chosen page, how many pages there are with the given page size and the found proposals on the
     * given page.
     */
    public Paginator.Paginated<ProposalDTO> getProposals(int page, int itemsPerPage) {
        return read(() -> ledger.getProposals(page, itemsPerPage));
    }

    /**
     * @return the treasury balance.
     */
    public BigInteger getBalance() {
        return read(treasury::getBalance);
    }

    /**
     * Calculates the id a proposal with the given content gets when submitted at {@code timeSubmitted}.
     *
     * @see ProposalHasher
     */
    public Hash256 hashProposal(Hash160 sponsor, ProposalUrl url, Hash256 digest, Hash160 wallet, BigInteger value,
            long timeSubmitted) {
        return ProposalHasher.hashProposal(sponsor, url, digest, wallet, value, timeSubmitted);
    }

    //endregion SAFE METHODS

    //region MEMBER METHODS

    /**
     * Admits {@code newMember} with the given handle, sponsored by {@code caller}.
     * <p>
     * The caller has to be a full member and must not have sponsored a member or submitted a proposal within the
     * cooldown period.
     *
     * @param caller    the sponsoring member.
     * @param newMember the account to admit.
     * @param handle    the new member's handle. Must not be taken.
     */
    public void sponsorMember(Hash160 caller, Hash160 newMember, Handle handle) {
        requireNonNull(caller, "caller");
        requireNonNull(newMember, "newMember");
        requireNonNull(handle, "handle");
        write(SPONSOR_MEMBER, now -> {
            registry.sponsorMember(caller, newMember, handle, now);
            return null;
        });
    }

    /**
     * Removes {@code target} from the members. Only possible during the target's veto window.
     *
     * @param caller a full member.
     * @param target the member to remove.
     */
    public void vetoMember(Hash160 caller, Hash160 target) {
        requireNonNull(caller, "caller");
        requireNonNull(target, "target");
        write(VETO_MEMBER, now -> {
            registry.vetoMember(caller, target, now);
            return null;
        });
    }

    //endregion MEMBER METHODS

    //region PROPOSAL METHODS

    /**
     * Submits a proposal to pay {@code value} out of the treasury to {@code wallet}.
     * <p>
     * The caller has to be a full member and must not have sponsored a member or submitted a proposal within the
     * cooldown period. The value has to be lower than the current treasury balance.
     *
     * @param caller the submitting member.
     * @param url    the link to the proposal document.
     * @param digest the SHA-256 hash of the proposal document.
     * @param wallet the receiver of the funds.
     * @param value  the requested amount.
     * @return the id of the proposal.
     */
    public Hash256 submitProposal(Hash160 caller, ProposalUrl url, Hash256 digest, Hash160 wallet,
            BigInteger value) {
        requireNonNull(caller, "caller");
        requireNonNull(url, "url");
        requireNonNull(digest, "digest");
        requireNonNull(wallet, "wallet");
        requireNonNull(value, "value");
        return write(SUBMIT_PROPOSAL, now -> ledger.submitProposal(caller, url, digest, wallet, value, now));
    }

    /**
     * Neutralizes the proposal with {@code id}. Only possible during the proposal's veto window. Any full member can
     * veto any proposal.
     *
     * @param caller a full member.
     * @param id     the proposal id.
     */
    public void vetoProposal(Hash160 caller, Hash256 id) {
        requireNonNull(caller, "caller");
        requireNonNull(id, "id");
        write(VETO_PROPOSAL, now -> {
            ledger.vetoProposal(caller, id, now);
            return null;
        });
    }

    /**
     * Pays out the value of the proposal with {@code id} to its wallet. Anyone can claim any proposal once its veto
     * window has passed. Claiming a vetoed or already claimed proposal does nothing.
     *
     * @param id the proposal id.
     * @return the released amount. Zero if nothing was released.
     */
    public BigInteger claimProposal(Hash256 id) {
        requireNonNull(id, "id");
        return write(CLAIM_PROPOSAL, now -> ledger.claimProposal(id, now));
    }

    /**
     * Adds {@code amount} to the treasury. Anyone can donate.
     *
     * @param donor  the donating account.
     * @param amount the donated amount.
     */
    public void donate(Hash160 donor, BigInteger amount) {
        requireNonNull(donor, "donor");
        requireNonNull(amount, "amount");
        write(DONATE, now -> {
            ledger.donate(donor, amount);
            return null;
        });
    }

    //endregion PROPOSAL METHODS

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(String method, Operation<T> operation) {
        if (lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Can't call " + method + " while another operation is executed, e.g., "
                    + "from a notification listener");
        }
        lock.writeLock().lock();
        try {
            long now = now();
            operationTime = now;
            return operation.execute(now);
        } catch (GovernanceException e) {
            LOG.debug("Rejected {}: {}", method, e.getMessage());
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @FunctionalInterface
    private interface Operation<T> {
        T execute(long now);
    }
}
