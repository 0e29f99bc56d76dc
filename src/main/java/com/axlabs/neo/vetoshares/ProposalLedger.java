package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.events.Event2Args;
import com.axlabs.neo.vetoshares.events.Notifications;
import com.axlabs.neo.vetoshares.storage.GovernanceStorage;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.axlabs.neo.vetoshares.ErrorCode.DUPLICATE_PROPOSAL;
import static com.axlabs.neo.vetoshares.ErrorCode.INSUFFICIENT_FUNDS;
import static com.axlabs.neo.vetoshares.ErrorCode.NOT_YET_CLAIMABLE;
import static com.axlabs.neo.vetoshares.ErrorCode.PROPOSAL_NOT_FOUND;
import static com.axlabs.neo.vetoshares.ErrorCode.VETO_WINDOW_CLOSED;

/**
 * Keeps track of the spending proposals and releases their funds.
 * <p>
 * A proposal can be vetoed by any full member during its veto window. Once the window has passed, anyone can claim
 * it, which pays the requested value out to the proposal's wallet. Vetoing and claiming both set the proposal's value
 * to zero. A proposal with value zero is neutralized and nothing can be claimed from it anymore.
 */
class ProposalLedger {

    private static final Logger LOG = LoggerFactory.getLogger(ProposalLedger.class);

    private final GovernanceStorage storage;
    private final AccessGuard guard;
    private final GovernanceParameters params;
    private final VetoSharesTreasury treasury;

    private final Event2Args<Hash160, Hash256> newProposal;
    private final Event2Args<Hash160, Hash256> proposalVetoed;
    private final Event2Args<Hash256, BigInteger> proposalClaimed;
    private final Event2Args<Hash160, BigInteger> newDonation;

    ProposalLedger(GovernanceStorage storage, AccessGuard guard, GovernanceParameters params,
            VetoSharesTreasury treasury, Notifications notifications) {
        this.storage = storage;
        this.guard = guard;
        this.params = params;
        this.treasury = treasury;
        newProposal = new Event2Args<>(VetoSharesGov.NEW_PROPOSAL, notifications);
        proposalVetoed = new Event2Args<>(VetoSharesGov.PROPOSAL_VETOED, notifications);
        proposalClaimed = new Event2Args<>(VetoSharesGov.PROPOSAL_CLAIMED, notifications);
        newDonation = new Event2Args<>(VetoSharesGov.NEW_DONATION, notifications);
    }

    Hash256 submitProposal(Hash160 caller, ProposalUrl url, Hash256 digest, Hash160 wallet, BigInteger value,
            long now) {

        Member sponsor = guard.requireFullMemberWithElapsedCooldown(caller, now, VetoSharesGov.SUBMIT_PROPOSAL);
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Proposal value must not be negative");
        }
        // The full balance can never be requested.
        if (value.compareTo(treasury.getBalance()) >= 0) {
            throw new GovernanceException(INSUFFICIENT_FUNDS, VetoSharesGov.SUBMIT_PROPOSAL);
        }
        Hash256 id = ProposalHasher.hashProposal(caller, url, digest, wallet, value, now);
        if (storage.getProposal(id) != null) {
            throw new GovernanceException(DUPLICATE_PROPOSAL, VetoSharesGov.SUBMIT_PROPOSAL);
        }

        storage.putProposal(new Proposal(id, caller, url, digest, wallet, value, now));
        guard.recordAction(caller, sponsor, now);
        LOG.info("{} submitted proposal {} requesting {} for {}", caller.toAddress(), id, value, wallet.toAddress());
        newProposal.fire(caller, id);
        return id;
    }

    void vetoProposal(Hash160 caller, Hash256 id, long now) {
        guard.requireFullMember(caller, now, VetoSharesGov.VETO_PROPOSAL);
        Proposal p = storage.getProposal(id);
        if (p == null && params.isProposalVetoStrict()) {
            throw new GovernanceException(PROPOSAL_NOT_FOUND, VetoSharesGov.VETO_PROPOSAL);
        }
        // Without a stored proposal the check runs against a submission time of zero, i.e., the default record.
        long timeSubmitted = p == null ? 0 : p.timeSubmitted;
        if (now - timeSubmitted >= params.getVetoWindow()) {
            throw new GovernanceException(VETO_WINDOW_CLOSED, VetoSharesGov.VETO_PROPOSAL);
        }

        if (p != null) {
            p.value = BigInteger.ZERO;
            storage.putProposal(p);
        }
        LOG.info("{} vetoed proposal {}", caller.toAddress(), id);
        proposalVetoed.fire(caller, id);
    }

    /**
     * Claims the proposal with {@code id}, i.e., transfers the proposal's value to its wallet.
     *
     * @return the released amount. Zero if the proposal was already neutralized or doesn't exist.
     */
    BigInteger claimProposal(Hash256 id, long now) {
        Proposal p = storage.getProposal(id);
        long timeSubmitted = p == null ? 0 : p.timeSubmitted;
        if (now - timeSubmitted < params.getVetoWindow()) {
            throw new GovernanceException(NOT_YET_CLAIMABLE, VetoSharesGov.CLAIM_PROPOSAL);
        }
        if (p == null || p.isNeutralized()) {
            LOG.debug("Nothing to claim on proposal {}", id);
            return BigInteger.ZERO;
        }
        // Earlier claims may have drained the treasury since this proposal was submitted.
        if (p.value.compareTo(treasury.getBalance()) > 0) {
            throw new GovernanceException(INSUFFICIENT_FUNDS, VetoSharesGov.CLAIM_PROPOSAL);
        }

        BigInteger value = p.value;
        treasury.release(p.wallet, value);
        p.value = BigInteger.ZERO;
        storage.putProposal(p);
        LOG.info("Proposal {} claimed. Released {} to {}", id, value, p.wallet.toAddress());
        proposalClaimed.fire(id, value);
        return value;
    }

    void donate(Hash160 donor, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Donation amount must not be negative");
        }
        treasury.deposit(amount);
        LOG.info("{} donated {}", donor.toAddress(), amount);
        newDonation.fire(donor, amount);
    }

    ProposalDTO getProposal(Hash256 id) {
        Proposal p = storage.getProposal(id);
        if (p == null) {
            return null;
        }
        ProposalDTO dto = new ProposalDTO();
        dto.id = p.id;
        dto.sponsor = p.sponsor;
        dto.url = p.url;
        dto.digest = p.digest;
        dto.wallet = p.wallet;
        dto.value = p.value;
        dto.timeSubmitted = p.timeSubmitted;
        dto.vetoWindowEnd = p.timeSubmitted + params.getVetoWindow();
        dto.neutralized = p.isNeutralized();
        return dto;
    }

    int getProposalCount() {
        return storage.getProposalCount();
    }

    Paginator.Paginated<ProposalDTO> getProposals(int page, int itemsPerPage) {
        int[] pagination = Paginator.calcPagination(storage.getProposalCount(), page, itemsPerPage);
        List<ProposalDTO> list = new ArrayList<>();
        for (int i = pagination[0]; i < pagination[1]; i++) {
            list.add(getProposal(storage.getProposalId(i)));
        }
        return new Paginator.Paginated<>(page, pagination[2], list);
    }
}
