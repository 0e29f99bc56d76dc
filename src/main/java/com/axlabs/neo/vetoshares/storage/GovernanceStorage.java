package com.axlabs.neo.vetoshares.storage;

import com.axlabs.neo.vetoshares.Handle;
import com.axlabs.neo.vetoshares.Member;
import com.axlabs.neo.vetoshares.Proposal;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;
import java.util.List;

/**
 * The state of the governance: the member table, the set of taken handles, the proposal table and the treasury
 * balance.
 * <p>
 * Records are passed by value. A record obtained from the storage is a copy and changes to it only take effect
 * once it is put back. Implementations don't need to be thread-safe; {@link com.axlabs.neo.vetoshares.VetoSharesGov}
 * serializes all access.
 */
public interface GovernanceStorage {

    /**
     * @param account the member's account.
     * @return the member record or null if the account is not a member.
     */
    Member getMember(Hash160 account);

    void putMember(Hash160 account, Member member);

    void deleteMember(Hash160 account);

    /**
     * @return the accounts of all members. The ordering can change for consecutive calls.
     */
    List<Hash160> getMemberAccounts();

    int getMembersCount();

    boolean isHandleTaken(Handle handle);

    void markHandleTaken(Handle handle);

    void releaseHandle(Handle handle);

    /**
     * @param id the proposal id.
     * @return the proposal record or null if no proposal with the given id was submitted.
     */
    Proposal getProposal(Hash256 id);

    /**
     * Stores the given proposal under its id. Proposals stored for the first time are appended to the submission
     * order.
     *
     * @param proposal the proposal.
     */
    void putProposal(Proposal proposal);

    int getProposalCount();

    /**
     * @param index the position of the proposal in the submission order.
     * @return the id of the proposal at the given position.
     */
    Hash256 getProposalId(int index);

    BigInteger getBalance();

    void setBalance(BigInteger balance);

}
