package com.axlabs.neo.vetoshares.storage;

import com.axlabs.neo.vetoshares.Handle;
import com.axlabs.neo.vetoshares.Member;
import com.axlabs.neo.vetoshares.Proposal;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the governance state in memory. The state is lost when the process ends.
 */
public class InMemoryGovernanceStorage implements GovernanceStorage {

    private final Map<Hash160, Member> members = new HashMap<>();
    private final Set<Handle> takenHandles = new HashSet<>();
    private final Map<Hash256, Proposal> proposals = new HashMap<>();
    private final List<Hash256> proposalOrder = new ArrayList<>();
    private BigInteger balance = BigInteger.ZERO;

    @Override
    public Member getMember(Hash160 account) {
        Member m = members.get(account);
        return m == null ? null : new Member(m);
    }

    @Override
    public void putMember(Hash160 account, Member member) {
        members.put(account, new Member(member));
    }

    @Override
    public void deleteMember(Hash160 account) {
        members.remove(account);
    }

    @Override
    public List<Hash160> getMemberAccounts() {
        return new ArrayList<>(members.keySet());
    }

    @Override
    public int getMembersCount() {
        return members.size();
    }

    @Override
    public boolean isHandleTaken(Handle handle) {
        return takenHandles.contains(handle);
    }

    @Override
    public void markHandleTaken(Handle handle) {
        takenHandles.add(handle);
    }

    @Override
    public void releaseHandle(Handle handle) {
        takenHandles.remove(handle);
    }

    @Override
    public Proposal getProposal(Hash256 id) {
        Proposal p = proposals.get(id);
        return p == null ? null : new Proposal(p);
    }

    @Override
    public void putProposal(Proposal proposal) {
        if (proposals.put(proposal.id, new Proposal(proposal)) == null) {
            proposalOrder.add(proposal.id);
        }
    }

    @Override
    public int getProposalCount() {
        return proposalOrder.size();
    }

    @Override
    public Hash256 getProposalId(int index) {
        return proposalOrder.get(index);
    }

    @Override
    public BigInteger getBalance() {
        return balance;
    }

    @Override
    public void setBalance(BigInteger balance) {
        this.balance = balance;
    }
}
