package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.events.Event2Args;
import com.axlabs.neo.vetoshares.events.Notifications;
import com.axlabs.neo.vetoshares.storage.GovernanceStorage;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.axlabs.neo.vetoshares.ErrorCode.ALREADY_MEMBER;
import static com.axlabs.neo.vetoshares.ErrorCode.HANDLE_TAKEN;
import static com.axlabs.neo.vetoshares.ErrorCode.NOT_A_MEMBER;
import static com.axlabs.neo.vetoshares.ErrorCode.VETO_WINDOW_CLOSED;
import static java.util.Objects.requireNonNull;

/**
 * Keeps track of the members, their sponsors and their handles.
 * <p>
 * New members are admitted by a full member's sponsorship. During their veto window any full member can veto them,
 * which removes them again. After the veto window they are full members for good.
 */
class MembershipRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(MembershipRegistry.class);

    private final GovernanceStorage storage;
    private final AccessGuard guard;
    private final GovernanceParameters params;

    private final Event2Args<Hash160, Hash160> newMember;
    private final Event2Args<Hash160, Hash160> memberVetoed;

    MembershipRegistry(GovernanceStorage storage, AccessGuard guard, GovernanceParameters params,
            Notifications notifications) {
        this.storage = storage;
        this.guard = guard;
        this.params = params;
        newMember = new Event2Args<>(VetoSharesGov.NEW_MEMBER, notifications);
        memberVetoed = new Event2Args<>(VetoSharesGov.MEMBER_VETOED, notifications);
    }

    /**
     * Admits the initial members. Genesis members are their own sponsors.
     * <p>
     * The whole list is validated before the first member is stored, so an invalid list leaves the storage
     * untouched.
     */
    void admitGenesisMembers(List<GenesisMember> genesisMembers, long now) {
        Set<Hash160> accounts = new HashSet<>();
        Set<Handle> handles = new HashSet<>();
        for (GenesisMember m : genesisMembers) {
            requireNonNull(m, "genesis member");
            requireNonNull(m.account, "account");
            requireNonNull(m.handle, "handle");
            if (Hash160.ZERO.equals(m.account)) {
                throw new IllegalArgumentException("The zero account can't be a member");
            }
            if (!accounts.add(m.account) || AccessGuard.isMember(storage.getMember(m.account))) {
                throw new IllegalArgumentException("Genesis member " + m.account.toAddress() + " is listed twice");
            }
            if (!handles.add(m.handle) || storage.isHandleTaken(m.handle)) {
                throw new IllegalArgumentException("Genesis handle '" + m.handle.getName() + "' is listed twice");
            }
        }
        for (GenesisMember m : genesisMembers) {
            storage.putMember(m.account, new Member(m.account, m.handle, now));
            storage.markHandleTaken(m.handle);
            LOG.info("Admitted genesis member {} with handle '{}'", m.account.toAddress(), m.handle.getName());
        }
    }

    void sponsorMember(Hash160 caller, Hash160 member, Handle handle, long now) {
        Member sponsor = guard.requireFullMemberWithElapsedCooldown(caller, now, VetoSharesGov.SPONSOR_MEMBER);
        if (Hash160.ZERO.equals(member)) {
            throw new IllegalArgumentException("The zero account can't be a member");
        }
        if (AccessGuard.isMember(storage.getMember(member))) {
            throw new GovernanceException(ALREADY_MEMBER, VetoSharesGov.SPONSOR_MEMBER);
        }
        if (storage.isHandleTaken(handle)) {
            throw new GovernanceException(HANDLE_TAKEN, VetoSharesGov.SPONSOR_MEMBER);
        }

        storage.putMember(member, new Member(caller, handle, now));
        storage.markHandleTaken(handle);
        guard.recordAction(caller, sponsor, now);
        LOG.info("{} sponsored new member {} with handle '{}'", caller.toAddress(), member.toAddress(),
                handle.getName());
        newMember.fire(caller, member);
    }

    void vetoMember(Hash160 caller, Hash160 target, long now) {
        guard.requireFullMember(caller, now, VetoSharesGov.VETO_MEMBER);
        Member m = storage.getMember(target);
        if (!AccessGuard.isMember(m)) {
            throw new GovernanceException(NOT_A_MEMBER, VetoSharesGov.VETO_MEMBER);
        }
        if (now - m.timeJoined >= params.getVetoWindow()) {
            throw new GovernanceException(VETO_WINDOW_CLOSED, VetoSharesGov.VETO_MEMBER);
        }

        storage.deleteMember(target);
        if (params.releasesVetoedHandles()) {
            storage.releaseHandle(m.handle);
        }
        LOG.info("{} vetoed member {}", caller.toAddress(), target.toAddress());
        memberVetoed.fire(caller, target);
    }

    MemberDTO getMember(Hash160 account, long now) {
        Member m = storage.getMember(account);
        if (!AccessGuard.isMember(m)) {
            return null;
        }
        MemberDTO dto = new MemberDTO();
        dto.account = account;
        dto.sponsor = m.sponsor;
        dto.handle = m.handle;
        dto.timeJoined = m.timeJoined;
        dto.lastActionTime = m.lastActionTime;
        dto.full = guard.isFull(m, now);
        return dto;
    }

    boolean isMember(Hash160 account) {
        return AccessGuard.isMember(storage.getMember(account));
    }

    boolean isHandleTaken(Handle handle) {
        return storage.isHandleTaken(handle);
    }

    List<MemberDTO> getMembers(long now) {
        return storage.getMemberAccounts().stream()
                .map(a -> getMember(a, now))
                .collect(Collectors.toList());
    }

    int getMembersCount() {
        return storage.getMembersCount();
    }
}
