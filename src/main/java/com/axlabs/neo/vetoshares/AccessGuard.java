package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.storage.GovernanceStorage;
import io.neow3j.types.Hash160;

import static com.axlabs.neo.vetoshares.ErrorCode.NOT_A_MEMBER;
import static com.axlabs.neo.vetoshares.ErrorCode.NOT_YET_FULL;
import static com.axlabs.neo.vetoshares.ErrorCode.RATE_LIMITED;

/**
 * The checks every member action has to pass before it is executed.
 * <p>
 * Sponsoring a member and submitting a proposal require a full member whose cooldown has elapsed. Both actions
 * share the same cooldown, i.e., a member can do one of them per cooldown period. Vetoes only require a full member.
 * <p>
 * The last action time is only recorded via {@link #recordAction(Hash160, Member, long)} once the guarded action has
 * passed all of its own checks.
 */
class AccessGuard {

    private final GovernanceStorage storage;
    private final GovernanceParameters params;

    AccessGuard(GovernanceStorage storage, GovernanceParameters params) {
        this.storage = storage;
        this.params = params;
    }

    /**
     * Checks that {@code caller} is a member whose provisional period is over.
     *
     * @param caller the calling account.
     * @param now    the current time.
     * @param method the guarded operation.
     * @return the caller's member record.
     */
    Member requireFullMember(Hash160 caller, long now, String method) {
        Member m = storage.getMember(caller);
        if (!isMember(m)) {
            throw new GovernanceException(NOT_A_MEMBER, method);
        }
        if (!isFull(m, now)) {
            throw new GovernanceException(NOT_YET_FULL, method);
        }
        return m;
    }

    void requireCooldownElapsed(Member caller, long now, String method) {
        if (now - caller.lastActionTime < params.getCooldown()) {
            throw new GovernanceException(RATE_LIMITED, method);
        }
    }

    /**
     * Checks that {@code caller} is a full member that did not act within the cooldown period.
     *
     * @return the caller's member record.
     */
    Member requireFullMemberWithElapsedCooldown(Hash160 caller, long now, String method) {
        Member m = requireFullMember(caller, now, method);
        requireCooldownElapsed(m, now, method);
        return m;
    }

    /**
     * Sets the caller's last action time to {@code now}.
     *
     * @param caller       the calling account.
     * @param callerRecord the caller's member record as returned by the guard.
     * @param now          the current time.
     */
    void recordAction(Hash160 caller, Member callerRecord, long now) {
        callerRecord.lastActionTime = now;
        storage.putMember(caller, callerRecord);
    }

    static boolean isMember(Member m) {
        return m != null && m.sponsor != null && !Hash160.ZERO.equals(m.sponsor);
    }

    boolean isFull(Member m, long now) {
        return now - m.timeJoined >= params.getVetoWindow();
    }
}
