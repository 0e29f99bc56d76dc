package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.storage.GovernanceStorage;
import io.neow3j.types.Hash160;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the deployment of a {@link VetoSharesGov} from the {@link Config}.
 * <p>
 * The configuration file has to list the genesis members and their handles in the following format:
 * <pre>
 *  member1=NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PBP
 *  handle1=alice
 *  member2=NdbtgSku2qLuwsBBzLx3FLtmmMdm32Ktor
 *  handle2=charlie
 *  ...
 * </pre>
 * Governance parameters can be set with their keys, e.g., {@code veto_window=604800}. Parameters that are not set
 * keep their default values.
 */
public class DeployConfig {

    static final String MEMBER_PREFIX = "member";
    static final String HANDLE_PREFIX = "handle";

    static final String[] PARAMETER_KEYS = new String[]{
            GovernanceParameters.VETO_WINDOW_KEY,
            GovernanceParameters.COOLDOWN_KEY,
            GovernanceParameters.RELEASE_VETOED_HANDLES_KEY,
            GovernanceParameters.STRICT_PROPOSAL_VETO_KEY
    };

    public static GovernanceParameters getParameters() {
        GovernanceParameters params = new GovernanceParameters();
        for (String key : PARAMETER_KEYS) {
            if (Config.getProperty(key) != null) {
                params.set(key, Config.getLongProperty(key));
            }
        }
        return params;
    }

    public static List<GenesisMember> getGenesisMembers() {
        List<GenesisMember> members = new ArrayList<>();
        int i = 1;
        String address = Config.getProperty(MEMBER_PREFIX + i);
        while (address != null) {
            String handle = Config.getProperty(HANDLE_PREFIX + i);
            if (handle == null) {
                throw new IllegalStateException("Missing handle for member " + i);
            }
            members.add(new GenesisMember(Hash160.fromAddress(address.trim()), Handle.fromString(handle.trim())));
            address = Config.getProperty(MEMBER_PREFIX + ++i);
        }
        return members;
    }

    /**
     * Deploys a governance with the configured genesis members and parameters.
     *
     * @param clock         the clock.
     * @param storage       the storage.
     * @param fundsTransfer pays out released funds.
     * @return the governance.
     */
    public static VetoSharesGov deploy(Clock clock, GovernanceStorage storage, FundsTransfer fundsTransfer) {
        return new VetoSharesGov(getGenesisMembers(), getParameters(), clock, storage, fundsTransfer);
    }
}
