package com.axlabs.neo.vetoshares;

import com.axlabs.neo.vetoshares.storage.InMemoryGovernanceStorage;
import com.axlabs.neo.vetoshares.util.TestClock;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.axlabs.neo.vetoshares.util.TestHelper.GENESIS_TIME;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DeployConfigTest {

    static final String ALICE = "NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PBP";
    static final String CHARLIE = "NdbtgSku2qLuwsBBzLx3FLtmmMdm32Ktor";
    static final String DENISE = "NerDv9t8exrQRrP11jjvZKXzSXvTnmfDTo";

    @AfterEach
    public void resetProfile() {
        Config.setProfile(null);
    }

    @Test
    public void read_genesis_members() {
        List<GenesisMember> members = DeployConfig.getGenesisMembers();
        assertThat(members.size(), is(3));
        assertThat(members.get(0).account, is(Hash160.fromAddress(ALICE)));
        assertThat(members.get(0).handle.getName(), is("alice"));
        assertThat(members.get(1).account, is(Hash160.fromAddress(CHARLIE)));
        assertThat(members.get(2).account, is(Hash160.fromAddress(DENISE)));
        assertThat(members.get(2).handle.getName(), is("denise"));
    }

    @Test
    public void read_parameters_of_profile() {
        Config.setProfile("corrected");
        assertThat(Config.getProfile(), is("corrected"));

        GovernanceParameters params = DeployConfig.getParameters();
        assertThat(params.getVetoWindow(), is(3600L));
        assertThat(params.getCooldown(), is(60L));
        assertTrue(params.releasesVetoedHandles());
        assertTrue(params.isProposalVetoStrict());
        assertThat(DeployConfig.getGenesisMembers().size(), is(1));
    }

    @Test
    public void deploy_from_config() {
        TestClock clock = new TestClock(GENESIS_TIME);
        VetoSharesGov gov = DeployConfig.deploy(clock, new InMemoryGovernanceStorage(), new WalletLedger());

        assertThat(gov.getMembersCount(), is(3));
        assertTrue(gov.isHandleTaken(Handle.fromString("charlie")));
        assertThat(gov.getParameter(GovernanceParameters.VETO_WINDOW_KEY), is(GovernanceParameters.ONE_WEEK));
    }

    @Test
    public void fail_reading_missing_profile() {
        Config.setProfile("missing");
        IllegalStateException e = assertThrows(IllegalStateException.class, DeployConfig::getGenesisMembers);
        assertThat(e.getMessage(), containsString("missing.vetoshares.properties"));
    }
}
