package com.gridfacts.core.facts;

import com.gridfacts.core.command.FakeCommandRunner;
import com.gridfacts.core.host.FixedHostResolver;
import com.gridfacts.core.host.GridHomeLocator;
import com.gridfacts.core.host.GridTools;
import com.gridfacts.core.host.PreconditionFailedException;
import com.gridfacts.core.model.ClusterFacts;
import com.gridfacts.core.model.Listener;
import com.gridfacts.core.model.Network;
import com.gridfacts.core.model.ScanListener;
import com.gridfacts.core.model.Vip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link FactAssembler} against captured 19c output.
 */
class FactAssemblerTest {

    private static final String HOME = "/u01/app/19.0.0/grid";
    private static final String SRVCTL = HOME + "/bin/srvctl";
    private static final GridTools TOOLS = GridTools.forHome(Paths.get(HOME));

    @TempDir
    Path tempDir;

    private FakeCommandRunner runner;
    private FactAssembler assembler;

    @BeforeEach
    void setUp() {
        runner = new FakeCommandRunner();
        assembler = new FactAssembler(runner, new FixedHostResolver("rac1", "example.com"));
    }

    @Test
    void collect_clusterMode_resolvesAllRecordTypes() {
        givenCluster();

        ClusterFacts facts = assembler.collect(TOOLS);

        assertThat(facts.crsMode()).isTrue();
        assertThat(facts.clusterName()).isEqualTo("rac-cluster");
        assertThat(facts.crsHome()).isEqualTo(HOME);
        assertThat(facts.version()).containsExactly(
            entry("version", "Oracle Clusterware active version on the cluster is [19.0.0.0.0]"));
        assertThat(facts.networks()).extracting(Network::id).containsExactly("1", "2");
        assertThat(facts.vips()).extracting(Vip::fqdn).containsExactly("rac1-vip.example.com");
        assertThat(facts.scans()).hasSize(1);
        assertThat(facts.scans().get(0).ipv4()).containsExactly("10.0.0.21", "10.0.0.22", "10.0.0.23");
        assertThat(facts.databases()).containsExactly("orcl", "rptdb");
        assertThat(facts.warnings()).isEmpty();
    }

    @Test
    void collect_clusterMode_linksListenersToVipsByNetwork() {
        givenCluster();

        ClusterFacts facts = assembler.collect(TOOLS);

        assertThat(facts.localListeners()).extracting(Listener::name).containsExactly("LISTENER", "LISTENER_NET2");
        Listener onVipNetwork = facts.localListeners().get(0);
        assertThat(onVipNetwork.address()).isEqualTo("rac1-vip.example.com");
        assertThat(onVipNetwork.ipv4()).isEqualTo("10.0.0.11");
        assertThat(onVipNetwork.protocolPorts()).containsExactly(entry("tcp", "1521"));

        Listener withoutVip = facts.localListeners().get(1);
        assertThat(withoutVip.networkId()).isEqualTo("2");
        assertThat(withoutVip.address()).isNull();
        assertThat(withoutVip.ipv4()).isNull();
        assertThat(withoutVip.ipv6()).isNull();
    }

    @Test
    void collect_clusterMode_buildsScanListenerOnlyForNetworksWithScan() {
        givenCluster();

        ClusterFacts facts = assembler.collect(TOOLS);

        assertThat(facts.scanListeners()).hasSize(1);
        ScanListener scanListener = facts.scanListeners().get(0);
        assertThat(scanListener.networkId()).isEqualTo("1");
        assertThat(scanListener.scanAddress()).isEqualTo("rac-scan.example.com");
        assertThat(scanListener.endpoints()).isEqualTo("TCP:1521");
        assertThat(scanListener.protocolPorts()).containsExactly(entry("tcp", "1521"));
        assertThat(scanListener.ipv4()).containsExactly("10.0.0.21", "10.0.0.22", "10.0.0.23");
        assertThat(runner.getInvocations()).contains(
            SRVCTL + " config scan_listener -k 1",
            SRVCTL + " config scan_listener -k 2");
    }

    @Test
    void collect_clusterMode_queriesListenerStatusForLocalNode() {
        givenCluster();

        assembler.collect(TOOLS);

        assertThat(runner.getInvocations())
            .contains(SRVCTL + " status listener -n rac1", SRVCTL + " config vip -n rac1")
            .doesNotContain(SRVCTL + " status listener");
    }

    @Test
    void collect_restartMode_skipsScanListenersAndReadsHasVersions() {
        givenCluster();
        runner.respond(HOME + "/bin/olsnodes", "");
        runner.respond(SRVCTL + " status listener", "Listener LISTENER is enabled");
        runner.respond(HOME + "/bin/crsctl query has releaseversion",
            "Oracle High Availability Services release version on the local node is [19.0.0.0.0]");
        runner.respond(HOME + "/bin/crsctl query has softwareversion",
            "Oracle High Availability Services version on the local node is [19.0.0.0.0]");

        ClusterFacts facts = assembler.collect(TOOLS);

        assertThat(facts.crsMode()).isFalse();
        assertThat(facts.scans()).isNotEmpty();
        assertThat(facts.scanListeners()).isEmpty();
        assertThat(runner.getInvocations()).noneMatch(command -> command.contains("scan_listener"));
        assertThat(facts.localListeners()).extracting(Listener::name).containsExactly("LISTENER");
        assertThat(facts.version()).containsEntry("releaseversion", "19.0.0.0.0")
            .containsEntry("version", "19.0.0.0.0")
            .containsEntry("releasepatch", "");
    }

    @Test
    void collect_malformedVipRecord_keepsSiblingRecordTypes() {
        givenCluster();
        runner.respond(SRVCTL + " config vip -n rac1", """
            VIP exists: hosting node rac1
            VIP Name: rac1-vip
            """);

        ClusterFacts facts = assembler.collect(TOOLS);

        assertThat(facts.vips()).isEmpty();
        assertThat(facts.networks()).hasSize(2);
        assertThat(facts.scans()).hasSize(1);
        assertThat(facts.scanListeners()).hasSize(1);
        assertThat(facts.localListeners()).noneMatch(Listener::isResolved);
        assertThat(facts.warnings()).singleElement().asString()
            .startsWith("vip:")
            .contains("VIP exists: hosting node rac1");
    }

    @Test
    void collect_noToolOutput_returnsEmptyFacts() {
        ClusterFacts facts = assembler.collect(TOOLS);

        assertThat(facts.crsMode()).isFalse();
        assertThat(facts.clusterName()).isEmpty();
        assertThat(facts.networks()).isEmpty();
        assertThat(facts.vips()).isEmpty();
        assertThat(facts.localListeners()).isEmpty();
        assertThat(facts.databases()).isEmpty();
        assertThat(facts.version()).containsEntry("releaseversion", "").doesNotContainKey("version");
    }

    @Test
    void collect_olsnodesTimesOut_stopsBeforeCollectingTopology() {
        givenCluster();
        runner.timeOut(HOME + "/bin/olsnodes");

        assertThatThrownBy(() -> assembler.collect(TOOLS))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("olsnodes");
        assertThat(runner.getInvocations()).containsExactly(HOME + "/bin/olsnodes");
    }

    @Test
    void collect_unresolvableHome_failsBeforeRunningCommands() {
        GridHomeLocator locator = new GridHomeLocator(null, Map.of(), tempDir.resolve("proc"), tempDir.resolve("oratab"));

        assertThatThrownBy(() -> assembler.collect(locator))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("Grid Infrastructure home");
        assertThat(runner.getInvocations()).isEmpty();
    }

    @Test
    void collect_homeWithoutTools_failsBeforeRunningCommands() {
        GridHomeLocator locator = new GridHomeLocator(tempDir.toString(), Map.of(), null, null);

        assertThatThrownBy(() -> assembler.collect(locator))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("srvctl");
        assertThat(runner.getInvocations()).isEmpty();
    }

    @Test
    void collect_locatedHome_usesItsTools() throws IOException {
        Path bin = Files.createDirectories(tempDir.resolve("grid/bin"));
        for (String tool : List.of("srvctl", "crsctl", "cemutlo", "olsnodes")) {
            Path file = Files.writeString(bin.resolve(tool), "#!/bin/sh\n");
            assertThat(file.toFile().setExecutable(true)).isTrue();
        }
        GridHomeLocator locator = new GridHomeLocator(null, Map.of("ORACLE_HOME", tempDir.resolve("grid").toString()),
            null, null);

        ClusterFacts facts = assembler.collect(locator);

        assertThat(facts.crsHome()).isEqualTo(tempDir.resolve("grid").toString());
        assertThat(runner.getInvocations()).first().isEqualTo(bin.resolve("olsnodes").toString());
    }

    private void givenCluster() {
        runner.respond(HOME + "/bin/olsnodes", """
            rac1
            rac2
            """);
        runner.respond(HOME + "/bin/cemutlo -n", "rac-cluster");
        runner.respond(HOME + "/bin/crsctl query crs activeversion",
            "Oracle Clusterware active version on the cluster is [19.0.0.0.0]");
        runner.respond(SRVCTL + " config network", """
            Network 1 exists
            Subnet IPv4: 10.0.0.0/255.255.255.0/eth0, static
            Subnet IPv6:
            Ping Targets:
            Network is enabled
            Network 2 exists
            Subnet IPv4: 192.168.10.0/255.255.255.0/eth2, static
            Subnet IPv6:
            Network is enabled
            """);
        runner.respond(SRVCTL + " config vip -n rac1", """
            VIP exists: network number 1, hosting node rac1
            VIP Name: rac1-vip
            VIP IPv4 Address: 10.0.0.11
            VIP IPv6 Address:
            VIP is enabled.
            """);
        runner.respond(SRVCTL + " config scan -all", """
            SCAN name: rac-scan, Network: 1
            Subnet IPv4: 10.0.0.0/255.255.255.0/eth0, static
            Subnet IPv6:
            SCAN 1 IPv4 VIP: 10.0.0.21
            SCAN VIP is enabled.
            SCAN 2 IPv4 VIP: 10.0.0.22
            SCAN VIP is enabled.
            SCAN 3 IPv4 VIP: 10.0.0.23
            SCAN VIP is enabled.
            """);
        runner.respond(SRVCTL + " status listener -n rac1", """
            Listener LISTENER is enabled on node(s): rac1
            Listener LISTENER is running on node(s): rac1
            Listener LISTENER_NET2 is enabled on node(s): rac1
            Listener LISTENER_NET2 is running on node(s): rac1
            """);
        runner.respond(SRVCTL + " config listener -l LISTENER", """
            Name: LISTENER
            Type: Database Listener
            Network: 1, Owner: grid
            Home: <CRS home>
            End points: TCP:1521
            Listener is enabled.
            """);
        runner.respond(SRVCTL + " config listener -l LISTENER_NET2", """
            Name: LISTENER_NET2
            Type: Database Listener
            Network: 2, Owner: grid
            Home: <CRS home>
            End points: TCP:1525
            Listener is enabled.
            """);
        runner.respond(SRVCTL + " config scan_listener -k 1", """
            SCAN Listeners for network 1:
            Registration invited nodes:
            Registration invited subnets:
            Endpoints: TCP:1521
            SCAN Listener LISTENER_SCAN1 exists
            SCAN Listener is enabled.
            """);
        runner.respond(SRVCTL + " config scan_listener -k 2", """
            SCAN Listeners for network 2:
            Endpoints: TCP:1530
            """);
        runner.respond(SRVCTL + " config database", """
            orcl
            rptdb
            """);
    }
}
