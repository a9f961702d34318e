package com.gridfacts.core.detect;

import com.gridfacts.core.command.FakeCommandRunner;
import com.gridfacts.core.host.GridTools;
import com.gridfacts.core.host.PreconditionFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link ClusterModeDetector}.
 */
class ClusterModeDetectorTest {

    private static final GridTools TOOLS = GridTools.forHome(Paths.get("/u01/app/grid"));
    private static final String CRSCTL = "/u01/app/grid/bin/crsctl";

    private FakeCommandRunner runner;
    private ClusterModeDetector detector;

    @BeforeEach
    void setUp() {
        runner = new FakeCommandRunner();
        detector = new ClusterModeDetector(runner);
    }

    @Test
    void isCrsMode_nodesListed_returnsTrue() {
        runner.respond("/u01/app/grid/bin/olsnodes", """
            rac1
            rac2
            """);

        assertThat(detector.isCrsMode(TOOLS)).isTrue();
    }

    @Test
    void isCrsMode_emptyOutput_returnsFalse() {
        runner.respond("/u01/app/grid/bin/olsnodes", "");

        assertThat(detector.isCrsMode(TOOLS)).isFalse();
    }

    @Test
    void isCrsMode_toolFails_returnsFalse() {
        runner.fail("/u01/app/grid/bin/olsnodes", 1);

        assertThat(detector.isCrsMode(TOOLS)).isFalse();
    }

    @Test
    void isCrsMode_olsnodesTimesOut_failsInsteadOfAssumingRestart() {
        runner.timeOut("/u01/app/grid/bin/olsnodes");

        assertThatThrownBy(() -> detector.isCrsMode(TOOLS))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("/u01/app/grid/bin/olsnodes")
            .hasMessageContaining("timed out");
    }

    @Test
    void isCrsMode_olsnodesNotStarted_fails() {
        runner.notStarted("/u01/app/grid/bin/olsnodes");

        assertThatThrownBy(() -> detector.isCrsMode(TOOLS))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("could not be started");
    }

    @Test
    void detectVersion_crsMode_storesRawActiveVersion() {
        runner.respond(CRSCTL + " query crs activeversion",
            "Oracle Clusterware active version on the cluster is [19.0.0.0.0]");

        Map<String, String> version = detector.detectVersion(TOOLS, true);

        assertThat(version).containsExactly(
            entry("version", "Oracle Clusterware active version on the cluster is [19.0.0.0.0]"));
        assertThat(runner.getInvocations()).containsExactly(CRSCTL + " query crs activeversion");
    }

    @Test
    void detectVersion_restartMode_extractsBracketedVersions() {
        runner.respond(CRSCTL + " query has releaseversion",
            "Oracle High Availability Services release version on the local node is [19.0.0.0.0]");
        runner.respond(CRSCTL + " query has releasepatch",
            "Oracle Clusterware release patch level is [2701864972] and the complete list of patches "
                + "[29517242 ] have been applied on the local node. The release patch string is [19.3.0.0.0].");
        runner.respond(CRSCTL + " query has softwareversion",
            "Oracle High Availability Services version on the local node is [19.0.0.0.0]");
        runner.respond(CRSCTL + " query has softwarepatch",
            "Oracle Clusterware patch level on node db1 is [2701864972].");

        Map<String, String> version = detector.detectVersion(TOOLS, false);

        assertThat(version).containsEntry("releaseversion", "19.0.0.0.0");
        assertThat(version.get("releasepatch")).startsWith("Oracle Clusterware release patch level is");
        assertThat(version).containsEntry("softwareversion", "19.0.0.0.0");
        assertThat(version).containsEntry("softwarepatch", "Oracle Clusterware patch level on node db1 is [2701864972].");
        assertThat(version).containsEntry("version", "19.0.0.0.0");
    }

    @Test
    void detectVersion_restartMode_aliasComesFromFirstMatch() {
        runner.respond(CRSCTL + " query has releaseversion", "CRS-4639: Could not contact Oracle High Availability Services");
        runner.respond(CRSCTL + " query has releasepatch", "patch string is [19.3.0.0.0]");
        runner.respond(CRSCTL + " query has softwareversion", "version on the local node is [19.21.0.0.0]");

        Map<String, String> version = detector.detectVersion(TOOLS, false);

        assertThat(version).containsEntry("releaseversion", "CRS-4639: Could not contact Oracle High Availability Services");
        assertThat(version).containsEntry("version", "19.3.0.0.0");
        assertThat(version).containsEntry("softwarepatch", "");
    }
}
