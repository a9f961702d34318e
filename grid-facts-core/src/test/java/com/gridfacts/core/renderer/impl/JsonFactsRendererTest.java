package com.gridfacts.core.renderer.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridfacts.core.model.ClusterFacts;
import com.gridfacts.core.model.Listener;
import com.gridfacts.core.model.Network;
import com.gridfacts.core.model.Scan;
import com.gridfacts.core.model.ScanListener;
import com.gridfacts.core.model.Vip;
import com.gridfacts.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonFactsRenderer}.
 */
class JsonFactsRendererTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private final JsonFactsRenderer renderer = new JsonFactsRenderer();

    @Test
    void format_wrapsFactsUnderRootKey() throws IOException {
        JsonNode root = MAPPER.readTree(renderer.format(sampleFacts(List.of()), RenderContext.stdout()));

        assertThat(root.fieldNames()).toIterable().containsExactly("oracle_gi_facts");
        JsonNode facts = root.get("oracle_gi_facts");
        assertThat(facts.fieldNames()).toIterable().containsExactly(
            "clustername", "version", "vip", "network", "scan", "local_listener", "scan_listener",
            "database_list", "oracle_crs_home", "crs_mode");
        assertThat(facts.get("clustername").asText()).isEqualTo("rac-cluster");
        assertThat(facts.get("version").asText()).isEqualTo("Oracle Clusterware active version on the cluster is [19.0.0.0.0]");
        assertThat(facts.get("oracle_crs_home").asText()).isEqualTo("/u01/app/19.0.0/grid");
        assertThat(facts.get("crs_mode").asBoolean()).isTrue();
    }

    @Test
    void toJson_flattensListenerPortsAndOmitsNulls() {
        JsonNode facts = renderer.toJson(sampleFacts(List.of()));

        JsonNode resolved = facts.get("local_listener").get(0);
        assertThat(resolved.get("name").asText()).isEqualTo("LISTENER");
        assertThat(resolved.get("tcp").asText()).isEqualTo("1521");
        assertThat(resolved.get("tcps").asText()).isEqualTo("2484");
        assertThat(resolved.get("address").asText()).isEqualTo("rac1-vip.example.com");
        assertThat(resolved.has("ipv6")).isFalse();

        JsonNode unresolved = facts.get("local_listener").get(1);
        assertThat(unresolved.has("address")).isFalse();
        assertThat(unresolved.has("ipv4")).isFalse();
    }

    @Test
    void toJson_scanAddressesAreArrays() {
        JsonNode facts = renderer.toJson(sampleFacts(List.of()));

        JsonNode scan = facts.get("scan").get(0);
        assertThat(scan.get("ipv4").isArray()).isTrue();
        assertThat(scan.get("ipv4")).hasSize(3);

        JsonNode scanListener = facts.get("scan_listener").get(0);
        assertThat(scanListener.get("scan_address").asText()).isEqualTo("rac-scan.example.com");
        assertThat(scanListener.get("ipv4").get(0).asText()).isEqualTo("10.0.0.21");
        assertThat(scanListener.get("tcp").asText()).isEqualTo("1521");
        assertThat(facts.get("database_list").get(1).asText()).isEqualTo("rptdb");
    }

    @Test
    void toJson_warningsPresentOnlyWhenReported() {
        assertThat(renderer.toJson(sampleFacts(List.of())).has("warnings")).isFalse();

        JsonNode facts = renderer.toJson(sampleFacts(List.of("vip: VIP record without network number")));
        assertThat(facts.get("warnings").get(0).asText()).startsWith("vip:");
    }

    @Test
    void format_compactSetting_producesSingleLine() {
        String json = renderer.format(sampleFacts(List.of()), new RenderContext(null, Map.of("json.pretty", "false")));

        assertThat(json).doesNotContain("\n");
    }

    @Test
    void render_outputFile_writesJson() throws IOException {
        Path output = tempDir.resolve("out/gi_facts.json");

        renderer.render(sampleFacts(List.of()), new RenderContext(output, Map.of()));

        assertThat(output).exists();
        assertThat(MAPPER.readTree(output.toFile()).has("oracle_gi_facts")).isTrue();
        assertThat(Files.readString(output)).endsWith(System.lineSeparator());
    }

    static ClusterFacts sampleFacts(List<String> warnings) {
        Vip vip = new Vip("1", "rac1-vip", "rac1-vip.example.com", "10.0.0.11", null);
        Scan scan = new Scan("1", "rac-scan", "rac-scan.example.com",
            List.of("10.0.0.21", "10.0.0.22", "10.0.0.23"), List.of());
        Map<String, String> ports = new LinkedHashMap<>();
        ports.put("tcp", "1521");
        ports.put("tcps", "2484");
        Listener resolved = new Listener("LISTENER", "Database Listener", "1", "TCP:1521/TCPS:2484", ports,
            null, null, null).withVip(vip);
        Listener unresolved = new Listener("LISTENER_NET2", "Database Listener", "2", "TCP:1525",
            Map.of("tcp", "1525"), null, null, null);
        ScanListener scanListener = new ScanListener("1", scan.fqdn(), "TCP:1521", Map.of("tcp", "1521"),
            scan.ipv4(), scan.ipv6());

        return new ClusterFacts(
            "rac-cluster",
            Map.of("version", "Oracle Clusterware active version on the cluster is [19.0.0.0.0]"),
            List.of(vip),
            List.of(new Network("1", "10.0.0.0/255.255.255.0/eth0, static", null),
                new Network("2", "192.168.10.0/255.255.255.0/eth2, static", null)),
            List.of(scan),
            List.of(resolved, unresolved),
            List.of(scanListener),
            List.of("orcl", "rptdb"),
            "/u01/app/19.0.0/grid",
            true,
            warnings
        );
    }
}
