package com.gridfacts.core.renderer.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gridfacts.core.model.ClusterFacts;
import com.gridfacts.core.model.Listener;
import com.gridfacts.core.model.Network;
import com.gridfacts.core.model.Scan;
import com.gridfacts.core.model.ScanListener;
import com.gridfacts.core.model.Vip;
import com.gridfacts.core.renderer.FactsRenderer;
import com.gridfacts.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Renders facts as JSON under a single {@code oracle_gi_facts} key.
 *
 * <p>Key names follow the fact names consumers of Grid Infrastructure facts already use:
 * {@code clustername}, {@code vip}, {@code network}, {@code scan}, {@code local_listener},
 * {@code scan_listener}, {@code database_list}, {@code oracle_crs_home}, with the version keys at
 * the top level. Listener ports are flattened into the listener object ({@code "tcp": "1521"}).
 * Absent values are omitted.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code json.pretty} - Indent output ("true"/"false", default: "true")</li>
 * </ul>
 */
public class JsonFactsRenderer implements FactsRenderer {

    private static final Logger log = LoggerFactory.getLogger(JsonFactsRenderer.class);

    public static final String ROOT_KEY = "oracle_gi_facts";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String format(ClusterFacts facts, RenderContext context) {
        boolean pretty = Boolean.parseBoolean(context.getSettingOrDefault("json.pretty", "true"));
        ObjectNode root = MAPPER.createObjectNode();
        root.set(ROOT_KEY, toJson(facts));
        try {
            return pretty
                ? MAPPER.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root)
                : MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize facts", e);
            throw new IllegalStateException("Failed to serialize facts", e);
        }
    }

    /**
     * Converts facts to a JSON tree.
     *
     * @param facts collected facts
     * @return facts object (without the {@value #ROOT_KEY} wrapper)
     */
    public ObjectNode toJson(ClusterFacts facts) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("clustername", facts.clusterName());
        facts.version().forEach((key, value) -> node.put(key, value));

        ArrayNode vips = node.putArray("vip");
        facts.vips().forEach(vip -> vips.add(vip(vip)));
        ArrayNode networks = node.putArray("network");
        facts.networks().forEach(network -> networks.add(network(network)));
        ArrayNode scans = node.putArray("scan");
        facts.scans().forEach(scan -> scans.add(scan(scan)));
        ArrayNode listeners = node.putArray("local_listener");
        facts.localListeners().forEach(listener -> listeners.add(listener(listener)));
        ArrayNode scanListeners = node.putArray("scan_listener");
        facts.scanListeners().forEach(scanListener -> scanListeners.add(scanListener(scanListener)));

        strings(node.putArray("database_list"), facts.databases());
        node.put("oracle_crs_home", facts.crsHome());
        node.put("crs_mode", facts.crsMode());
        if (facts.hasWarnings()) {
            strings(node.putArray("warnings"), facts.warnings());
        }
        return node;
    }

    private ObjectNode vip(Vip vip) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, "network", vip.networkId());
        putIfPresent(node, "name", vip.name());
        putIfPresent(node, "fqdn", vip.fqdn());
        putIfPresent(node, "ipv4", vip.ipv4());
        putIfPresent(node, "ipv6", vip.ipv6());
        return node;
    }

    private ObjectNode network(Network network) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, "network", network.id());
        putIfPresent(node, "ipv4", network.ipv4Subnet());
        putIfPresent(node, "ipv6", network.ipv6Subnet());
        return node;
    }

    private ObjectNode scan(Scan scan) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, "network", scan.networkId());
        putIfPresent(node, "name", scan.name());
        putIfPresent(node, "fqdn", scan.fqdn());
        strings(node.putArray("ipv4"), scan.ipv4());
        strings(node.putArray("ipv6"), scan.ipv6());
        return node;
    }

    private ObjectNode listener(Listener listener) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, "name", listener.name());
        putIfPresent(node, "type", listener.type());
        putIfPresent(node, "network", listener.networkId());
        putIfPresent(node, "endpoints", listener.endpoints());
        ports(node, listener.protocolPorts());
        putIfPresent(node, "address", listener.address());
        putIfPresent(node, "ipv4", listener.ipv4());
        putIfPresent(node, "ipv6", listener.ipv6());
        return node;
    }

    private ObjectNode scanListener(ScanListener scanListener) {
        ObjectNode node = MAPPER.createObjectNode();
        putIfPresent(node, "network", scanListener.networkId());
        putIfPresent(node, "scan_address", scanListener.scanAddress());
        putIfPresent(node, "endpoints", scanListener.endpoints());
        strings(node.putArray("ipv4"), scanListener.ipv4());
        strings(node.putArray("ipv6"), scanListener.ipv6());
        ports(node, scanListener.protocolPorts());
        return node;
    }

    private static void ports(ObjectNode node, Map<String, String> protocolPorts) {
        // protocol keys never replace record fields
        protocolPorts.forEach((protocol, port) -> {
            if (!node.has(protocol)) {
                node.put(protocol, port);
            }
        });
    }

    private static void strings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static void putIfPresent(ObjectNode node, String key, String value) {
        if (value != null) {
            node.put(key, value);
        }
    }
}
