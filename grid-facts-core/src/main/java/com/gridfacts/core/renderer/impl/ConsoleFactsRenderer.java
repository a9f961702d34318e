package com.gridfacts.core.renderer.impl;

import com.gridfacts.core.model.ClusterFacts;
import com.gridfacts.core.model.Listener;
import com.gridfacts.core.model.Network;
import com.gridfacts.core.model.Scan;
import com.gridfacts.core.model.ScanListener;
import com.gridfacts.core.model.Vip;
import com.gridfacts.core.renderer.FactsRenderer;
import com.gridfacts.core.renderer.RenderContext;

import java.util.List;

/**
 * Renders a human-readable summary with optional ANSI colors.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleFactsRenderer implements FactsRenderer {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public String format(ClusterFacts facts, RenderContext context) {
        boolean colors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        StringBuilder out = new StringBuilder();

        heading(out, "Cluster", colors);
        out.append("  Name:    ").append(facts.clusterName().isEmpty() ? "(unknown)" : facts.clusterName()).append('\n');
        out.append("  Mode:    ").append(facts.crsMode() ? "Clusterware" : "Oracle Restart").append('\n');
        out.append("  Home:    ").append(facts.crsHome()).append('\n');
        facts.version().forEach((key, value) -> out.append("  ").append(key).append(": ").append(value).append('\n'));

        heading(out, "Networks (" + facts.networks().size() + ")", colors);
        for (Network network : facts.networks()) {
            out.append("  ").append(network.id()).append("  ipv4=").append(orDash(network.ipv4Subnet()))
                .append("  ipv6=").append(orDash(network.ipv6Subnet())).append('\n');
        }

        heading(out, "VIPs (" + facts.vips().size() + ")", colors);
        for (Vip vip : facts.vips()) {
            out.append("  net ").append(vip.networkId()).append("  ").append(orDash(vip.fqdn()))
                .append("  ").append(orDash(vip.ipv4())).append('\n');
        }

        heading(out, "SCANs (" + facts.scans().size() + ")", colors);
        for (Scan scan : facts.scans()) {
            out.append("  net ").append(scan.networkId()).append("  ").append(orDash(scan.fqdn()))
                .append("  ").append(join(scan.ipv4(), scan.ipv6())).append('\n');
        }

        heading(out, "Local listeners (" + facts.localListeners().size() + ")", colors);
        for (Listener listener : facts.localListeners()) {
            out.append("  ").append(listener.name()).append("  ").append(orDash(listener.endpoints()))
                .append("  ").append(orDash(listener.address())).append('\n');
        }

        heading(out, "SCAN listeners (" + facts.scanListeners().size() + ")", colors);
        for (ScanListener scanListener : facts.scanListeners()) {
            out.append("  net ").append(scanListener.networkId()).append("  ").append(scanListener.endpoints())
                .append("  ").append(orDash(scanListener.scanAddress())).append('\n');
        }

        heading(out, "Databases (" + facts.databases().size() + ")", colors);
        facts.databases().forEach(db -> out.append("  ").append(db).append('\n'));

        if (facts.hasWarnings()) {
            out.append('\n').append(colors ? ANSI_YELLOW : "").append("Warnings:").append(colors ? ANSI_RESET : "").append('\n');
            facts.warnings().forEach(warning -> out.append("  ! ").append(warning).append('\n'));
        }
        return out.toString().stripTrailing();
    }

    private static void heading(StringBuilder out, String title, boolean colors) {
        if (out.length() > 0) {
            out.append('\n');
        }
        if (colors) {
            out.append(ANSI_BOLD).append(ANSI_CYAN).append(title).append(ANSI_RESET);
        } else {
            out.append(title);
        }
        out.append('\n');
    }

    private static String join(List<String> ipv4, List<String> ipv6) {
        if (ipv4.isEmpty() && ipv6.isEmpty()) {
            return "-";
        }
        return String.join(", ", ipv4) + (ipv6.isEmpty() ? "" : " " + String.join(", ", ipv6));
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }
}
