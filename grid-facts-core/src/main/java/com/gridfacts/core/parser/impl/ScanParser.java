package com.gridfacts.core.parser.impl;

import com.gridfacts.core.host.HostResolver;
import com.gridfacts.core.model.Scan;
import com.gridfacts.core.parser.base.AbstractRecordParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code srvctl config scan -all}.
 *
 * <pre>
 * SCAN name: rac-scan, Network: 1
 * Subnet IPv4: 10.0.0.0/255.255.255.0/eth0, static
 * SCAN 1 IPv4 VIP: 10.0.0.21
 * SCAN VIP is enabled.
 * SCAN 2 IPv4 VIP: 10.0.0.22
 * </pre>
 */
public class ScanParser extends AbstractRecordParser<Scan, ScanParser.Builder> {

    private static final String SCAN_NAME = "SCAN name:";
    private static final Pattern SCAN_HEADER = Pattern.compile("SCAN name: (.+), Network: ([0-9]+)");
    private static final Pattern SCAN_VIP = Pattern.compile("SCAN [0-9]+ (IPv[46]) VIP: (.+)");

    private final HostResolver hostResolver;

    public ScanParser(HostResolver hostResolver) {
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver must not be null");
    }

    @Override
    public String getId() {
        return "scan";
    }

    @Override
    protected Builder startRecord(String line, String source) {
        if (!line.startsWith(SCAN_NAME)) {
            return null;
        }
        Matcher matcher = findFirst(SCAN_HEADER, line);
        if (matcher == null) {
            throw malformed("SCAN record without name and network", line, source);
        }
        String name = matcher.group(1).trim();
        return new Builder(matcher.group(2), name, hostResolver.fqdn(name));
    }

    @Override
    protected void applyField(Builder builder, String line) {
        Matcher matcher = findFirst(SCAN_VIP, line);
        if (matcher == null) {
            return;
        }
        String address = extractGroup(matcher, 2).trim();
        if ("IPv4".equals(matcher.group(1))) {
            builder.ipv4.add(address);
        } else {
            builder.ipv6.add(address);
        }
    }

    static final class Builder implements RecordBuilder<Scan> {
        private final String networkId;
        private final String name;
        private final String fqdn;
        private final List<String> ipv4 = new ArrayList<>();
        private final List<String> ipv6 = new ArrayList<>();

        Builder(String networkId, String name, String fqdn) {
            this.networkId = networkId;
            this.name = name;
            this.fqdn = fqdn;
        }

        @Override
        public String key() {
            return networkId;
        }

        @Override
        public Scan build() {
            return new Scan(networkId, name, fqdn, ipv4, ipv6);
        }
    }
}
