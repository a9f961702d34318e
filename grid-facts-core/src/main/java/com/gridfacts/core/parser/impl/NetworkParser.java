package com.gridfacts.core.parser.impl;

import com.gridfacts.core.model.Network;
import com.gridfacts.core.parser.base.AbstractRecordParser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code srvctl config network}.
 *
 * <pre>
 * Network 1 exists
 * Subnet IPv4: 10.0.0.0/255.255.255.0/eth0, static
 * Subnet IPv6:
 * Ping Targets:
 * Network is enabled
 * </pre>
 */
public class NetworkParser extends AbstractRecordParser<Network, NetworkParser.Builder> {

    private static final Pattern NETWORK_EXISTS = Pattern.compile("Network ([0-9]+) exists");

    static final String SUBNET_IPV4 = "Subnet IPv4:";
    static final String SUBNET_IPV6 = "Subnet IPv6:";

    @Override
    public String getId() {
        return "network";
    }

    @Override
    protected Builder startRecord(String line, String source) {
        Matcher matcher = findFirst(NETWORK_EXISTS, line);
        return matcher == null ? null : new Builder(matcher.group(1));
    }

    @Override
    protected void applyField(Builder builder, String line) {
        String value;
        if ((value = valueAfter(line, SUBNET_IPV4)) != null) {
            builder.ipv4Subnet = value;
        } else if ((value = valueAfter(line, SUBNET_IPV6)) != null) {
            builder.ipv6Subnet = value;
        }
    }

    static final class Builder implements RecordBuilder<Network> {
        private final String id;
        private String ipv4Subnet;
        private String ipv6Subnet;

        Builder(String id) {
            this.id = id;
        }

        @Override
        public String key() {
            return id;
        }

        @Override
        public Network build() {
            return new Network(id, ipv4Subnet, ipv6Subnet);
        }
    }
}
