package com.gridfacts.core.parser.impl;

import com.gridfacts.core.host.HostResolver;
import com.gridfacts.core.model.Vip;
import com.gridfacts.core.parser.base.AbstractRecordParser;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code srvctl config vip -n <node>}.
 *
 * <pre>
 * VIP exists: network number 1, hosting node rac1
 * VIP Name: rac1-vip
 * VIP IPv4 Address: 10.0.0.11
 * VIP IPv6 Address:
 * VIP is enabled.
 * </pre>
 */
public class VipParser extends AbstractRecordParser<Vip, VipParser.Builder> {

    private static final String VIP_EXISTS = "VIP exists:";
    private static final Pattern NETWORK_NUMBER = Pattern.compile("network number ([0-9]+),");

    private static final String VIP_NAME = "VIP Name:";
    private static final String VIP_IPV4 = "VIP IPv4 Address:";
    private static final String VIP_IPV6 = "VIP IPv6 Address:";

    private final HostResolver hostResolver;

    public VipParser(HostResolver hostResolver) {
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver must not be null");
    }

    @Override
    public String getId() {
        return "vip";
    }

    @Override
    protected Builder startRecord(String line, String source) {
        if (!line.startsWith(VIP_EXISTS)) {
            return null;
        }
        Matcher matcher = findFirst(NETWORK_NUMBER, line);
        if (matcher == null) {
            throw malformed("VIP record without network number", line, source);
        }
        return new Builder(matcher.group(1));
    }

    @Override
    protected void applyField(Builder builder, String line) {
        String value;
        if ((value = valueAfter(line, VIP_NAME)) != null) {
            builder.name = value;
            builder.fqdn = hostResolver.fqdn(value);
        } else if ((value = valueAfter(line, VIP_IPV4)) != null) {
            builder.ipv4 = value;
        } else if ((value = valueAfter(line, VIP_IPV6)) != null) {
            builder.ipv6 = value;
        }
    }

    static final class Builder implements RecordBuilder<Vip> {
        private final String networkId;
        private String name;
        private String fqdn;
        private String ipv4;
        private String ipv6;

        Builder(String networkId) {
            this.networkId = networkId;
        }

        @Override
        public String key() {
            return networkId;
        }

        @Override
        public Vip build() {
            return new Vip(networkId, name, fqdn, ipv4, ipv6);
        }
    }
}
