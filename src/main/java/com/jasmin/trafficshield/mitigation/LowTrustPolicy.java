package com.jasmin.trafficshield.mitigation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a source belongs to the configured low-trust population (test ranges,
 * traffic generators). Membership comes only from the configured CIDR ranges and identifiers.
 */
@Slf4j
@Component
public class LowTrustPolicy {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final Pattern IPV6 = Pattern.compile("\\[?[0-9A-Fa-f]*:[0-9A-Fa-f:.]*]?");

    private final Set<String> sourceIds;
    private final List<Range> ranges;
    private final double thresholdMultiplier;

    public LowTrustPolicy(MitigationProperties props) {
        MitigationProperties.LowTrust cfg = props.getLowTrust();
        this.sourceIds = Collections.unmodifiableSet(new HashSet<>(cfg.getSourceIds()));
        this.thresholdMultiplier = cfg.getThresholdMultiplier();
        List<Range> parsed = new ArrayList<>();
        for (String cidr : cfg.getCidrs()) {
            parsed.add(Range.parse(cidr));
        }
        this.ranges = Collections.unmodifiableList(parsed);
        if (!sourceIds.isEmpty() || !ranges.isEmpty()) {
            log.info("Low-trust policy: {} ranges, {} explicit sources", ranges.size(), sourceIds.size());
        }
    }

    public boolean isLowTrust(String sourceId) {
        if (sourceId == null) {
            return false;
        }
        if (sourceIds.contains(sourceId)) {
            return true;
        }
        if (ranges.isEmpty()) {
            return false;
        }
        byte[] address = literal(sourceId);
        if (address == null) {
            return false;
        }
        for (Range r : ranges) {
            if (r.contains(address)) {
                return true;
            }
        }
        return false;
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    /** Address bytes of an IP literal, or null when the id is not one. Never resolves names. */
    static byte[] literal(String s) {
        if (IPV4.matcher(s).matches()) {
            String[] octets = s.split("\\.");
            byte[] out = new byte[4];
            for (int i = 0; i < 4; i++) {
                int v = Integer.parseInt(octets[i]);
                if (v > 255) {
                    return null;
                }
                out[i] = (byte) v;
            }
            return out;
        }
        // anything else would reach the resolver
        if (!IPV6.matcher(s).matches()) {
            return null;
        }
        try {
            return InetAddress.getByName(s).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static final class Range {
        private final BigInteger network;
        private final BigInteger mask;
        private final int length;

        private Range(BigInteger network, BigInteger mask, int length) {
            this.network = network;
            this.mask = mask;
            this.length = length;
        }

        static Range parse(String cidr) {
            String[] parts = cidr.trim().split("/");
            byte[] base = literal(parts[0]);
            if (base == null || parts.length > 2) {
                throw new IllegalArgumentException("Invalid CIDR: " + cidr);
            }
            int bits = base.length * 8;
            int prefix;
            try {
                prefix = parts.length == 2 ? Integer.parseInt(parts[1]) : bits;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid CIDR prefix: " + cidr, e);
            }
            if (prefix < 0 || prefix > bits) {
                throw new IllegalArgumentException("Invalid CIDR prefix: " + cidr);
            }
            BigInteger all = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
            BigInteger mask = all.shiftRight(bits - prefix).shiftLeft(bits - prefix);
            return new Range(new BigInteger(1, base).and(mask), mask, base.length);
        }

        boolean contains(byte[] address) {
            return address.length == length && new BigInteger(1, address).and(mask).equals(network);
        }
    }
}
