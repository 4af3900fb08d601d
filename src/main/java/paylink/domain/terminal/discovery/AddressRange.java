package paylink.domain.terminal.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IPv4 range to scan: CIDR block, inclusive dash range or a single host.
 * For CIDR prefixes shorter than /31 the network and broadcast addresses are skipped.
 */
public final class AddressRange {
    private final String definition;
    private final List<String> hosts;

    private AddressRange(String definition, List<String> hosts) {
        this.definition = definition;
        this.hosts = Collections.unmodifiableList(hosts);
    }

    /**
     * @throws IllegalArgumentException if the range is malformed or has more than maxHosts addresses
     */
    public static AddressRange parse(String definition, int maxHosts) {
        if (definition == null || definition.isBlank()) {
            throw new IllegalArgumentException("Address range cannot be empty");
        }
        String value = definition.trim();

        if (value.contains("/")) {
            String[] parts = value.split("/", 2);
            long base = toLong(parts[0]);
            int prefix = parsePrefix(parts[1]);
            long size = 1L << (32 - prefix);
            long network = base & (~(size - 1) & 0xFFFFFFFFL);
            long first = network;
            long last = network + size - 1;
            if (prefix < 31) {
                first++;
                last--;
            }
            return new AddressRange(value, enumerate(first, last, maxHosts));
        }

        if (value.contains("-")) {
            String[] parts = value.split("-", 2);
            long first = toLong(parts[0].trim());
            long last = toLong(parts[1].trim());
            if (last < first) {
                throw new IllegalArgumentException("Address range end is before its start: " + value);
            }
            return new AddressRange(value, enumerate(first, last, maxHosts));
        }

        if (isIpv4(value)) {
            return new AddressRange(value, List.of(toString(toLong(value))));
        }
        // single host name
        return new AddressRange(value, List.of(value));
    }

    private static List<String> enumerate(long first, long last, int maxHosts) {
        long count = last - first + 1;
        if (count > maxHosts) {
            throw new IllegalArgumentException("Address range has " + count + " hosts, the limit is " + maxHosts);
        }
        List<String> result = new ArrayList<>((int) count);
        for (long ip = first; ip <= last; ip++) {
            result.add(toString(ip));
        }
        return result;
    }

    private static int parsePrefix(String value) {
        try {
            int prefix = Integer.parseInt(value.trim());
            if (prefix < 0 || prefix > 32) {
                throw new IllegalArgumentException("CIDR prefix must be between 0 and 32, got " + prefix);
            }
            return prefix;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid CIDR prefix '" + value + "'", e);
        }
    }

    private static boolean isIpv4(String value) {
        return value.matches("\\d{1,3}(\\.\\d{1,3}){3}");
    }

    private static long toLong(String ip) {
        if (!isIpv4(ip)) {
            throw new IllegalArgumentException("Invalid IPv4 address '" + ip + "'");
        }
        long result = 0;
        for (String octet : ip.split("\\.")) {
            int value = Integer.parseInt(octet);
            if (value > 255) {
                throw new IllegalArgumentException("Invalid IPv4 address '" + ip + "'");
            }
            result = (result << 8) | value;
        }
        return result;
    }

    private static String toString(long ip) {
        return ((ip >> 24) & 0xFF) + "." + ((ip >> 16) & 0xFF) + "." + ((ip >> 8) & 0xFF) + "." + (ip & 0xFF);
    }

    public List<String> hosts() {
        return hosts;
    }

    public int size() {
        return hosts.size();
    }

    @Override
    public String toString() {
        return "AddressRange{" + definition + ", " + hosts.size() + " hosts}";
    }
}
