package com.minislaq.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IP address helpers
 *
 * Only address literals are accepted. Host names are rejected before they
 * reach {@link InetAddress}, so nothing here ever does a DNS lookup.
 *
 * @author Mini-SLAQ
 */
public final class NetworkUtils {

    private static final List<Cidr> PRIVATE_BLOCKS;

    static {
        List<Cidr> blocks = new ArrayList<>();
        for (String range : Constants.PRIVATE_RANGES) {
            blocks.add(parseCidr(range));
        }
        PRIVATE_BLOCKS = Collections.unmodifiableList(blocks);
    }

    private NetworkUtils() {
    }

    /**
     * Parse an IPv4 or IPv6 address literal
     *
     * @return raw address bytes (4 or 16), or null if the text is not an address
     */
    public static byte[] parseAddress(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (text.indexOf(':') < 0) {
            return parseIpv4(text);
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean allowed = Character.digit(c, 16) >= 0 || c == ':' || c == '.';
            if (!allowed) {
                return null;
            }
        }
        try {
            // text is a pure IPv6 literal here, so no name resolution happens
            byte[] address = InetAddress.getByName(text).getAddress();
            return address.length == 16 ? address : toMappedIpv6(address);
        } catch (UnknownHostException e) {
            return null;
        }
    }

    public static boolean isValidAddress(String text) {
        return parseAddress(text) != null;
    }

    private static byte[] parseIpv4(String text) {
        String[] parts = text.split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        byte[] address = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3) {
                return null;
            }
            for (int j = 0; j < part.length(); j++) {
                if (!Character.isDigit(part.charAt(j))) {
                    return null;
                }
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                return null;
            }
            address[i] = (byte) octet;
        }
        return address;
    }

    private static byte[] toMappedIpv6(byte[] ipv4) {
        byte[] mapped = new byte[16];
        mapped[10] = (byte) 0xff;
        mapped[11] = (byte) 0xff;
        System.arraycopy(ipv4, 0, mapped, 12, 4);
        return mapped;
    }

    /**
     * Parse a CIDR block such as 192.168.1.0/24 or fc00::/7
     *
     * @return the block, or null if the text is not a valid CIDR block
     */
    public static Cidr parseCidr(String text) {
        if (text == null) {
            return null;
        }
        int slash = text.indexOf('/');
        if (slash < 0) {
            return null;
        }
        byte[] network = parseAddress(text.substring(0, slash));
        if (network == null) {
            return null;
        }
        String bits = text.substring(slash + 1);
        if (bits.isEmpty() || bits.length() > 3) {
            return null;
        }
        for (int i = 0; i < bits.length(); i++) {
            if (!Character.isDigit(bits.charAt(i))) {
                return null;
            }
        }
        int prefix = Integer.parseInt(bits);
        if (prefix > network.length * 8) {
            return null;
        }
        return new Cidr(network, prefix);
    }

    /**
     * Whether the address is private, loopback or link-local
     */
    public static boolean isPrivate(byte[] address) {
        for (Cidr block : PRIVATE_BLOCKS) {
            if (block.contains(address)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Coarse origin bucket from the first IPv4 octet
     *
     * Best effort only: this is not geolocation and the buckets say nothing
     * reliable about where a client is.
     */
    public static String countryOf(String text) {
        byte[] address = parseAddress(text);
        if (address == null) {
            return "Unknown";
        }
        if (isPrivate(address)) {
            return "Private";
        }
        if (address.length == 4) {
            int first = address[0] & 0xff;
            if (first >= 1 && first <= 126) {
                return "US/International";
            }
            if (first >= 128 && first <= 223) {
                return "International";
            }
        }
        return "Unknown";
    }

    /**
     * CIDR block
     */
    public static final class Cidr {

        private final byte[] network;
        private final int prefixLength;

        private Cidr(byte[] network, int prefixLength) {
            this.network = network;
            this.prefixLength = prefixLength;
        }

        /**
         * IPv4 addresses never match IPv6 blocks and vice versa
         */
        public boolean contains(byte[] address) {
            if (address == null || address.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xff << (8 - remainingBits)) & 0xff;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }

        public int getPrefixLength() {
            return prefixLength;
        }
    }
}
