package com.example.iam.policy.rule;

import com.example.iam.common.exception.ValidationException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * IPv4 or IPv6 network in CIDR notation. A bare address is a single-host block.
 *
 * <p>Only address literals are accepted; host names are never resolved.
 */
public final class CidrBlock {

    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    // Starts with a hex digit or colon and contains a colon: InetAddress treats it as a literal or fails
    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9a-fA-F:]*:[0-9a-fA-F:.]*$");

    private final String notation;
    private final byte[] network;
    private final int prefixLength;

    private CidrBlock(String notation, byte[] network, int prefixLength) {
        this.notation = notation;
        this.network = network;
        this.prefixLength = prefixLength;
    }

    public static CidrBlock parse(String notation) {
        if (notation == null || notation.isBlank()) {
            throw new ValidationException("CIDR block is required");
        }
        String trimmed = notation.trim();
        int slash = trimmed.indexOf('/');
        String addressPart = slash < 0 ? trimmed : trimmed.substring(0, slash);

        InetAddress address = parseAddress(addressPart)
                .orElseThrow(() -> new ValidationException("Invalid IP address in CIDR block: " + notation));
        int maxBits = address.getAddress().length * 8;

        int prefix = maxBits;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(trimmed.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new ValidationException("Invalid CIDR prefix length: " + notation, e);
            }
            if (prefix < 0 || prefix > maxBits) {
                throw new ValidationException("CIDR prefix length out of range: " + notation);
            }
        }
        return new CidrBlock(trimmed, mask(address.getAddress(), prefix), prefix);
    }

    /**
     * Parses an IP literal. Returns empty for anything that is not one; the resolver is
     * never consulted.
     */
    public static Optional<InetAddress> parseAddress(String literal) {
        if (literal == null || literal.isBlank()) {
            return Optional.empty();
        }
        String candidate = literal.trim();
        if (IPV4_LITERAL.matcher(candidate).matches()) {
            return parseIpv4(candidate);
        }
        if (!IPV6_LITERAL.matcher(candidate).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByName(candidate));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    private static Optional<InetAddress> parseIpv4(String candidate) {
        String[] octets = candidate.split("\\.");
        byte[] bytes = new byte[4];
        for (int i = 0; i < octets.length; i++) {
            int value = Integer.parseInt(octets[i]);
            if (value > 255) {
                return Optional.empty();
            }
            bytes[i] = (byte) value;
        }
        try {
            return Optional.of(InetAddress.getByAddress(bytes));
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Four-byte address rejected", e);
        }
    }

    public boolean contains(InetAddress address) {
        byte[] candidate = address.getAddress();
        if (candidate.length != network.length) {
            return false;
        }
        return Arrays.equals(mask(candidate, prefixLength), network);
    }

    private static byte[] mask(byte[] address, int prefix) {
        byte[] masked = address.clone();
        for (int i = 0; i < masked.length; i++) {
            int bitsInByte = Math.max(0, Math.min(8, prefix - i * 8));
            int byteMask = bitsInByte == 0 ? 0 : (0xFF << (8 - bitsInByte)) & 0xFF;
            masked[i] = (byte) (masked[i] & byteMask);
        }
        return masked;
    }

    @Override
    public String toString() {
        return notation;
    }
}
