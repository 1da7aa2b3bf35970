package socs.routing.util;

import java.io.Serializable;

/**
 * An immutable IPv4 address or network mask, held as the 32 bits of an int.
 * Ordering treats the bits as unsigned so that 10.0.0.1 sorts before 192.168.0.1.
 */
public final class Ipv4Address implements Comparable<Ipv4Address>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final Ipv4Address ANY = new Ipv4Address(0);
    public static final Ipv4Address HOST_MASK = new Ipv4Address(0xFFFFFFFF);

    private final int address;

    private Ipv4Address(int address) {
        this.address = address;
    }

    /**
     * Parse a dotted quad such as "10.1.1.2".
     *
     * @param dotted the textual form
     * @return the address
     * @throws IllegalArgumentException if the text is not four octets in the range 0-255
     */
    public static Ipv4Address parse(String dotted) {
        if (dotted == null) {
            throw new IllegalArgumentException("Address must not be null");
        }
        String[] octets = dotted.trim().split("\\.", -1);
        if (octets.length != 4) {
            throw new IllegalArgumentException("Not a dotted quad: [" + dotted + "]");
        }
        int value = 0;
        for (String octet : octets) {
            int part;
            try {
                part = Integer.parseInt(octet);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a dotted quad: [" + dotted + "]", e);
            }
            if (part < 0 || part > 255) {
                throw new IllegalArgumentException("Octet out of range in [" + dotted + "]");
            }
            value = (value << 8) | part;
        }
        return new Ipv4Address(value);
    }

    /**
     * Build a mask from a prefix length, e.g. 24 gives 255.255.255.0.
     */
    public static Ipv4Address maskOf(int prefixLength) {
        if (prefixLength < 0 || prefixLength > 32) {
            throw new IllegalArgumentException("Prefix length must be between 0-32: " + prefixLength);
        }
        if (prefixLength == 0) {
            return ANY;
        }
        return new Ipv4Address(0xFFFFFFFF << (32 - prefixLength));
    }

    public int toInt() {
        return address;
    }

    public Ipv4Address combineMask(Ipv4Address mask) {
        return new Ipv4Address(address & mask.address);
    }

    public Ipv4Address next() {
        if (address == 0xFFFFFFFF) {
            throw new IllegalStateException("Address space exhausted after " + this);
        }
        return new Ipv4Address(address + 1);
    }

    /**
     * @return the number of leading one bits when this address is read as a mask
     */
    public int prefixLength() {
        return Integer.bitCount(address);
    }

    /**
     * @return the number of leading bits this address shares with the other one
     */
    public int commonPrefixLength(Ipv4Address other) {
        return Integer.numberOfLeadingZeros(address ^ other.address);
    }

    public boolean isAny() {
        return address == 0;
    }

    @Override
    public int compareTo(Ipv4Address other) {
        return Integer.compareUnsigned(address, other.address);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ipv4Address)) {
            return false;
        }
        return address == ((Ipv4Address) o).address;
    }

    @Override
    public int hashCode() {
        return address;
    }

    @Override
    public String toString() {
        return ((address >>> 24) & 0xFF) + "." + ((address >>> 16) & 0xFF) + "." +
                ((address >>> 8) & 0xFF) + "." + (address & 0xFF);
    }
}
