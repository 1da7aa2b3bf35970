package socs.routing.node;

import socs.routing.util.Ipv4Address;

/**
 * One forwarding table entry. A next hop of 0.0.0.0 means the destination is on-link.
 */
public final class RouteEntry {

    public enum RouteSource {
        STATIC,
        GLOBAL
    }

    private final Ipv4Address destination;
    private final Ipv4Address mask;
    private final Ipv4Address nextHop;
    private final int ifIndex;
    private final long metric;
    private final RouteSource source;

    public RouteEntry(Ipv4Address destination, Ipv4Address mask, Ipv4Address nextHop, int ifIndex,
                      long metric, RouteSource source) {
        this.destination = destination;
        this.mask = mask;
        this.nextHop = nextHop;
        this.ifIndex = ifIndex;
        this.metric = metric;
        this.source = source;
    }

    public Ipv4Address getDestination() {
        return destination;
    }

    public Ipv4Address getMask() {
        return mask;
    }

    public Ipv4Address getNextHop() {
        return nextHop;
    }

    public int getIfIndex() {
        return ifIndex;
    }

    public long getMetric() {
        return metric;
    }

    public RouteSource getSource() {
        return source;
    }

    public boolean matches(Ipv4Address address) {
        return address.combineMask(mask).equals(destination.combineMask(mask));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouteEntry)) {
            return false;
        }
        RouteEntry other = (RouteEntry) o;
        return ifIndex == other.ifIndex && metric == other.metric && source == other.source &&
                destination.equals(other.destination) && mask.equals(other.mask) && nextHop.equals(other.nextHop);
    }

    @Override
    public int hashCode() {
        int result = destination.hashCode();
        result = 31 * result + mask.hashCode();
        result = 31 * result + nextHop.hashCode();
        result = 31 * result + ifIndex;
        result = 31 * result + (int) (metric ^ (metric >>> 32));
        result = 31 * result + source.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return destination + "/" + mask.prefixLength() + " via " + (nextHop.isAny() ? "on-link" : nextHop.toString()) +
                " if " + ifIndex + " metric " + metric + " [" + source + "]";
    }
}
