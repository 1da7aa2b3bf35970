package socs.routing.topology;

import socs.routing.util.Ipv4Address;
import socs.routing.util.RouterConstants;
import socs.routing.util.RouterUtils;

/**
 * A network interface on a node. A device attached to a channel is a point-to-point interface;
 * a device without one is a stub interface whose subnet carries no transit traffic.
 */
public class NetDevice {
    private final Node node;
    private final int ifIndex;
    private final Ipv4Address address;
    private final Ipv4Address mask;
    private long metric = RouterConstants.METRIC_UNSET;
    private Channel channel;

    NetDevice(Node node, int ifIndex, Ipv4Address address, Ipv4Address mask) {
        this.node = node;
        this.ifIndex = ifIndex;
        this.address = address;
        this.mask = mask;
    }

    public Node getNode() {
        return node;
    }

    public int getIfIndex() {
        return ifIndex;
    }

    public Ipv4Address getAddress() {
        return address;
    }

    public Ipv4Address getMask() {
        return mask;
    }

    public Ipv4Address getNetworkAddress() {
        return address.combineMask(mask);
    }

    /**
     * @return the configured cost, or {@link RouterConstants#METRIC_UNSET}
     */
    public long getMetric() {
        return metric;
    }

    public NetDevice setMetric(long metric) {
        this.metric = RouterUtils.checkMetric(metric);
        return this;
    }

    public Channel getChannel() {
        return channel;
    }

    void setChannel(Channel channel) {
        this.channel = channel;
    }

    public boolean isPointToPoint() {
        return channel != null;
    }

    @Override
    public String toString() {
        return "node " + node.getId() + " if " + ifIndex + " (" + address + "/" + mask.prefixLength() + ")";
    }
}
