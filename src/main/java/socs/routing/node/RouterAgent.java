package socs.routing.node;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import socs.routing.message.LinkRecord;
import socs.routing.message.RouterLSA;
import socs.routing.topology.Channel;
import socs.routing.topology.NetDevice;
import socs.routing.topology.Node;
import socs.routing.util.Configuration;
import socs.routing.util.Ipv4Address;
import socs.routing.util.RouterConstants;
import socs.routing.util.RouterIdAllocator;
import socs.routing.util.RouterUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The routing capability of a node. Its presence marks the node as a router; it is how the
 * route manager asks a router for the link state advertisements describing its connections.
 */
public class RouterAgent {
    private final Log log = LogFactory.getLog(RouterAgent.class);

    private final Node node;
    private final Ipv4Address routerId;
    private final long defaultInterfaceMetric;
    private final long defaultStubMetric;

    private final List<RouterLSA> lsas = new ArrayList<>();

    RouterAgent(Node node, Configuration config) {
        this.node = node;
        this.routerId = RouterIdAllocator.getInstance().allocateRouterId();
        this.defaultInterfaceMetric = config.getMetric(RouterConstants.INTERFACE_DEFAULT_METRIC_KEY);
        this.defaultStubMetric = config.getMetric(RouterConstants.STUB_DEFAULT_METRIC_KEY);
    }

    /**
     * Make the given node a router using the classpath configuration.
     *
     * @param node the node that gains the routing capability
     * @return the agent now attached to the node
     */
    public static RouterAgent install(Node node) {
        return install(node, Configuration.load());
    }

    /**
     * Make the given node a router.
     *
     * @param node   the node that gains the routing capability
     * @param config supplies the default interface and stub metrics
     * @return the agent now attached to the node
     */
    public static RouterAgent install(Node node, Configuration config) {
        RouterAgent agent = new RouterAgent(node, config);
        node.setRouterAgent(agent);
        return agent;
    }

    public Ipv4Address getRouterId() {
        return routerId;
    }

    public Node getNode() {
        return node;
    }

    /**
     * Walk the interfaces of the node and build the advertisement this router exports. Every
     * point-to-point interface contributes a link to the router at the other end of its channel,
     * every interface without a channel contributes its subnet as a stub network.
     * <p/>
     * Each call throws away the previous advertisements and starts over, so a changed topology is
     * picked up by calling this again.
     *
     * @return the number of advertisements now held
     * @throws MalformedTopologyException if a channel does not join exactly two interfaces; no
     *                                    advertisement is held afterwards
     */
    public int discoverLSAs() throws MalformedTopologyException {
        clearLSAs();
        RouterLSA lsa = new RouterLSA(RouterLSA.SPFStatus.NOT_EXPLORED, routerId, routerId);

        for (NetDevice device : node.getDevices()) {
            if (device.isPointToPoint()) {
                NetDevice adjacent = getAdjacent(device, device.getChannel());
                Optional<RouterAgent> neighbour = adjacent.getNode().getRouterAgent();
                if (!neighbour.isPresent()) {
                    log.warn("[" + RouterConstants.DISCOVER_STRING + "] Router " + routerId + ": the device at " +
                            "the other end of " + device.getChannel() + " belongs to " + adjacent.getNode() +
                            ", which is not a router. Link ignored.");
                    continue;
                }
                long metric = RouterUtils.metricOrDefault(device.getMetric(), defaultInterfaceMetric);
                lsa.addLinkRecord(LinkRecord.pointToPoint(neighbour.get().getRouterId(), device.getAddress(), metric));
                if (log.isDebugEnabled()) {
                    log.debug("[" + RouterConstants.DISCOVER_STRING + "] Router " + routerId + " if " +
                            device.getIfIndex() + " -> router " + neighbour.get().getRouterId() + " metric " + metric);
                }
            } else {
                long metric = RouterUtils.metricOrDefault(device.getMetric(), defaultStubMetric);
                lsa.addLinkRecord(LinkRecord.stubNetwork(device.getNetworkAddress(), device.getMask(), metric));
                if (log.isDebugEnabled()) {
                    log.debug("[" + RouterConstants.DISCOVER_STRING + "] Router " + routerId + " if " +
                            device.getIfIndex() + " -> stub " + device.getNetworkAddress() + "/" +
                            device.getMask().prefixLength() + " metric " + metric);
                }
            }
        }

        lsas.add(lsa);
        return lsas.size();
    }

    public int getNumLSAs() {
        return lsas.size();
    }

    /**
     * @param n index of the advertisement, between 0 and {@link #getNumLSAs()} - 1
     * @return a copy of the advertisement, or empty if there is no such index
     */
    public Optional<RouterLSA> getLSA(int n) {
        if (n < 0 || n >= lsas.size()) {
            return Optional.empty();
        }
        return Optional.of(new RouterLSA(lsas.get(n)));
    }

    /**
     * @param localAddress address of one of this router's interfaces
     * @return the interface index, or -1 if no interface has that address
     */
    int findIfIndexForAddress(Ipv4Address localAddress) {
        return node.getInterfaceForAddress(localAddress);
    }

    /**
     * @return the index of the stub interface carrying the given subnet, or -1
     */
    int findIfIndexForNetwork(Ipv4Address network, Ipv4Address mask) {
        Optional<NetDevice> device = node.getStubDevice(network, mask);
        return device.isPresent() ? device.get().getIfIndex() : -1;
    }

    private void clearLSAs() {
        lsas.clear();
    }

    /**
     * @return the device sharing the channel with the given one
     */
    private NetDevice getAdjacent(NetDevice device, Channel channel) throws MalformedTopologyException {
        int nDevices = channel.getNDevices();
        if (nDevices != 2) {
            String message = "[" + RouterConstants.DISCOVER_STRING + "] Router " + routerId + " on " + node +
                    ": point-to-point " + channel + " has " + nDevices + " attached device(s), expected 2.";
            log.error(message);
            throw new MalformedTopologyException(channel, message);
        }
        NetDevice first = channel.getDevice(0);
        NetDevice second = channel.getDevice(1);
        if (first == device) {
            return second;
        }
        if (second == device) {
            return first;
        }
        String message = "[" + RouterConstants.DISCOVER_STRING + "] " + channel + " does not list " + device +
                " among its devices.";
        log.error(message);
        throw new MalformedTopologyException(channel, message);
    }
}
