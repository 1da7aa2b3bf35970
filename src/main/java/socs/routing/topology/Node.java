package socs.routing.topology;

import socs.routing.node.RouterAgent;
import socs.routing.node.RoutingTable;
import socs.routing.util.Ipv4Address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A simulated node: an ordered set of interfaces, a forwarding table and, when the node is a
 * router, the agent that advertises its links.
 */
public class Node {
    private final int id;
    private final List<NetDevice> devices = new ArrayList<>();
    private final RoutingTable routingTable = new RoutingTable();
    private RouterAgent routerAgent;

    Node(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Add an interface. Its interface index is its position on the node.
     */
    public NetDevice addDevice(Ipv4Address address, Ipv4Address mask) {
        NetDevice device = new NetDevice(this, devices.size(), address, mask);
        devices.add(device);
        return device;
    }

    public int getNDevices() {
        return devices.size();
    }

    public NetDevice getDevice(int ifIndex) {
        return devices.get(ifIndex);
    }

    public List<NetDevice> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    public Optional<NetDevice> getDeviceByAddress(Ipv4Address address) {
        for (NetDevice device : devices) {
            if (device.getAddress().equals(address)) {
                return Optional.of(device);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the index of the interface with the given address, or -1 if there is none
     */
    public int getInterfaceForAddress(Ipv4Address address) {
        Optional<NetDevice> device = getDeviceByAddress(address);
        return device.isPresent() ? device.get().getIfIndex() : -1;
    }

    /**
     * @return the first stub interface whose subnet is the given network
     */
    public Optional<NetDevice> getStubDevice(Ipv4Address network, Ipv4Address mask) {
        for (NetDevice device : devices) {
            if (!device.isPointToPoint() && device.getMask().equals(mask) &&
                    device.getNetworkAddress().equals(network)) {
                return Optional.of(device);
            }
        }
        return Optional.empty();
    }

    public Optional<RouterAgent> getRouterAgent() {
        return Optional.ofNullable(routerAgent);
    }

    public void setRouterAgent(RouterAgent routerAgent) {
        if (this.routerAgent != null && routerAgent != null) {
            throw new IllegalStateException("Node " + id + " already carries a router agent");
        }
        this.routerAgent = routerAgent;
    }

    public RoutingTable getRoutingTable() {
        return routingTable;
    }

    @Override
    public String toString() {
        return "Node[" + id + "]";
    }
}
