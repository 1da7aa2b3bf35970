package socs.routing.topology;

import org.junit.Test;
import socs.routing.util.Ipv4Address;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class NodeTest {

    @Test
    public void interfaceIndexFollowsInsertionOrder() {
        NodeList nodes = new NodeList();
        Node node = nodes.create();
        NetDevice first = node.addDevice(Ipv4Address.parse("10.0.0.1"), Ipv4Address.maskOf(24));
        NetDevice second = node.addDevice(Ipv4Address.parse("10.0.1.1"), Ipv4Address.maskOf(24));
        assertEquals(0, first.getIfIndex());
        assertEquals(1, second.getIfIndex());
        assertSame(second, node.getDeviceByAddress(Ipv4Address.parse("10.0.1.1")).get());
        assertFalse(node.getDeviceByAddress(Ipv4Address.parse("10.0.2.1")).isPresent());
        assertEquals(1, node.getInterfaceForAddress(Ipv4Address.parse("10.0.1.1")));
        assertEquals(-1, node.getInterfaceForAddress(Ipv4Address.parse("10.0.2.1")));
    }

    @Test
    public void stubDeviceFoundByNetwork() {
        Node node = new NodeList().create();
        NetDevice stub = node.addDevice(Ipv4Address.parse("192.168.3.7"), Ipv4Address.maskOf(24));
        assertSame(stub, node.getStubDevice(Ipv4Address.parse("192.168.3.0"), Ipv4Address.maskOf(24)).get());
        assertFalse(node.getStubDevice(Ipv4Address.parse("192.168.3.0"), Ipv4Address.maskOf(25)).isPresent());
    }

    @Test
    public void channelRecordsEveryAttachedDevice() {
        NodeList nodes = new NodeList();
        Channel channel = new Channel("c");
        for (int i = 0; i < 3; i++) {
            channel.attach(nodes.create().addDevice(Ipv4Address.parse("10.0.0." + (i + 1)), Ipv4Address.maskOf(24)));
        }
        assertEquals(3, channel.getNDevices());
        assertTrue(channel.getDevice(2).isPointToPoint());
    }

    @Test(expected = IllegalStateException.class)
    public void deviceJoinsOnlyOneChannel() {
        NetDevice device = new NodeList().create().addDevice(Ipv4Address.parse("10.0.0.1"), Ipv4Address.maskOf(24));
        new Channel("a").attach(device);
        new Channel("b").attach(device);
    }

    @Test
    public void nodesIterateInIndexOrder() {
        NodeList nodes = new NodeList();
        nodes.create();
        nodes.create();
        nodes.create();
        int expected = 0;
        for (Node node : nodes) {
            assertEquals(expected++, node.getId());
        }
        assertEquals(3, nodes.size());
    }
}
