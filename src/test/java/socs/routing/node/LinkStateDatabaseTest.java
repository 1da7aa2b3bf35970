package socs.routing.node;

import org.junit.Before;
import org.junit.Test;
import socs.routing.message.LinkRecord;
import socs.routing.message.RouterLSA;
import socs.routing.topology.NodeList;
import socs.routing.util.Ipv4Address;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LinkStateDatabaseTest {
    private NodeList nodes;
    private LinkStateDatabase lsdb;

    @Before
    public void setUp() {
        nodes = new NodeList();
        lsdb = new LinkStateDatabase();
    }

    @Test
    public void buildStoresOneAdvertisementPerRouter() throws TopologyDiscoveryException {
        List<RouterAgent> agents = Topologies.line(nodes, 3, 1);
        nodes.create(); // a plain host, not a router

        lsdb.build(nodes);

        assertEquals(3, lsdb.size());
        List<Ipv4Address> expectedIds = new ArrayList<>();
        for (RouterAgent agent : agents) {
            expectedIds.add(agent.getRouterId());
        }
        assertEquals(expectedIds, new ArrayList<>(lsdb.getRouterIds()));
        RouterLSA middle = lsdb.lookup(agents.get(1).getRouterId()).get();
        assertEquals(2, middle.getNLinkRecords());
        assertEquals(agents.get(0).getRouterId(), middle.getLinkRecord(0).getLinkId());
        assertEquals(agents.get(2).getRouterId(), middle.getLinkRecord(1).getLinkId());
    }

    @Test
    public void repeatedBuildIsIdentical() throws TopologyDiscoveryException {
        List<RouterAgent> agents = new ArrayList<>();
        Topologies.randomConnected(nodes, agents, 10, 6, 42L);
        Topologies.stub(agents.get(3), "172.16.0.1", 16);

        lsdb.build(nodes);
        String first = lsdb.toString();
        List<RouterLSA> firstLSAs = new ArrayList<>(lsdb.getLSAs());

        lsdb.build(nodes);
        assertEquals(first, lsdb.toString());
        assertEquals(firstLSAs, new ArrayList<>(lsdb.getLSAs()));
    }

    @Test
    public void lookupOfUnknownRouterIsEmpty() throws TopologyDiscoveryException {
        Topologies.line(nodes, 2, 1);
        lsdb.build(nodes);
        assertFalse(lsdb.lookup(Ipv4Address.parse("203.0.113.1")).isPresent());
    }

    @Test
    public void emptyDatabaseBeforeBuild() {
        Topologies.line(nodes, 2, 1);
        assertTrue(lsdb.isEmpty());
        assertFalse(lsdb.lookup(nodes.get(0).getRouterAgent().get().getRouterId()).isPresent());
    }

    @Test
    public void clearDropsEverything() throws TopologyDiscoveryException {
        Topologies.line(nodes, 2, 1);
        lsdb.build(nodes);
        lsdb.clear();
        assertEquals(0, lsdb.size());
    }

    @Test
    public void buildReflectsTopologyChange() throws TopologyDiscoveryException {
        List<RouterAgent> agents = Topologies.line(nodes, 2, 1);
        lsdb.build(nodes);
        assertEquals(1, lsdb.lookup(agents.get(0).getRouterId()).get().getNLinkRecords());

        Topologies.stub(agents.get(0), "192.168.0.1", 24);
        lsdb.build(nodes);
        RouterLSA lsa = lsdb.lookup(agents.get(0).getRouterId()).get();
        assertEquals(2, lsa.getNLinkRecords());
        assertEquals(LinkRecord.LinkType.STUB_NETWORK, lsa.getLinkRecord(1).getLinkType());
    }

    @Test
    public void malformedChannelOnlyAffectsItsRouters() {
        List<RouterAgent> agents = Topologies.routers(nodes, 5);
        Topologies.threeWayChannel(agents.get(0), agents.get(1), agents.get(2));
        Topologies.link(agents.get(0), agents.get(3), "10.4.4", 1);
        Topologies.link(agents.get(3), agents.get(4), "10.5.5", 1);

        try {
            lsdb.build(nodes);
            fail("build should report the malformed channel");
        } catch (TopologyDiscoveryException e) {
            assertEquals(3, e.getFailedRouters().size());
            assertTrue(e.getFailedRouters().contains(agents.get(0).getRouterId()));
            assertEquals(3, e.getSuppressed().length);
            assertTrue(e.getSuppressed()[0] instanceof MalformedTopologyException);
        }

        assertEquals(2, lsdb.size());
        assertFalse(lsdb.lookup(agents.get(0).getRouterId()).isPresent());
        RouterLSA r4 = lsdb.lookup(agents.get(3).getRouterId()).get();
        assertEquals(2, r4.getNLinkRecords());
        assertEquals(agents.get(0).getRouterId(), r4.getLinkRecord(0).getLinkId());
        assertTrue(lsdb.lookup(agents.get(4).getRouterId()).isPresent());
    }
}
