package socs.routing.message;

import org.junit.Test;
import socs.routing.message.LinkRecord.LinkType;
import socs.routing.util.Ipv4Address;
import socs.routing.util.RouterConstants;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class LinkRecordTest {

    @Test
    public void emptyRecordIsUninitialized() {
        LinkRecord record = new LinkRecord();
        assertEquals(LinkType.UNKNOWN, record.getLinkType());
        assertEquals(Ipv4Address.ANY, record.getLinkId());
        assertEquals(Ipv4Address.ANY, record.getLinkData());
        assertEquals(0, record.getMetric());
    }

    @Test
    public void pointToPointCarriesNeighbourAndLocalAddress() {
        LinkRecord record = LinkRecord.pointToPoint(Ipv4Address.parse("0.0.0.2"), Ipv4Address.parse("10.1.1.1"), 3);
        assertEquals(LinkType.POINT_TO_POINT, record.getLinkType());
        assertEquals(Ipv4Address.parse("0.0.0.2"), record.getLinkId());
        assertEquals(Ipv4Address.parse("10.1.1.1"), record.getLinkData());
        assertEquals(3, record.getMetric());
    }

    @Test
    public void acceptsFullUnsignedRange() {
        LinkRecord record = new LinkRecord();
        record.setMetric(RouterConstants.MAX_METRIC);
        assertEquals(RouterConstants.MAX_METRIC, record.getMetric());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeMetric() {
        new LinkRecord().setMetric(-1);
    }

    @Test(expected = NullPointerException.class)
    public void rejectsNullAddress() {
        new LinkRecord().setLinkId(null);
    }

    @Test
    public void equalityIsStructural() {
        LinkRecord a = LinkRecord.stubNetwork(Ipv4Address.parse("10.0.0.0"), Ipv4Address.maskOf(24), 0);
        LinkRecord b = LinkRecord.stubNetwork(Ipv4Address.parse("10.0.0.0"), Ipv4Address.maskOf(24), 0);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        b.setMetric(1);
        assertNotEquals(a, b);
    }
}
