package socs.routing.message;

import socs.routing.util.Ipv4Address;
import socs.routing.util.RouterUtils;

import java.io.Serializable;

/**
 * A single link of a router link state advertisement, modelled on the link fields of an OSPF
 * router LSA (RFC 2328, A.4.2).
 * <p/>
 * The meaning of the two address fields depends on the link type:
 * <ul>
 * <li>{@link LinkType#POINT_TO_POINT}: link id is the router id of the neighbouring router, link data
 * is the address of the local end of the link.</li>
 * <li>{@link LinkType#STUB_NETWORK}: link id is the network address, link data is the network mask.</li>
 * </ul>
 * The metric is an additive cost. A sum of metrics along a path must mean something, so use a
 * delay-like figure rather than bandwidth.
 */
public class LinkRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum LinkType {
        UNKNOWN,
        POINT_TO_POINT,
        // transit and virtual links are never discovered; kept so the numbering matches OSPF
        TRANSIT_NETWORK,
        STUB_NETWORK,
        VIRTUAL_LINK
    }

    private LinkType linkType;
    private Ipv4Address linkId;
    private Ipv4Address linkData;
    private long metric;

    /**
     * An uninitialized record: unknown type, both addresses 0.0.0.0, metric 0.
     */
    public LinkRecord() {
        this(LinkType.UNKNOWN, Ipv4Address.ANY, Ipv4Address.ANY, 0);
    }

    public LinkRecord(LinkType linkType, Ipv4Address linkId, Ipv4Address linkData, long metric) {
        setLinkType(linkType);
        setLinkId(linkId);
        setLinkData(linkData);
        setMetric(metric);
    }

    public LinkRecord(LinkRecord record) {
        this(record.linkType, record.linkId, record.linkData, record.metric);
    }

    public static LinkRecord pointToPoint(Ipv4Address neighbourRouterId, Ipv4Address localAddress, long metric) {
        return new LinkRecord(LinkType.POINT_TO_POINT, neighbourRouterId, localAddress, metric);
    }

    public static LinkRecord stubNetwork(Ipv4Address networkAddress, Ipv4Address mask, long metric) {
        return new LinkRecord(LinkType.STUB_NETWORK, networkAddress, mask, metric);
    }

    public LinkType getLinkType() {
        return linkType;
    }

    public void setLinkType(LinkType linkType) {
        if (linkType == null) {
            throw new NullPointerException("Link type must not be null");
        }
        this.linkType = linkType;
    }

    public Ipv4Address getLinkId() {
        return linkId;
    }

    public void setLinkId(Ipv4Address linkId) {
        if (linkId == null) {
            throw new NullPointerException("Link id must not be null");
        }
        this.linkId = linkId;
    }

    public Ipv4Address getLinkData() {
        return linkData;
    }

    public void setLinkData(Ipv4Address linkData) {
        if (linkData == null) {
            throw new NullPointerException("Link data must not be null");
        }
        this.linkData = linkData;
    }

    public long getMetric() {
        return metric;
    }

    public void setMetric(long metric) {
        this.metric = RouterUtils.checkMetric(metric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LinkRecord)) {
            return false;
        }
        LinkRecord other = (LinkRecord) o;
        return linkType == other.linkType && metric == other.metric &&
                linkId.equals(other.linkId) && linkData.equals(other.linkData);
    }

    @Override
    public int hashCode() {
        int result = linkType.hashCode();
        result = 31 * result + linkId.hashCode();
        result = 31 * result + linkData.hashCode();
        result = 31 * result + (int) (metric ^ (metric >>> 32));
        return result;
    }

    @Override
    public String toString() {
        return "LinkType [" + linkType + "] - LinkID [" + linkId + "] - LinkData [" + linkData +
                "] - Metric [" + metric + "]";
    }
}
