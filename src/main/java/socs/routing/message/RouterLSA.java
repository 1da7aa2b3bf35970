package socs.routing.message;

import socs.routing.util.Ipv4Address;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A router link state advertisement: the header fields of an OSPF router LSA together with the
 * router's link records. The whole routing domain is known at once, so there is no age or
 * sequence number; an advertisement is rebuilt from scratch on each discovery.
 * <p/>
 * Link records are held by value and kept in insertion order. Duplicates are allowed.
 */
public class RouterLSA implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Marks whether the vertex for this router is unexplored, waiting on the candidate list, or
     * already placed in the shortest path tree.
     */
    public enum SPFStatus {
        NOT_EXPLORED,
        CANDIDATE,
        IN_SPFTREE
    }

    private Ipv4Address linkStateId;
    private Ipv4Address advertisingRouter;
    private SPFStatus status;
    private final List<LinkRecord> linkRecords = new ArrayList<>();

    public RouterLSA() {
        this(SPFStatus.NOT_EXPLORED, Ipv4Address.ANY, Ipv4Address.ANY);
    }

    public RouterLSA(SPFStatus status, Ipv4Address linkStateId, Ipv4Address advertisingRouter) {
        setStatus(status);
        setLinkStateId(linkStateId);
        setAdvertisingRouter(advertisingRouter);
    }

    /**
     * Deep copy: the new advertisement gets its own copy of every link record.
     */
    public RouterLSA(RouterLSA lsa) {
        this(lsa.status, lsa.linkStateId, lsa.advertisingRouter);
        copyLinkRecords(lsa);
    }

    /**
     * Overwrite this advertisement with a deep copy of another one. Existing records are dropped first.
     *
     * @return this advertisement
     */
    public RouterLSA assign(RouterLSA lsa) {
        if (lsa == this) {
            return this;
        }
        clearLinkRecords();
        setStatus(lsa.status);
        setLinkStateId(lsa.linkStateId);
        setAdvertisingRouter(lsa.advertisingRouter);
        copyLinkRecords(lsa);
        return this;
    }

    /**
     * Append copies of the other advertisement's link records. This concatenates; call
     * {@link #clearLinkRecords()} first to replace.
     */
    public void copyLinkRecords(RouterLSA lsa) {
        // snapshot so copying an advertisement onto itself terminates
        List<LinkRecord> source = new ArrayList<>(lsa.linkRecords);
        for (LinkRecord record : source) {
            linkRecords.add(new LinkRecord(record));
        }
    }

    /**
     * @param record the record to append; a copy is stored
     * @return the number of link records after the append
     */
    public int addLinkRecord(LinkRecord record) {
        linkRecords.add(new LinkRecord(record));
        return linkRecords.size();
    }

    public int getNLinkRecords() {
        return linkRecords.size();
    }

    /**
     * @param n index of the record, 0 based
     * @return a copy of the record
     * @throws IndexOutOfBoundsException if there is no such record
     */
    public LinkRecord getLinkRecord(int n) {
        return new LinkRecord(linkRecords.get(n));
    }

    /**
     * @return read-only view of the records in insertion order
     */
    public List<LinkRecord> getLinkRecords() {
        return Collections.unmodifiableList(linkRecords);
    }

    public void clearLinkRecords() {
        linkRecords.clear();
    }

    public boolean isEmpty() {
        return linkRecords.isEmpty();
    }

    public Ipv4Address getLinkStateId() {
        return linkStateId;
    }

    public void setLinkStateId(Ipv4Address linkStateId) {
        if (linkStateId == null) {
            throw new NullPointerException("Link state id must not be null");
        }
        this.linkStateId = linkStateId;
    }

    public Ipv4Address getAdvertisingRouter() {
        return advertisingRouter;
    }

    public void setAdvertisingRouter(Ipv4Address advertisingRouter) {
        if (advertisingRouter == null) {
            throw new NullPointerException("Advertising router must not be null");
        }
        this.advertisingRouter = advertisingRouter;
    }

    public SPFStatus getStatus() {
        return status;
    }

    public void setStatus(SPFStatus status) {
        if (status == null) {
            throw new NullPointerException("SPF status must not be null");
        }
        this.status = status;
    }

    /**
     * Write a verbose dump of the header and every link record.
     */
    public void print(StringBuilder sb) {
        sb.append("--------------------------------------------------\n");
        sb.append("       LinkStateID   :   ").append(linkStateId).append("\n");
        sb.append("       AdvertisingRtr:   ").append(advertisingRouter).append("\n");
        sb.append("       Status        :   ").append(status).append("\n");
        sb.append("..................................................\n");
        for (LinkRecord record : linkRecords) {
            sb.append(record).append("\n");
        }
        sb.append("--------------------------------------------------\n");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouterLSA)) {
            return false;
        }
        RouterLSA other = (RouterLSA) o;
        return status == other.status && linkStateId.equals(other.linkStateId) &&
                advertisingRouter.equals(other.advertisingRouter) && linkRecords.equals(other.linkRecords);
    }

    @Override
    public int hashCode() {
        int result = linkStateId.hashCode();
        result = 31 * result + advertisingRouter.hashCode();
        result = 31 * result + status.hashCode();
        result = 31 * result + linkRecords.hashCode();
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb);
        return sb.toString();
    }
}
