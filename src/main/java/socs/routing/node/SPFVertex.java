package socs.routing.node;

import socs.routing.message.RouterLSA;
import socs.routing.message.RouterLSA.SPFStatus;
import socs.routing.util.Ipv4Address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A vertex of the shortest path tree (RFC 2328, section 16). Vertices belong to the
 * {@link SPFCalculator} run that created them and refer to each other by handle, their index in
 * that run's vertex table.
 */
public class SPFVertex {

    public enum VertexType {
        ROUTER,
        NETWORK
    }

    /**
     * The first hop out of the root: the address to forward to and the root's interface to send on.
     */
    public static final class NextHop implements Comparable<NextHop> {
        private final Ipv4Address address;
        private final int ifIndex;

        NextHop(Ipv4Address address, int ifIndex) {
            this.address = address;
            this.ifIndex = ifIndex;
        }

        public Ipv4Address getAddress() {
            return address;
        }

        public int getIfIndex() {
            return ifIndex;
        }

        @Override
        public int compareTo(NextHop other) {
            int byAddress = address.compareTo(other.address);
            if (byAddress != 0) {
                return byAddress;
            }
            return Integer.compare(ifIndex, other.ifIndex);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof NextHop)) {
                return false;
            }
            NextHop other = (NextHop) o;
            return ifIndex == other.ifIndex && address.equals(other.address);
        }

        @Override
        public int hashCode() {
            return 31 * address.hashCode() + ifIndex;
        }

        @Override
        public String toString() {
            return address + "%" + ifIndex;
        }
    }

    private final int handle;
    private final VertexType vertexType;
    private final Ipv4Address vertexId;
    // host mask for routers
    private final Ipv4Address mask;
    // null for network vertices
    private final RouterLSA lsa;

    private long distanceFromRoot;
    private SPFStatus status = SPFStatus.NOT_EXPLORED;
    private final List<Integer> parents = new ArrayList<>();
    private final List<Integer> children = new ArrayList<>();
    // only filled in for vertices whose parent is the root
    private final List<NextHop> rootNextHops = new ArrayList<>();

    SPFVertex(int handle, VertexType vertexType, Ipv4Address vertexId, Ipv4Address mask, RouterLSA lsa) {
        this.handle = handle;
        this.vertexType = vertexType;
        this.vertexId = vertexId;
        this.mask = mask;
        this.lsa = lsa;
    }

    public int getHandle() {
        return handle;
    }

    public VertexType getVertexType() {
        return vertexType;
    }

    public Ipv4Address getVertexId() {
        return vertexId;
    }

    public Ipv4Address getMask() {
        return mask;
    }

    RouterLSA getLSA() {
        return lsa;
    }

    /**
     * Only meaningful once the vertex is in the tree.
     */
    public long getDistanceFromRoot() {
        return distanceFromRoot;
    }

    void setDistanceFromRoot(long distanceFromRoot) {
        this.distanceFromRoot = distanceFromRoot;
    }

    public SPFStatus getStatus() {
        return status;
    }

    void setStatus(SPFStatus status) {
        this.status = status;
        if (lsa != null) {
            lsa.setStatus(status);
        }
    }

    public List<Integer> getParents() {
        return Collections.unmodifiableList(parents);
    }

    void addParent(int parent) {
        if (!parents.contains(parent)) {
            parents.add(parent);
        }
    }

    void clearParents() {
        parents.clear();
        rootNextHops.clear();
    }

    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(int child) {
        children.add(child);
    }

    List<NextHop> getRootNextHops() {
        return rootNextHops;
    }

    void addRootNextHop(NextHop nextHop) {
        if (!rootNextHops.contains(nextHop)) {
            rootNextHops.add(nextHop);
        }
    }

    @Override
    public String toString() {
        return vertexType + " " + vertexId + (vertexType == VertexType.NETWORK ? "/" + mask.prefixLength() : "") +
                " (" + status + ", distance " + distanceFromRoot + ")";
    }
}
