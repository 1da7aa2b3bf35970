package socs.routing.node;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import socs.routing.message.LinkRecord;
import socs.routing.message.RouterLSA;
import socs.routing.message.RouterLSA.SPFStatus;
import socs.routing.node.RouteEntry.RouteSource;
import socs.routing.node.SPFVertex.NextHop;
import socs.routing.node.SPFVertex.VertexType;
import socs.routing.util.Ipv4Address;
import socs.routing.util.RouterConstants;
import socs.routing.util.RouterUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Dijkstra shortest path first calculation over a link state database, after RFC 2328 16.1.
 * <p/>
 * One calculator may be reused for several roots; each {@link #compute(RouterAgent)} throws away
 * the previous tree. The calculator marks the database advertisements as it goes, so the
 * database must not be rebuilt or shared with another calculation while a run is in progress.
 */
public class SPFCalculator {
    private final Log log = LogFactory.getLog(SPFCalculator.class);

    private final LinkStateDatabase lsdb;

    // vertex table of the current run; a handle is an index into it
    private final List<SPFVertex> vertices = new ArrayList<>();
    private final Map<VertexKey, Integer> vertexIndex = new HashMap<>();
    // handles in the order they joined the tree
    private final List<Integer> treeOrder = new ArrayList<>();
    private final TreeSet<Integer> candidates = new TreeSet<>(new Comparator<Integer>() {
        @Override
        public int compare(Integer a, Integer b) {
            return compareCandidates(vertices.get(a), vertices.get(b));
        }
    });

    private RouterAgent rootAgent;
    private int root = -1;

    public SPFCalculator(LinkStateDatabase lsdb) {
        this.lsdb = lsdb;
    }

    /**
     * Build the shortest path tree rooted at the given router. A root without an advertisement in
     * the database gets an empty tree.
     *
     * @param rootAgent the router to compute paths from
     * @return true if the root was found in the database
     */
    public boolean compute(RouterAgent rootAgent) {
        reset();
        this.rootAgent = rootAgent;
        Ipv4Address rootId = rootAgent.getRouterId();

        Optional<RouterLSA> rootLSA = lsdb.lookup(rootId);
        if (!rootLSA.isPresent()) {
            log.debug("[" + RouterConstants.SPF_STRING + "] No advertisement for root " + rootId +
                    ". Nothing is reachable.");
            return false;
        }

        root = createVertex(VertexType.ROUTER, rootId, Ipv4Address.HOST_MASK, rootLSA.get());
        SPFVertex rootVertex = vertices.get(root);
        rootVertex.setDistanceFromRoot(0);
        rootVertex.setStatus(SPFStatus.IN_SPFTREE);
        treeOrder.add(root);

        int current = root;
        while (true) {
            relax(current);
            if (candidates.isEmpty()) {
                break;
            }
            current = candidates.pollFirst();
            SPFVertex vertex = vertices.get(current);
            vertex.setStatus(SPFStatus.IN_SPFTREE);
            treeOrder.add(current);
            for (int parent : vertex.getParents()) {
                vertices.get(parent).addChild(current);
            }
            if (log.isDebugEnabled()) {
                log.debug("[" + RouterConstants.SPF_STRING + "] Root " + rootId + " added " + vertex);
            }
        }
        return true;
    }

    private void reset() {
        vertices.clear();
        vertexIndex.clear();
        treeOrder.clear();
        candidates.clear();
        lsdb.resetStatus();
        rootAgent = null;
        root = -1;
    }

    /**
     * Examine the links of a vertex that has just joined the tree (RFC 2328 16.1 step 2).
     */
    private void relax(int handle) {
        SPFVertex vertex = vertices.get(handle);
        RouterLSA lsa = vertex.getLSA();
        if (lsa == null) {
            // stub networks are leaves
            return;
        }

        for (LinkRecord record : lsa.getLinkRecords()) {
            switch (record.getLinkType()) {
                case POINT_TO_POINT:
                    relaxPointToPoint(vertex, record);
                    break;
                case STUB_NETWORK:
                    NextHop onLink = null;
                    if (handle == root) {
                        onLink = new NextHop(RouterConstants.ON_LINK,
                                rootAgent.findIfIndexForNetwork(record.getLinkId(), record.getLinkData()));
                    }
                    relaxEdge(vertex, VertexType.NETWORK, record.getLinkId(), record.getLinkData(), null,
                            record.getMetric(), onLink);
                    break;
                default:
                    log.debug("[" + RouterConstants.SPF_STRING + "] Ignoring " + record.getLinkType() +
                            " link of router " + vertex.getVertexId());
                    break;
            }
        }
    }

    private void relaxPointToPoint(SPFVertex vertex, LinkRecord record) {
        Ipv4Address neighbourId = record.getLinkId();
        Optional<RouterLSA> neighbourLSA = lsdb.lookup(neighbourId);
        if (!neighbourLSA.isPresent()) {
            log.debug("[" + RouterConstants.SPF_STRING + "] Router " + neighbourId + " has no advertisement. " +
                    "Link from " + vertex.getVertexId() + " skipped.");
            return;
        }
        LinkRecord backLink = findBackLink(neighbourLSA.get(), vertex.getVertexId(), record.getLinkData());
        if (backLink == null) {
            log.warn("[" + RouterConstants.SPF_STRING + "] Router " + neighbourId + " does not advertise a link " +
                    "back to " + vertex.getVertexId() + ". Link skipped.");
            return;
        }

        NextHop nextHop = null;
        if (vertex.getHandle() == root) {
            nextHop = new NextHop(backLink.getLinkData(), rootAgent.findIfIndexForAddress(record.getLinkData()));
        }
        relaxEdge(vertex, VertexType.ROUTER, neighbourId, Ipv4Address.HOST_MASK, neighbourLSA.get(),
                record.getMetric(), nextHop);
    }

    /**
     * Of the neighbour's point-to-point links back to the given router, pick the one whose local
     * address shares the longest prefix with ours, i.e. the other end of the same link.
     */
    private LinkRecord findBackLink(RouterLSA neighbourLSA, Ipv4Address routerId, Ipv4Address localAddress) {
        LinkRecord best = null;
        int bestPrefix = -1;
        for (LinkRecord record : neighbourLSA.getLinkRecords()) {
            if (record.getLinkType() != LinkRecord.LinkType.POINT_TO_POINT || !record.getLinkId().equals(routerId)) {
                continue;
            }
            int prefix = record.getLinkData().commonPrefixLength(localAddress);
            if (prefix > bestPrefix) {
                best = record;
                bestPrefix = prefix;
            }
        }
        return best;
    }

    private void relaxEdge(SPFVertex parent, VertexType type, Ipv4Address id, Ipv4Address mask, RouterLSA lsa,
                           long metric, NextHop nextHop) {
        Integer handle = vertexIndex.get(new VertexKey(type, id, mask));
        if (handle != null && vertices.get(handle).getStatus() == SPFStatus.IN_SPFTREE) {
            return;
        }

        long distance = RouterUtils.addMetrics(parent.getDistanceFromRoot(), metric);
        if (distance < 0) {
            log.warn("[" + RouterConstants.SPF_STRING + "] Path to " + type + " " + id + " through " +
                    parent.getVertexId() + " exceeds the maximum metric " + RouterConstants.MAX_METRIC +
                    ". Path rejected.");
            return;
        }

        if (handle == null) {
            int created = createVertex(type, id, mask, lsa);
            SPFVertex vertex = vertices.get(created);
            vertex.setDistanceFromRoot(distance);
            vertex.setStatus(SPFStatus.CANDIDATE);
            vertex.addParent(parent.getHandle());
            if (nextHop != null) {
                vertex.addRootNextHop(nextHop);
            }
            candidates.add(created);
            return;
        }

        SPFVertex vertex = vertices.get(handle);
        if (distance < vertex.getDistanceFromRoot()) {
            // re-key: the candidate set orders on distance
            candidates.remove(handle);
            vertex.setDistanceFromRoot(distance);
            vertex.clearParents();
            vertex.addParent(parent.getHandle());
            if (nextHop != null) {
                vertex.addRootNextHop(nextHop);
            }
            candidates.add(handle);
        } else if (distance == vertex.getDistanceFromRoot()) {
            vertex.addParent(parent.getHandle());
            if (nextHop != null) {
                vertex.addRootNextHop(nextHop);
            }
        }
    }

    private int createVertex(VertexType type, Ipv4Address id, Ipv4Address mask, RouterLSA lsa) {
        int handle = vertices.size();
        vertices.add(new SPFVertex(handle, type, id, mask, lsa));
        vertexIndex.put(new VertexKey(type, id, mask), handle);
        return handle;
    }

    /**
     * Lowest distance first, then lowest vertex id, then networks before routers.
     */
    private static int compareCandidates(SPFVertex a, SPFVertex b) {
        int result = Long.compare(a.getDistanceFromRoot(), b.getDistanceFromRoot());
        if (result != 0) {
            return result;
        }
        result = a.getVertexId().compareTo(b.getVertexId());
        if (result != 0) {
            return result;
        }
        if (a.getVertexType() != b.getVertexType()) {
            return a.getVertexType() == VertexType.NETWORK ? -1 : 1;
        }
        result = a.getMask().compareTo(b.getMask());
        if (result != 0) {
            return result;
        }
        return Integer.compare(a.getHandle(), b.getHandle());
    }

    /**
     * Turn the tree into forwarding entries for the root: a host route to every reachable router
     * and a network route to every reachable stub network. When several equal cost paths exist
     * the lowest next hop address wins.
     *
     * @return the entries, nearest destinations first
     */
    public List<RouteEntry> getRouteEntries() {
        List<RouteEntry> entries = new ArrayList<>();
        if (root < 0) {
            return entries;
        }
        Map<Integer, TreeSet<NextHop>> nextHops = new HashMap<>();
        for (int handle : treeOrder) {
            if (handle == root) {
                continue;
            }
            SPFVertex vertex = vertices.get(handle);
            TreeSet<NextHop> hops = findNextHops(handle, nextHops);
            if (hops.isEmpty()) {
                log.warn("[" + RouterConstants.SPF_STRING + "] No first hop found toward " + vertex + ". Skipped.");
                continue;
            }
            NextHop best = hops.first();
            entries.add(new RouteEntry(vertex.getVertexId(), vertex.getMask(), best.getAddress(), best.getIfIndex(),
                    vertex.getDistanceFromRoot(), RouteSource.GLOBAL));
        }
        return entries;
    }

    /**
     * Walk the parents of a vertex back toward the root and collect the first hops of every
     * shortest path found on the way.
     */
    private TreeSet<NextHop> findNextHops(int handle, Map<Integer, TreeSet<NextHop>> memo) {
        TreeSet<NextHop> hops = memo.get(handle);
        if (hops != null) {
            return hops;
        }
        hops = new TreeSet<>();
        SPFVertex vertex = vertices.get(handle);
        for (int parent : vertex.getParents()) {
            if (parent == root) {
                hops.addAll(vertex.getRootNextHops());
            } else {
                hops.addAll(findNextHops(parent, memo));
            }
        }
        memo.put(handle, hops);
        return hops;
    }

    /**
     * Render the first shortest path to a router as "root ->(metric) hop ->(metric) destination".
     *
     * @return the path, or empty if the router is not in the tree
     */
    public Optional<String> getShortestPath(Ipv4Address routerId) {
        Optional<SPFVertex> destination = findVertex(VertexType.ROUTER, routerId, Ipv4Address.HOST_MASK);
        if (!destination.isPresent() || destination.get().getStatus() != SPFStatus.IN_SPFTREE) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder();
        SPFVertex vertex = destination.get();
        sb.insert(0, vertex.getVertexId());
        while (vertex.getHandle() != root) {
            SPFVertex previous = vertices.get(vertex.getParents().get(0));
            long length = vertex.getDistanceFromRoot() - previous.getDistanceFromRoot();
            sb.insert(0, " ->(" + length + ") ");
            sb.insert(0, previous.getVertexId());
            vertex = previous;
        }
        return Optional.of(sb.toString());
    }

    public Optional<SPFVertex> findVertex(VertexType type, Ipv4Address id, Ipv4Address mask) {
        Integer handle = vertexIndex.get(new VertexKey(type, id, mask));
        return handle == null ? Optional.<SPFVertex>empty() : Optional.of(vertices.get(handle));
    }

    public Optional<SPFVertex> getRoot() {
        return root < 0 ? Optional.<SPFVertex>empty() : Optional.of(vertices.get(root));
    }

    public SPFVertex getVertex(int handle) {
        return vertices.get(handle);
    }

    public List<SPFVertex> getVertices() {
        return Collections.unmodifiableList(vertices);
    }

    public int getNCandidates() {
        return candidates.size();
    }

    private static final class VertexKey {
        private final VertexType type;
        private final Ipv4Address id;
        private final Ipv4Address mask;

        private VertexKey(VertexType type, Ipv4Address id, Ipv4Address mask) {
            this.type = type;
            this.id = id;
            this.mask = mask;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof VertexKey)) {
                return false;
            }
            VertexKey other = (VertexKey) o;
            return type == other.type && id.equals(other.id) && mask.equals(other.mask);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * type.hashCode() + id.hashCode()) + mask.hashCode();
        }
    }
}
