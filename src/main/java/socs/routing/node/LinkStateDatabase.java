package socs.routing.node;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import socs.routing.message.LinkRecord;
import socs.routing.message.RouterLSA;
import socs.routing.topology.Node;
import socs.routing.topology.NodeList;
import socs.routing.util.Ipv4Address;
import socs.routing.util.RouterConstants;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The advertisements of every router in the simulation, keyed by router id. The database is
 * rebuilt as a whole on each {@link #build(NodeList)}; advertisements it hands out stay valid
 * only until the next build.
 */
public class LinkStateDatabase {
    private final Log log = LogFactory.getLog(LinkStateDatabase.class);

    //linkStateID => LSA, ordered by router id
    private final TreeMap<Ipv4Address, RouterLSA> _store = new TreeMap<>();

    /**
     * Drop everything, then ask each router, in ascending node order, to discover its
     * advertisements and store them.
     * <p/>
     * A router whose discovery fails is left out; all other routers are still discovered and
     * stored before the failure is reported.
     *
     * @param nodes the nodes of the simulation
     * @throws TopologyDiscoveryException if one or more routers found a malformed channel
     */
    public void build(NodeList nodes) throws TopologyDiscoveryException {
        clear();
        List<Ipv4Address> failedRouters = new ArrayList<>();
        List<MalformedTopologyException> failures = new ArrayList<>();

        for (Node node : nodes) {
            Optional<RouterAgent> agent = node.getRouterAgent();
            if (!agent.isPresent()) {
                continue;
            }
            RouterAgent router = agent.get();
            try {
                int nLSAs = router.discoverLSAs();
                for (int i = 0; i < nLSAs; i++) {
                    Optional<RouterLSA> lsa = router.getLSA(i);
                    if (lsa.isPresent()) {
                        insert(lsa.get());
                    }
                }
            } catch (MalformedTopologyException e) {
                log.error("[" + RouterConstants.LSDB_STRING + "] Discovery failed for router " +
                        router.getRouterId() + " on " + node + ". Its advertisement is left out of the database.");
                failedRouters.add(router.getRouterId());
                failures.add(e);
            }
        }

        log.info("[" + RouterConstants.LSDB_STRING + "] Built link state database with " + _store.size() +
                " advertisement(s).");
        if (!failedRouters.isEmpty()) {
            throw new TopologyDiscoveryException(failedRouters, failures);
        }
    }

    /**
     * Store an advertisement under its link state id, replacing any previous one for that router.
     */
    void insert(RouterLSA lsa) {
        _store.put(lsa.getLinkStateId(), lsa);
    }

    /**
     * @param routerId the router to look for
     * @return the router's advertisement, or empty if it has none
     */
    public Optional<RouterLSA> lookup(Ipv4Address routerId) {
        return Optional.ofNullable(_store.get(routerId));
    }

    public void clear() {
        _store.clear();
    }

    /**
     * Mark every advertisement as unexplored before a new shortest path computation.
     */
    void resetStatus() {
        for (RouterLSA lsa : _store.values()) {
            lsa.setStatus(RouterLSA.SPFStatus.NOT_EXPLORED);
        }
    }

    public int size() {
        return _store.size();
    }

    public boolean isEmpty() {
        return _store.isEmpty();
    }

    public Set<Ipv4Address> getRouterIds() {
        return Collections.unmodifiableSet(_store.keySet());
    }

    public Collection<RouterLSA> getLSAs() {
        return Collections.unmodifiableCollection(_store.values());
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (RouterLSA lsa : _store.values()) {
            sb.append(lsa.getLinkStateId()).append("(").append(lsa.getStatus()).append(")").append(":\t");
            for (LinkRecord record : lsa.getLinkRecords()) {
                sb.append(record.getLinkType()).append(",").append(record.getLinkId()).append(",").
                        append(record.getLinkData()).append(",").append(record.getMetric()).append("\t");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
