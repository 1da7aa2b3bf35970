package socs.routing.node;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import socs.routing.node.RouteEntry.RouteSource;
import socs.routing.topology.Node;
import socs.routing.topology.NodeList;
import socs.routing.util.RouterConstants;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Computes routes for a whole simulation at once. It gathers the advertisements of every router
 * into a link state database, runs a shortest path calculation rooted at each router and
 * installs the result in that router's forwarding table.
 * <p/>
 * Modelled on OSPFv2 (RFC 2328 16.1). Everything runs on the caller's thread.
 */
public class RouteManager {
    private final Log log = LogFactory.getLog(RouteManager.class);

    private final NodeList nodes;
    private final LinkStateDatabase lsdb = new LinkStateDatabase();

    public RouteManager(NodeList nodes) {
        this.nodes = nodes;
    }

    /**
     * Rebuild the link state database from the current topology.
     *
     * @throws TopologyDiscoveryException if some routers could not be discovered; the database
     *                                    still holds every other router
     */
    public void buildRoutingDatabase() throws TopologyDiscoveryException {
        lsdb.build(nodes);
    }

    /**
     * Replace the routes this manager installed on every router with freshly computed ones.
     * Called before {@link #buildRoutingDatabase()} this leaves every router without global routes.
     */
    public void initializeRoutes() {
        SPFCalculator calculator = new SPFCalculator(lsdb);
        int nRoutes = 0;
        int nRouters = 0;

        for (Node node : nodes) {
            Optional<RouterAgent> agent = node.getRouterAgent();
            if (!agent.isPresent()) {
                continue;
            }
            nRouters++;
            List<RouteEntry> entries = Collections.emptyList();
            if (calculator.compute(agent.get())) {
                entries = calculator.getRouteEntries();
            }
            node.getRoutingTable().replaceRoutes(RouteSource.GLOBAL, entries);
            nRoutes += entries.size();

            if (log.isDebugEnabled()) {
                log.debug("[" + RouterConstants.ROUTES_STRING + "] Router " + agent.get().getRouterId() + " on " +
                        node + " got " + entries.size() + " route(s).");
            }
        }
        log.info("[" + RouterConstants.ROUTES_STRING + "] Installed " + nRoutes + " route(s) on " + nRouters +
                " router(s).");
    }

    public LinkStateDatabase getLinkStateDatabase() {
        return lsdb;
    }

    /**
     * Dump every router's global routes, for diagnostics.
     */
    public String printRoutingTables() {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            Optional<RouterAgent> agent = node.getRouterAgent();
            if (!agent.isPresent()) {
                continue;
            }
            sb.append("-------------------------------------------\n");
            sb.append("    ROUTER: ").append(agent.get().getRouterId()).append(" (").append(node).append(")\n");
            for (RouteEntry entry : node.getRoutingTable().getRoutes(RouteSource.GLOBAL)) {
                sb.append("    ").append(entry).append("\n");
            }
        }
        sb.append("-------------------------------------------\n");
        return sb.toString();
    }
}
