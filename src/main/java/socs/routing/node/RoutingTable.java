package socs.routing.node;

import socs.routing.node.RouteEntry.RouteSource;
import socs.routing.util.Ipv4Address;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * A node's forwarding table. Every entry remembers which source installed it so a source can
 * swap out its own routes without touching anyone else's.
 */
public class RoutingTable {
    private final List<RouteEntry> routes = new ArrayList<>();

    public void addRoute(RouteEntry entry) {
        routes.add(entry);
    }

    /**
     * Remove every route installed by the given source and install the new ones in its place.
     */
    public void replaceRoutes(RouteSource source, Collection<RouteEntry> entries) {
        for (RouteEntry entry : entries) {
            if (entry.getSource() != source) {
                throw new IllegalArgumentException("Route " + entry + " does not belong to source " + source);
            }
        }
        removeRoutes(source);
        routes.addAll(entries);
    }

    public void removeRoutes(RouteSource source) {
        Iterator<RouteEntry> it = routes.iterator();
        while (it.hasNext()) {
            if (it.next().getSource() == source) {
                it.remove();
            }
        }
    }

    public List<RouteEntry> getRoutes() {
        return Collections.unmodifiableList(routes);
    }

    public List<RouteEntry> getRoutes(RouteSource source) {
        List<RouteEntry> result = new ArrayList<>();
        for (RouteEntry entry : routes) {
            if (entry.getSource() == source) {
                result.add(entry);
            }
        }
        return result;
    }

    public int getNRoutes() {
        return routes.size();
    }

    /**
     * Longest prefix match; among equally long prefixes the lowest metric wins, then the earliest
     * installed entry.
     */
    public Optional<RouteEntry> lookup(Ipv4Address destination) {
        RouteEntry best = null;
        for (RouteEntry entry : routes) {
            if (!entry.matches(destination)) {
                continue;
            }
            if (best == null) {
                best = entry;
                continue;
            }
            int prefix = entry.getMask().prefixLength();
            int bestPrefix = best.getMask().prefixLength();
            if (prefix > bestPrefix || (prefix == bestPrefix && entry.getMetric() < best.getMetric())) {
                best = entry;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (RouteEntry entry : routes) {
            sb.append(entry).append("\n");
        }
        return sb.toString();
    }
}
