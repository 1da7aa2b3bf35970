package socs.routing.node;

import socs.routing.util.Ipv4Address;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reports the routers whose discovery failed during a database build. The individual failures
 * are attached as suppressed exceptions. Advertisements of every other router were still built.
 */
public class TopologyDiscoveryException extends Exception {
    private static final long serialVersionUID = 1L;

    private final List<Ipv4Address> failedRouters;

    TopologyDiscoveryException(List<Ipv4Address> failedRouters, List<MalformedTopologyException> causes) {
        super("Topology discovery failed for " + failedRouters.size() + " router(s): " + failedRouters);
        this.failedRouters = Collections.unmodifiableList(new ArrayList<>(failedRouters));
        for (MalformedTopologyException cause : causes) {
            addSuppressed(cause);
        }
    }

    public List<Ipv4Address> getFailedRouters() {
        return failedRouters;
    }
}
