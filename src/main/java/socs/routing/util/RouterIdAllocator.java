package socs.routing.util;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Hands out router identities, one per router agent, starting at the configured base and
 * incrementing with each allocation. Identities are never reused until {@link #reset()}.
 */
public class RouterIdAllocator {
    private static final Log log = LogFactory.getLog(RouterIdAllocator.class);
    private static RouterIdAllocator routerIdAllocator;

    private final Ipv4Address base;
    private Ipv4Address nextRouterId;

    private RouterIdAllocator(Ipv4Address base) {
        this.base = base;
        this.nextRouterId = base;
    }

    public static synchronized RouterIdAllocator getInstance() {
        if (routerIdAllocator == null) {
            Configuration config = Configuration.load();
            routerIdAllocator = new RouterIdAllocator(config.getAddress(RouterConstants.ROUTER_ID_BASE_KEY));
        }
        return routerIdAllocator;
    }

    public synchronized Ipv4Address allocateRouterId() {
        Ipv4Address routerId = nextRouterId;
        nextRouterId = nextRouterId.next();
        if (log.isDebugEnabled()) {
            log.debug("Allocated router id " + routerId);
        }
        return routerId;
    }

    /**
     * Start again from the base. Only safe when no router agent from the previous run is still in use.
     */
    public synchronized void reset() {
        log.info("Router id allocation restarted at " + base);
        nextRouterId = base;
    }

    public Ipv4Address getBase() {
        return base;
    }
}
