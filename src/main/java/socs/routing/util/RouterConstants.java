package socs.routing.util;


public class RouterConstants {
    public static final String ROUTER_ID_BASE_KEY = "socs.routing.router-id.base";
    public static final String INTERFACE_DEFAULT_METRIC_KEY = "socs.routing.interface.default-metric";
    public static final String STUB_DEFAULT_METRIC_KEY = "socs.routing.stub.default-metric";

    // metrics and distances are unsigned 32 bit quantities
    public static final long MIN_METRIC = 0;
    public static final long MAX_METRIC = 0xFFFFFFFFL;
    public static final long METRIC_UNSET = -1;

    public static final Ipv4Address ON_LINK = Ipv4Address.ANY;

    public static final String DISCOVER_STRING = "DISCOVER";
    public static final String LSDB_STRING = "LSDB";
    public static final String SPF_STRING = "SPF";
    public static final String ROUTES_STRING = "ROUTES";
}
