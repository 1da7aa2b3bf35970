package socs.routing.node;

import socs.routing.topology.Channel;
import socs.routing.topology.NetDevice;
import socs.routing.topology.Node;
import socs.routing.topology.NodeList;
import socs.routing.util.Configuration;
import socs.routing.util.Ipv4Address;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Builds the topologies shared by the routing tests.
 */
final class Topologies {
    static final Ipv4Address MASK_24 = Ipv4Address.maskOf(24);

    private Topologies() {
    }

    static RouterAgent router(NodeList nodes) {
        return RouterAgent.install(nodes.create(), Configuration.load());
    }

    static List<RouterAgent> routers(NodeList nodes, int count) {
        List<RouterAgent> agents = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            agents.add(router(nodes));
        }
        return agents;
    }

    /**
     * Join two nodes with a point-to-point channel on subnet "prefix.0/24"; the first node gets
     * host 1, the second host 2.
     */
    static Channel link(Node a, Node b, String prefix, long metricA, long metricB) {
        Channel channel = new Channel(prefix + ".0/24");
        NetDevice deviceA = a.addDevice(Ipv4Address.parse(prefix + ".1"), MASK_24).setMetric(metricA);
        NetDevice deviceB = b.addDevice(Ipv4Address.parse(prefix + ".2"), MASK_24).setMetric(metricB);
        channel.attach(deviceA);
        channel.attach(deviceB);
        return channel;
    }

    static Channel link(RouterAgent a, RouterAgent b, String prefix, long metric) {
        return link(a.getNode(), b.getNode(), prefix, metric, metric);
    }

    static NetDevice stub(RouterAgent router, String address, int prefixLength) {
        return router.getNode().addDevice(Ipv4Address.parse(address), Ipv4Address.maskOf(prefixLength));
    }

    /**
     * Routers in a line, each joined to the next with the given metric on subnet 10.1.(i+1).0/24.
     */
    static List<RouterAgent> line(NodeList nodes, int count, long metric) {
        List<RouterAgent> agents = routers(nodes, count);
        for (int i = 0; i + 1 < count; i++) {
            link(agents.get(i), agents.get(i + 1), "10.1." + (i + 1), metric);
        }
        return agents;
    }

    /**
     * A channel shared by three routers, which no point-to-point channel may be.
     */
    static Channel threeWayChannel(RouterAgent a, RouterAgent b, RouterAgent c) {
        Channel channel = new Channel("broken");
        channel.attach(a.getNode().addDevice(Ipv4Address.parse("10.9.9.1"), MASK_24));
        channel.attach(b.getNode().addDevice(Ipv4Address.parse("10.9.9.2"), MASK_24));
        channel.attach(c.getNode().addDevice(Ipv4Address.parse("10.9.9.3"), MASK_24));
        return channel;
    }

    /**
     * A random connected graph: a random spanning tree plus extra links, each direction with its
     * own metric between 1 and 10.
     *
     * @return metric[i][j] of the link from router i to router j, or -1 where there is none
     */
    static long[][] randomConnected(NodeList nodes, List<RouterAgent> agents, int count, int extraLinks, long seed) {
        Random random = new Random(seed);
        agents.addAll(routers(nodes, count));
        long[][] metric = new long[count][count];
        for (long[] row : metric) {
            Arrays.fill(row, -1);
        }
        Set<Long> used = new HashSet<>();
        int subnet = 0;
        for (int i = 1; i < count; i++) {
            int j = random.nextInt(i);
            subnet = addRandomLink(agents, metric, used, random, i, j, subnet);
        }
        int attempts = 0;
        while (extraLinks > 0 && attempts++ < 1000) {
            int i = random.nextInt(count);
            int j = random.nextInt(count);
            if (i == j || used.contains(pairKey(i, j))) {
                continue;
            }
            subnet = addRandomLink(agents, metric, used, random, i, j, subnet);
            extraLinks--;
        }
        return metric;
    }

    private static int addRandomLink(List<RouterAgent> agents, long[][] metric, Set<Long> used, Random random,
                                     int i, int j, int subnet) {
        long metricIJ = 1 + random.nextInt(10);
        long metricJI = 1 + random.nextInt(10);
        subnet++;
        link(agents.get(i).getNode(), agents.get(j).getNode(), "10." + (subnet / 256) + "." + (subnet % 256),
                metricIJ, metricJI);
        metric[i][j] = metricIJ;
        metric[j][i] = metricJI;
        used.add(pairKey(i, j));
        return subnet;
    }

    private static long pairKey(int i, int j) {
        return ((long) Math.min(i, j) << 32) | Math.max(i, j);
    }

    /**
     * Floyd-Warshall over a metric matrix, -1 meaning no link.
     */
    static long[][] allPairs(long[][] metric) {
        int n = metric.length;
        long[][] dist = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                dist[i][j] = i == j ? 0 : (metric[i][j] < 0 ? Long.MAX_VALUE : metric[i][j]);
            }
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (dist[i][k] != Long.MAX_VALUE && dist[k][j] != Long.MAX_VALUE &&
                            dist[i][k] + dist[k][j] < dist[i][j]) {
                        dist[i][j] = dist[i][k] + dist[k][j];
                    }
                }
            }
        }
        return dist;
    }
}
