package socs.routing.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The nodes of one simulation, iterated in ascending index order.
 */
public class NodeList implements Iterable<Node> {
    private final List<Node> nodes = new ArrayList<>();

    public Node create() {
        Node node = new Node(nodes.size());
        nodes.add(node);
        return node;
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public Iterator<Node> iterator() {
        return Collections.unmodifiableList(nodes).iterator();
    }
}
