package socs.routing.node;

import socs.routing.topology.Channel;

/**
 * Raised when a point-to-point channel does not join exactly two interfaces.
 */
public class MalformedTopologyException extends Exception {
    private static final long serialVersionUID = 1L;

    private final transient Channel channel;

    public MalformedTopologyException(Channel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }
}
