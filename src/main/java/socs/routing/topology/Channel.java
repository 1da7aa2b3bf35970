package socs.routing.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A point-to-point channel between router interfaces. The channel records whatever attaches
 * to it; checking that exactly two devices share it is left to topology discovery.
 */
public class Channel {
    private final String name;
    private final List<NetDevice> devices = new ArrayList<>();

    public Channel(String name) {
        this.name = name;
    }

    /**
     * Attach a device to this channel. The device must not already sit on another channel.
     */
    public void attach(NetDevice device) {
        if (device.getChannel() != null) {
            throw new IllegalStateException("Device " + device + " is already attached to channel " +
                    device.getChannel().getName());
        }
        devices.add(device);
        device.setChannel(this);
    }

    public String getName() {
        return name;
    }

    public int getNDevices() {
        return devices.size();
    }

    public NetDevice getDevice(int n) {
        return devices.get(n);
    }

    public List<NetDevice> getDevices() {
        return Collections.unmodifiableList(devices);
    }

    @Override
    public String toString() {
        return "Channel[" + name + "]";
    }
}
