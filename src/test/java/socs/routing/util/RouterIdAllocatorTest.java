package socs.routing.util;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class RouterIdAllocatorTest {

    @Test
    public void allocatesIncreasingIds() {
        RouterIdAllocator allocator = RouterIdAllocator.getInstance();
        Ipv4Address first = allocator.allocateRouterId();
        Ipv4Address second = allocator.allocateRouterId();
        assertEquals(first.next(), second);
        assertTrue(first.compareTo(allocator.getBase()) >= 0);
    }

    @Test
    public void resetRestartsAtBase() {
        RouterIdAllocator allocator = RouterIdAllocator.getInstance();
        allocator.allocateRouterId();
        allocator.reset();
        assertEquals(Ipv4Address.parse("0.0.0.1"), allocator.allocateRouterId());
    }
}
