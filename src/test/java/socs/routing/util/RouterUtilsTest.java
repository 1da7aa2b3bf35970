package socs.routing.util;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class RouterUtilsTest {

    @Test
    public void addsWithinRange() {
        assertEquals(RouterConstants.MAX_METRIC, RouterUtils.addMetrics(RouterConstants.MAX_METRIC - 3, 3));
    }

    @Test
    public void reportsOverflow() {
        assertEquals(-1, RouterUtils.addMetrics(RouterConstants.MAX_METRIC, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeMetric() {
        RouterUtils.checkMetric(-2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMetricWiderThan32Bits() {
        RouterUtils.checkMetric(RouterConstants.MAX_METRIC + 1);
    }

    @Test
    public void unsetMetricFallsBackToDefault() {
        assertEquals(7, RouterUtils.metricOrDefault(RouterConstants.METRIC_UNSET, 7));
        assertEquals(0, RouterUtils.metricOrDefault(0, 7));
    }
}
