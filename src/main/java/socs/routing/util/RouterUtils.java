package socs.routing.util;


public class RouterUtils {

    private RouterUtils() {
    }

    /**
     * @param metric the metric to check
     * @return the metric, if it fits in an unsigned 32 bit field
     * @throws IllegalArgumentException otherwise
     */
    public static long checkMetric(long metric) {
        if (metric < RouterConstants.MIN_METRIC || metric > RouterConstants.MAX_METRIC) {
            throw new IllegalArgumentException("Metric must be between " + RouterConstants.MIN_METRIC +
                    "-" + RouterConstants.MAX_METRIC + ", was " + metric);
        }
        return metric;
    }

    /**
     * Adds a link metric to an accumulated distance.
     *
     * @return the sum, or -1 if it no longer fits in an unsigned 32 bit field
     */
    public static long addMetrics(long distance, long metric) {
        long sum = distance + metric;
        if (sum > RouterConstants.MAX_METRIC) {
            return -1;
        }
        return sum;
    }

    /**
     * @param metric the configured metric, or {@link RouterConstants#METRIC_UNSET}
     * @param defaultMetric the metric to use when none was configured
     */
    public static long metricOrDefault(long metric, long defaultMetric) {
        if (metric == RouterConstants.METRIC_UNSET) {
            return defaultMetric;
        }
        return metric;
    }
}
