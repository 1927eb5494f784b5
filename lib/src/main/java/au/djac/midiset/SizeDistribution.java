package au.djac.midiset;

import org.apache.commons.io.FileUtils;

import java.util.*;

/**
 * Tallies extracted file sizes into a handful of fixed buckets, and renders them as a text bar
 * chart for the end-of-run summary.
 */
public class SizeDistribution
{
    public enum Bucket
    {
        UNDER_1KB    ("< 1KB",        1024L),
        UNDER_10KB   ("1KB - 10KB",   10L * 1024),
        UNDER_100KB  ("10KB - 100KB", 100L * 1024),
        UNDER_1MB    ("100KB - 1MB",  1024L * 1024),
        OVER_1MB     ("> 1MB",        Long.MAX_VALUE);

        private final String label;
        private final long limit; // exclusive

        Bucket(String label, long limit)
        {
            this.label = label;
            this.limit = limit;
        }

        public String getLabel() { return label; }

        public static Bucket forSize(long size)
        {
            for(var bucket : values())
            {
                if(size < bucket.limit)
                {
                    return bucket;
                }
            }
            return OVER_1MB;
        }
    }

    private static final int BAR_WIDTH = 40;

    private final long[] counts = new long[Bucket.values().length];
    private long count = 0;
    private long total = 0;
    private long min = Long.MAX_VALUE;
    private long max = 0;

    public synchronized void add(long size)
    {
        counts[Bucket.forSize(size).ordinal()]++;
        count++;
        total += size;
        min = Math.min(min, size);
        max = Math.max(max, size);
    }

    public synchronized long getCount(Bucket bucket) { return counts[bucket.ordinal()]; }
    public synchronized long getCount()              { return count; }
    public synchronized long getTotal()              { return total; }
    public synchronized long getMin()                { return (count == 0) ? 0 : min; }
    public synchronized long getMax()                { return max; }
    public synchronized long getAverage()            { return (count == 0) ? 0 : total / count; }

    /**
     * Renders the distribution, most populous bucket first, followed by overall size figures.
     * Empty buckets are left out.
     *
     * @return The lines of the chart, or an empty list if nothing was added.
     */
    public synchronized List<String> render()
    {
        var lines = new ArrayList<String>();
        if(count == 0)
        {
            return lines;
        }

        var buckets = new ArrayList<>(Arrays.asList(Bucket.values()));
        buckets.removeIf(b -> counts[b.ordinal()] == 0);
        buckets.sort(Comparator.comparingLong((Bucket b) -> counts[b.ordinal()]).reversed());

        long largest = counts[buckets.get(0).ordinal()];
        for(var bucket : buckets)
        {
            long n = counts[bucket.ordinal()];
            int barLength = (int) Math.max(1, n * BAR_WIDTH / largest);
            lines.add(String.format("  %-12s : %,8d files (%5.1f%%) %s",
                                    bucket.getLabel(),
                                    n,
                                    100.0 * n / count,
                                    "#".repeat(barLength)));
        }

        lines.add(String.format("  Total size   : %s", FileUtils.byteCountToDisplaySize(total)));
        lines.add(String.format("  Average size : %s", FileUtils.byteCountToDisplaySize(getAverage())));
        lines.add(String.format("  Largest file : %s", FileUtils.byteCountToDisplaySize(max)));
        lines.add(String.format("  Smallest file: %s", FileUtils.byteCountToDisplaySize(getMin())));
        return lines;
    }
}
