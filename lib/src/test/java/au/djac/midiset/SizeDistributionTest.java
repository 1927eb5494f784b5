package au.djac.midiset;

import static org.assertj.core.api.Assertions.assertThat;

import au.djac.midiset.SizeDistribution.Bucket;

import org.junit.jupiter.api.Test;

class SizeDistributionTest
{
    @Test
    void forSize_usesExclusiveUpperLimits()
    {
        assertThat(Bucket.forSize(0)).isEqualTo(Bucket.UNDER_1KB);
        assertThat(Bucket.forSize(1023)).isEqualTo(Bucket.UNDER_1KB);
        assertThat(Bucket.forSize(1024)).isEqualTo(Bucket.UNDER_10KB);
        assertThat(Bucket.forSize(100 * 1024 - 1)).isEqualTo(Bucket.UNDER_100KB);
        assertThat(Bucket.forSize(1024 * 1024 - 1)).isEqualTo(Bucket.UNDER_1MB);
        assertThat(Bucket.forSize(1024 * 1024)).isEqualTo(Bucket.OVER_1MB);
    }

    @Test
    void add_tracksCountsAndExtremes()
    {
        var dist = new SizeDistribution();
        dist.add(100);
        dist.add(200);
        dist.add(5000);
        dist.add(2_000_000);

        assertThat(dist.getCount()).isEqualTo(4);
        assertThat(dist.getCount(Bucket.UNDER_1KB)).isEqualTo(2);
        assertThat(dist.getCount(Bucket.UNDER_10KB)).isEqualTo(1);
        assertThat(dist.getCount(Bucket.UNDER_100KB)).isZero();
        assertThat(dist.getCount(Bucket.OVER_1MB)).isEqualTo(1);
        assertThat(dist.getTotal()).isEqualTo(2_005_300);
        assertThat(dist.getMin()).isEqualTo(100);
        assertThat(dist.getMax()).isEqualTo(2_000_000);
        assertThat(dist.getAverage()).isEqualTo(501_325);
    }

    @Test
    void render_listsNonEmptyBucketsLargestFirst()
    {
        var dist = new SizeDistribution();
        dist.add(10);
        dist.add(20);
        dist.add(30);
        dist.add(2048);

        var lines = dist.render();

        assertThat(lines.get(0)).startsWith("  < 1KB").contains("3 files").endsWith("#".repeat(40));
        assertThat(lines.get(1)).startsWith("  1KB - 10KB").contains("1 files").endsWith(" " + "#".repeat(13));
        assertThat(lines).noneMatch(l -> l.contains("> 1MB"));
        assertThat(lines).anyMatch(l -> l.startsWith("  Largest file : 2 KB"));
        assertThat(lines).anyMatch(l -> l.startsWith("  Smallest file: 10 bytes"));
    }

    @Test
    void render_isEmptyWithoutData()
    {
        assertThat(new SizeDistribution().render()).isEmpty();
        assertThat(new SizeDistribution().getMin()).isZero();
    }
}
