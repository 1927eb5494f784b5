package au.djac.midiset;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.*;

class RunStatsTest
{
    @Test
    void counters_distinguishProcessedFailedAndEmptyArchives()
    {
        var stats = new RunStats();
        stats.archivesDiscovered(4);
        stats.recordWritten(new OutputRecord("a", "1.mid", new byte[10]));
        stats.recordWritten(new OutputRecord("a", "2.mid", new byte[20]));
        stats.archiveSucceeded(2);
        stats.archiveSucceeded(0);
        stats.archiveFailed(Path.of("bad.zip"), "corrupt", new IOException("corrupt"));
        stats.archiveCancelled();
        stats.memberSkipped(Path.of("c.zip"), "x.mid", "encrypted", null);

        assertThat(stats.getArchivesDiscovered()).isEqualTo(4);
        assertThat(stats.getArchivesSeen()).isEqualTo(3);
        assertThat(stats.getArchivesProcessed()).isEqualTo(2);
        assertThat(stats.getArchivesFailed()).isEqualTo(1);
        assertThat(stats.getArchivesWithoutMidi()).isEqualTo(1);
        assertThat(stats.getArchivesCancelled()).isEqualTo(1);
        assertThat(stats.getFilesExtracted()).isEqualTo(2);
        assertThat(stats.getBytesWritten()).isEqualTo(30);
        assertThat(stats.getMembersSkipped()).isEqualTo(1);
        assertThat(stats.getGroups().get("a").getFiles()).isEqualTo(2);
        assertThat(stats.getGroups().get("a").getBytes()).isEqualTo(30);
        assertThat(stats.getFailures()).extracting(RunStats.Failure::getMemberName)
                                       .containsExactly(null, "x.mid");
    }

    @Test
    void recordWritten_isSafeUnderConcurrentUpdates() throws Exception
    {
        var stats = new RunStats();
        var pool = Executors.newFixedThreadPool(8);
        try
        {
            var tasks = new ArrayList<Callable<Void>>();
            for(int t = 0; t < 8; t++)
            {
                var group = "g" + (t % 2);
                tasks.add(() ->
                {
                    for(int i = 0; i < 1000; i++)
                    {
                        stats.recordWritten(new OutputRecord(group, i + ".mid", new byte[3]));
                    }
                    return null;
                });
            }
            for(var future : pool.invokeAll(tasks))
            {
                future.get();
            }
        }
        finally
        {
            pool.shutdown();
        }

        assertThat(stats.getFilesExtracted()).isEqualTo(8000);
        assertThat(stats.getBytesWritten()).isEqualTo(24_000);
        assertThat(stats.getGroups().get("g0").getFiles()).isEqualTo(4000);
        assertThat(stats.getSizes().getCount()).isEqualTo(8000);
    }

    @Test
    void summary_listsGroupsByFileCountAndOptionalHistogram()
    {
        var stats = new RunStats();
        stats.recordWritten(new OutputRecord("small", "1.mid", new byte[5]));
        stats.recordWritten(new OutputRecord("big", "1.mid", new byte[5]));
        stats.recordWritten(new OutputRecord("big", "2.mid", new byte[5]));

        var withChart = stats.summary(true);
        var withoutChart = stats.summary(false);

        assertThat(withChart).contains("MIDI file size distribution:");
        assertThat(withoutChart).doesNotContain("MIDI file size distribution:");
        assertThat(withoutChart).contains("MIDI files extracted  : 3");
        int big = withoutChart.indexOf("  big: 2 files, 10 bytes");
        int small = withoutChart.indexOf("  small: 1 files, 5 bytes");
        assertThat(big).isPositive().isLessThan(small);
    }
}
