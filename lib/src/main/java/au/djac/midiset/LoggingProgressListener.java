package au.djac.midiset;
import au.djac.midiset.archive.Archive;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default progress indicator: one log line per finished archive, showing how far through the
 * run it is.
 */
public class LoggingProgressListener implements ProgressListener
{
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private int total = 0;
    private int finished = 0;

    @Override
    public void runStarted(int totalArchives, int alreadyFinished)
    {
        total = totalArchives;
        finished = alreadyFinished;
        if(alreadyFinished == 0)
        {
            log.info("Extracting MIDI files from {} archive(s)", totalArchives);
        }
        else
        {
            log.info("Extracting MIDI files from {} archive(s) ({} unreadable, skipped)",
                     totalArchives, alreadyFinished);
        }
    }

    @Override
    public void archiveStarted(Archive archive)
    {
        log.debug("Started {} archive '{}'", archive.getFormat(), archive.getPath());
    }

    @Override
    public void archiveFinished(ArchiveResult result, RunStats stats)
    {
        finished++;
        var prefix = String.format("[%d/%d %3d%%]", finished, total, (total == 0) ? 100 : finished * 100 / total);
        var group = result.getArchive().getGroup();
        switch(result.getStatus())
        {
            case OK:
                log.info("{} {}: {} MIDI file(s), {}",
                         prefix, group, result.getRecords().size(),
                         FileUtils.byteCountToDisplaySize(result.getTotalBytes()));
                break;

            case FAILED:
                log.info("{} {}: failed", prefix, group);
                break;

            case CANCELLED:
                log.info("{} {}: cancelled", prefix, group);
                break;
        }
    }

    @Override
    public void runFinished(RunStats stats)
    {
        log.info("Done: {} archive(s) processed, {} failed, {} MIDI file(s), {}",
                 stats.getArchivesProcessed(),
                 stats.getArchivesFailed(),
                 stats.getFilesExtracted(),
                 FileUtils.byteCountToDisplaySize(stats.getBytesWritten()));
    }
}
