package au.djac.midiset;
import au.djac.midiset.archive.*;
import au.djac.midiset.parquet.PartitionedParquetWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one extraction over a list of discovered archives. Here's an outline of how it goes:
 *
 *  run()
 *  |
 *  +-- [one worker per archive at a time; or the calling thread, if jobs == 1]
 *  |   extract()
 *  |   |
 *  |   +-- ArchiveReader.read()
 *  |       [TarGzReader or ZipReader]
 *  |       |
 *  |       +-- MidiFileMatcher.matches()
 *  |
 *  +-- [calling thread only, via the result queue]
 *      accept()
 *      |
 *      +-- PartitionedParquetWriter.write()
 *
 * The calling thread is the only one that touches the writer. Workers hand over one complete
 * batch per archive through a bounded queue, and block when the writer falls behind.
 */
class ExtractionOperation
{
    private static final Logger log = LoggerFactory.getLogger(ExtractionOperation.class);

    private final MidiSet options;
    private final PartitionedParquetWriter writer;
    private final RunStats stats;
    private final ProgressListener progress;
    private final MidiFileMatcher matcher = new MidiFileMatcher();

    ExtractionOperation(MidiSet options, PartitionedParquetWriter writer, RunStats stats)
    {
        this.options = options;
        this.writer = writer;
        this.stats = stats;
        this.progress = options.progressListener();
    }

    /**
     * @param archives         The archives to read.
     * @param skippedArchives  Archives found but already skipped during discovery (and recorded in
     *                         the statistics as failed); these count towards the progress total.
     */
    void run(List<Archive> archives, int skippedArchives)
    {
        progress.runStarted(archives.size() + skippedArchives, skippedArchives);
        if(options.jobs() <= 1 || archives.size() <= 1)
        {
            runSequential(archives);
        }
        else
        {
            runParallel(archives);
        }
        progress.runFinished(stats);
    }

    private void runSequential(List<Archive> archives)
    {
        for(var archive : archives)
        {
            accept(options.cancelRequested() ? ArchiveResult.cancelled(archive) : extract(archive));
        }
    }

    /**
     * What a worker hands back for one archive: a result or, if the worker itself broke (an
     * Error, or an exception from a progress listener), the throwable to rethrow on the calling
     * thread.
     */
    private static final class Handover
    {
        private final ArchiveResult result;
        private final Throwable fatal;

        Handover(ArchiveResult result, Throwable fatal)
        {
            this.result = result;
            this.fatal = fatal;
        }
    }

    private void runParallel(List<Archive> archives)
    {
        int nThreads = Math.min(options.jobs(), archives.size());
        var handovers = new ArrayBlockingQueue<Handover>(options.queueCapacity());
        var threadCount = new AtomicInteger();
        var pool = Executors.newFixedThreadPool(nThreads, runnable ->
        {
            var thread = new Thread(runnable, "midiset-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.debug("Reading {} archive(s) with {} worker(s), queue capacity {}",
                  archives.size(), nThreads, options.queueCapacity());

        try
        {
            for(var archive : archives)
            {
                pool.execute(() ->
                {
                    Handover handover;
                    try
                    {
                        handover = new Handover(
                            options.cancelRequested() ? ArchiveResult.cancelled(archive) : extract(archive),
                            null);
                    }
                    catch(Throwable t)
                    {
                        // Every task must hand something over, or the calling thread waits forever.
                        handover = new Handover(null, t);
                    }

                    try
                    {
                        handovers.put(handover);
                    }
                    catch(InterruptedException e)
                    {
                        // Only happens when the pool is shut down early; nobody is waiting for it.
                        log.atDebug().setCause(e).log("Dropped result for '{}'", archive.getPath());
                        Thread.currentThread().interrupt();
                    }
                });
            }

            for(int i = 0; i < archives.size(); i++)
            {
                var handover = handovers.take();
                if(handover.fatal != null)
                {
                    rethrow(handover.fatal);
                }
                accept(handover.result);
            }
        }
        catch(InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted while waiting for archives", stats);
        }
        finally
        {
            pool.shutdownNow();
        }
    }

    private static void rethrow(Throwable fatal)
    {
        if(fatal instanceof Error)
        {
            throw (Error) fatal;
        }
        if(fatal instanceof RuntimeException)
        {
            throw (RuntimeException) fatal;
        }
        throw new MidiSetException("Worker thread failed: " + fatal, fatal);
    }

    /**
     * Reads one archive completely into memory. Runs on a worker thread (or the calling thread,
     * if sequential). Any problem with the archive becomes a failed result; Errors, and exceptions
     * from the progress listener, propagate.
     */
    private ArchiveResult extract(Archive archive)
    {
        progress.archiveStarted(archive);
        var records = new ArrayList<OutputRecord>();
        try
        {
            options.readerFor(archive.getFormat()).read(
                archive,
                matcher::matches,
                (memberName, content) ->
                    records.add(new OutputRecord(archive.getGroup(), memberName, content)),
                this::memberUnreadable);

            return ArchiveResult.ok(archive, records);
        }
        catch(ArchiveUnreadableException e)
        {
            return ArchiveResult.failed(e);
        }
        catch(RuntimeException e)
        {
            // A library bug or unexpected format quirk in one archive shouldn't take the run down.
            return ArchiveResult.failed(new ArchiveUnreadableException(
                archive,
                String.format("Unexpected error reading '%s': %s", archive.getPath(), e),
                e));
        }
    }

    private void memberUnreadable(Archive archive, String memberName, String msg, Exception ex)
    {
        if(ex == null)
        {
            log.warn(msg);
        }
        else
        {
            log.atWarn().setCause(ex).log(msg);
        }
        stats.memberSkipped(archive.getPath(), memberName, msg, ex);
    }

    /**
     * Hands one archive's result to the writer and the statistics. Runs on the calling thread
     * only.
     */
    private void accept(ArchiveResult result)
    {
        switch(result.getStatus())
        {
            case OK:
                writer.write(result.getRecords());
                for(var record : result.getRecords())
                {
                    stats.recordWritten(record);
                }
                stats.archiveSucceeded(result.getRecords().size());
                break;

            case FAILED:
                var failure = result.getFailure();
                log.atWarn().setCause(failure.getCause()).log(failure.getMessage());
                stats.archiveFailed(result.getArchive().getPath(), failure.getMessage(), failure);
                break;

            case CANCELLED:
                stats.archiveCancelled();
                break;
        }
        progress.archiveFinished(result, stats);
    }
}
