package au.djac.midiset;
import au.djac.midiset.archive.*;
import au.djac.midiset.parquet.PartitionedParquetWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point into the midiset library, providing various option-setting methods, and the
 * extract() method that performs the actual task: find the .tar.gz/.tgz/.zip archives in a
 * directory, pull out every MIDI file inside them, and write the lot to a Parquet dataset
 * partitioned by archive name.
 *
 * <pre>
 * RunStats stats = new MidiSet()
 *     .jobs(8)
 *     .overwrite(true)
 *     .extract(Path.of("~/data/midiset"), Path.of("~/data/midiset.parquet"));
 * </pre>
 */
public class MidiSet
{
    private static final Logger log = LoggerFactory.getLogger(MidiSet.class);

    private int _jobs = Runtime.getRuntime().availableProcessors();
    private int _queueCapacity = 0;
    private boolean _recursive = false;
    private boolean _overwrite = false;
    private int _compressionLevel = PartitionedParquetWriter.MAX_ZSTD_LEVEL;
    private ProgressListener _progressListener = new LoggingProgressListener();
    private Set<ArchiveReader> _readers = null;
    private Map<ArchiveFormat,ArchiveReader> _readerMap = null;

    private volatile boolean _cancelRequested = false;

    public MidiSet() {}

    /**
     * Extracts all MIDI files from the archives directly inside {@code inputDir} (or anywhere
     * beneath it, if {@link #recursive(boolean)} is set), and writes them to a new dataset at
     * {@code outputPath}.
     *
     * <p>Archives that cannot be read are skipped, and reported in the returned statistics. Any
     * other problem is fatal, and leaves nothing at {@code outputPath} (or the previous output
     * untouched, when overwriting).
     *
     * @param inputDir   The directory containing the archives.
     * @param outputPath Where the Parquet dataset (a directory) will be created.
     * @return Statistics for the run.
     * @throws InputNotFoundException     If {@code inputDir} is missing or unreadable.
     * @throws OutputConflictException    If {@code outputPath} exists (and overwriting is off), or
     *                                    cannot be written.
     * @throws NoArchivesFoundException   If there are no archives to read.
     * @throws NoMidiFilesFoundException  If the archives contain no MIDI files at all.
     * @throws WriteFailureException      If writing the dataset fails.
     * @throws RunCancelledException      If {@link #cancel()} is called during the run.
     */
    public RunStats extract(Path inputDir, Path outputPath)
    {
        _cancelRequested = false;
        var stats = new RunStats();

        ArchiveDiscoverer.checkInputDirectory(inputDir);

        try(var writer = new PartitionedParquetWriter(outputPath, _overwrite, _compressionLevel))
        {
            // Fail on an unusable destination before spending any time on the archives.
            writer.open();

            var skipped = new AtomicInteger();
            var archives = discoverer().discover(
                inputDir,
                (path, msg, ex) ->
                {
                    log.warn(msg);
                    skipped.incrementAndGet();
                    stats.archiveFailed(path, msg, ex);
                });

            if(archives.isEmpty() && skipped.get() == 0)
            {
                throw new NoArchivesFoundException(
                    "No .tar.gz, .tgz or .zip files found in '" + inputDir + "'");
            }
            log.info("Found {} archive(s) in '{}'", archives.size() + skipped.get(), inputDir);
            stats.archivesDiscovered(archives.size() + skipped.get());

            new ExtractionOperation(this, writer, stats).run(archives, skipped.get());

            if(_cancelRequested)
            {
                throw new RunCancelledException(
                    String.format("Run cancelled after %d of %d archive(s); no output written",
                                  stats.getArchivesSeen(), stats.getArchivesDiscovered()),
                    stats);
            }
            if(stats.getFilesExtracted() == 0)
            {
                throw new NoMidiFilesFoundException(
                    String.format("No MIDI files found in %d archive(s) (%d failed); no output written",
                                  stats.getArchivesSeen(), stats.getArchivesFailed()),
                    stats);
            }

            writer.commit();
            log.info("Wrote {} MIDI file(s) in {} part file(s) to '{}'",
                     stats.getFilesExtracted(), writer.getPartFiles(), writer.getOutputPath());
        }
        return stats;
    }

    /**
     * Asks a running {@link #extract} call (on another thread) to stop. Archives already being
     * read are finished; no others are started. The run then fails with
     * {@link RunCancelledException}, writing nothing.
     */
    public void cancel()
    {
        log.info("Cancellation requested");
        _cancelRequested = true;
    }

    /**
     * Specifies how many archives to read at once (by default, the number of available
     * processors). With 1, archives are read one after another on the calling thread.
     *
     * @param n The number of worker threads.
     * @return This object.
     */
    public MidiSet jobs(int n)
    {
        if(n < 1)
        {
            throw new IllegalArgumentException("jobs must be at least 1, not " + n);
        }
        _jobs = n;
        return this;
    }

    /**
     * Specifies how many fully-read archives may wait for the writer at once (by default, twice
     * the number of jobs). Workers block when the queue is full, which bounds memory use.
     *
     * @param n The queue capacity.
     * @return This object.
     */
    public MidiSet queueCapacity(int n)
    {
        if(n < 1)
        {
            throw new IllegalArgumentException("queue capacity must be at least 1, not " + n);
        }
        _queueCapacity = n;
        return this;
    }

    /**
     * Specifies whether to look for archives in sub-directories of the input directory too
     * (false by default).
     *
     * @param b Whether to search recursively.
     * @return This object.
     */
    public MidiSet recursive(boolean b)
    {
        _recursive = b;
        return this;
    }

    /**
     * Specifies whether an existing dataset at the output path may be replaced (false by
     * default). The old output is only removed once the new one is complete.
     *
     * @param b Whether to overwrite.
     * @return This object.
     */
    public MidiSet overwrite(boolean b)
    {
        _overwrite = b;
        return this;
    }

    /**
     * Specifies the ZSTD compression level for the Parquet files, from 1 to 22 (the default, and
     * the strongest).
     *
     * @param level The compression level.
     * @return This object.
     */
    public MidiSet compressionLevel(int level)
    {
        if(level < PartitionedParquetWriter.MIN_ZSTD_LEVEL || level > PartitionedParquetWriter.MAX_ZSTD_LEVEL)
        {
            throw new IllegalArgumentException(String.format(
                "compression level must be between %d and %d, not %d",
                PartitionedParquetWriter.MIN_ZSTD_LEVEL, PartitionedParquetWriter.MAX_ZSTD_LEVEL, level));
        }
        _compressionLevel = level;
        return this;
    }

    public MidiSet progressListener(ProgressListener listener)
    {
        _progressListener = Objects.requireNonNull(listener);
        return this;
    }

    /**
     * Replaces the reader for one or more archive formats.
     *
     * @param newReaders The readers to use; each one applies to its own
     *                   {@link ArchiveReader#getFormat()}.
     * @return This object.
     */
    public MidiSet readWith(ArchiveReader... newReaders)
    {
        if(_readers == null)
        {
            _readers = new HashSet<>();
        }
        _readers.addAll(Arrays.asList(newReaders));
        _readerMap = null;
        return this;
    }

    public Set<ArchiveReader> defaultReaders()
    {
        return Set.of(new TarGzReader(), new ZipReader());
    }


    int jobs()                          { return _jobs; }
    int compressionLevel()              { return _compressionLevel; }
    int queueCapacity()                 { return (_queueCapacity > 0) ? _queueCapacity : 2 * _jobs; }
    boolean cancelRequested()           { return _cancelRequested; }
    ProgressListener progressListener() { return _progressListener; }

    ArchiveDiscoverer discoverer()
    {
        return new ArchiveDiscoverer(_recursive);
    }

    synchronized ArchiveReader readerFor(ArchiveFormat format)
    {
        if(_readerMap == null)
        {
            _readerMap = new HashMap<>();
            for(var reader : defaultReaders())
            {
                _readerMap.put(reader.getFormat(), reader);
            }
            if(_readers != null)
            {
                for(var reader : _readers)
                {
                    _readerMap.put(reader.getFormat(), reader);
                }
            }
        }
        var reader = _readerMap.get(format);
        if(reader == null)
        {
            throw new IllegalStateException("No reader for archive format " + format);
        }
        return reader;
    }
}
