package au.djac.midiset.parquet;
import au.djac.midiset.*;

import org.apache.commons.io.FileUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.ParquetRuntimeException;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.codec.ZstandardCodec;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalOutputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Writes {@link OutputRecord}s as a Parquet dataset partitioned by group, in the Hive directory
 * layout:
 *
 * <pre>
 * output/
 *   group=classical_music/part-00000.parquet
 *   group=jazz_collection/part-00000.parquet
 *   group=jazz_collection/part-00001.parquet
 * </pre>
 *
 * Every file is ZSTD-compressed at the configured level (by default the maximum, 22).
 *
 * <p>Lifecycle: {@link #open()} validates the destination before any work is done; each
 * {@link #write} call adds one part file per group in the batch, inside a hidden staging
 * directory next to the output; {@link #commit()} moves the staging directory into place. If
 * the writer is closed without being committed, the staging directory is deleted, so a failed
 * run never leaves a dataset that looks complete.
 *
 * <p>Not thread-safe. A run has exactly one thread that owns the writer.
 */
public class PartitionedParquetWriter implements Closeable
{
    private static final Logger log = LoggerFactory.getLogger(PartitionedParquetWriter.class);

    public static final int MIN_ZSTD_LEVEL = 1;
    public static final int MAX_ZSTD_LEVEL = 22;

    private static final String STAGING_SUFFIX = ".inprogress";

    private final Path outputPath;
    private final boolean overwrite;
    private final int compressionLevel;
    private final Configuration conf;
    private final Map<String,Integer> partCounters = new HashMap<>();

    private Path stagingPath = null;
    private boolean stagingCreated = false;
    private Path createdParent = null; // Topmost output ancestor created by this writer, if any
    private boolean committed = false;
    private long partFiles = 0;

    public PartitionedParquetWriter(Path outputPath, boolean overwrite, int compressionLevel)
    {
        if(compressionLevel < MIN_ZSTD_LEVEL || compressionLevel > MAX_ZSTD_LEVEL)
        {
            throw new IllegalArgumentException(String.format(
                "ZSTD compression level must be between %d and %d, not %d",
                MIN_ZSTD_LEVEL, MAX_ZSTD_LEVEL, compressionLevel));
        }
        this.outputPath = outputPath.toAbsolutePath().normalize();
        this.overwrite = overwrite;
        this.compressionLevel = compressionLevel;

        // 'false' = don't load Hadoop's *-default.xml/*-site.xml resources from the classpath.
        this.conf = new Configuration(false);
        this.conf.setInt(ZstandardCodec.PARQUET_COMPRESS_ZSTD_LEVEL, compressionLevel);
    }

    public Path getOutputPath()     { return outputPath; }
    public int getCompressionLevel() { return compressionLevel; }
    public long getPartFiles()      { return partFiles; }

    /**
     * Checks that the output can be written (and, if it exists, replaced), without writing
     * anything yet.
     *
     * @throws OutputConflictException If the destination is unusable.
     */
    public void open()
    {
        var fileName = outputPath.getFileName();
        if(fileName == null)
        {
            throw new OutputConflictException("Output path '" + outputPath + "' has no file name");
        }

        if(Files.exists(outputPath, LinkOption.NOFOLLOW_LINKS))
        {
            if(!overwrite)
            {
                throw new OutputConflictException(
                    "Output '" + outputPath + "' already exists; choose another path or enable overwriting");
            }
            if(!Files.isWritable(outputPath))
            {
                throw new OutputConflictException(
                    "Output '" + outputPath + "' already exists and is not writable");
            }
            if(Files.isDirectory(outputPath, LinkOption.NOFOLLOW_LINKS) && !looksLikeDataset(outputPath))
            {
                throw new OutputConflictException(
                    "Output '" + outputPath + "' is a directory that does not hold a partitioned "
                    + "dataset; refusing to replace it");
            }
        }

        // Nothing is created yet; the nearest existing ancestor must allow the rest to be.
        var parent = outputPath.getParent();
        var existing = parent;
        while(existing != null && !Files.exists(existing))
        {
            existing = existing.getParent();
        }
        if(existing == null || !Files.isDirectory(existing))
        {
            throw new OutputConflictException("Cannot create output directory '" + parent + "'");
        }
        if(!Files.isWritable(existing))
        {
            throw new OutputConflictException("Output directory '" + existing + "' is not writable");
        }

        stagingPath = parent.resolve("." + fileName + STAGING_SUFFIX);
        log.debug("Output '{}' validated; staging in '{}'", outputPath, stagingPath);
    }

    private static boolean looksLikeDataset(Path dir)
    {
        try(var stream = Files.newDirectoryStream(dir))
        {
            for(var entry : stream)
            {
                var name = entry.getFileName().toString();
                if(!name.startsWith(".") && PartitionPaths.groupOf(name) == null)
                {
                    return false;
                }
            }
            return true;
        }
        catch(IOException e)
        {
            log.atDebug().setCause(e).log("Cannot list existing output '{}'", dir);
            return false;
        }
    }

    private void ensureStaging()
    {
        if(stagingPath == null)
        {
            throw new IllegalStateException("open() has not been called");
        }
        if(stagingCreated)
        {
            return;
        }
        try
        {
            if(Files.exists(stagingPath, LinkOption.NOFOLLOW_LINKS))
            {
                log.warn("Removing leftover staging directory '{}'", stagingPath);
                FileUtils.forceDelete(stagingPath.toFile());
            }
            for(var dir = stagingPath.getParent(); dir != null && !Files.exists(dir); dir = dir.getParent())
            {
                createdParent = dir;
            }
            Files.createDirectories(stagingPath);
            stagingCreated = true;
        }
        catch(IOException e)
        {
            throw new WriteFailureException(
                "Cannot create staging directory '" + stagingPath + "': " + e.getMessage(), e);
        }
    }

    /**
     * Writes a batch of records (normally, everything extracted from one archive). Records are
     * split by group, and each group's share goes to a new part file in that group's partition.
     *
     * @throws WriteFailureException On any I/O error.
     */
    public void write(List<OutputRecord> batch)
    {
        if(committed)
        {
            throw new IllegalStateException("Output '" + outputPath + "' has already been committed");
        }
        if(batch.isEmpty())
        {
            return;
        }
        ensureStaging();

        var byGroup = new LinkedHashMap<String,List<OutputRecord>>();
        for(var record : batch)
        {
            byGroup.computeIfAbsent(record.getGroup(), g -> new ArrayList<>()).add(record);
        }
        for(var entry : byGroup.entrySet())
        {
            writePart(entry.getKey(), entry.getValue());
        }
    }

    private void writePart(String group, List<OutputRecord> records)
    {
        var partitionDir = stagingPath.resolve(PartitionPaths.directoryName(group));
        int part = partCounters.merge(group, 1, Integer::sum) - 1;
        var file = partitionDir.resolve(String.format("part-%05d.parquet", part));
        log.debug("Writing {} record(s) to '{}'", records.size(), file);

        try
        {
            Files.createDirectories(partitionDir);
            try(var writer = ExampleParquetWriter.builder(new LocalOutputFile(file))
                    .withType(MidiFileSchema.SCHEMA)
                    .withConf(conf)
                    .withCompressionCodec(CompressionCodecName.ZSTD)
                    .withWriteMode(ParquetFileWriter.Mode.CREATE)
                    .withDictionaryEncoding(false)
                    .withDictionaryEncoding(MidiFileSchema.GROUP, true)
                    .withDictionaryEncoding(MidiFileSchema.FILE_NAME, true)
                    .build())
            {
                var factory = new SimpleGroupFactory(MidiFileSchema.SCHEMA);
                for(var record : records)
                {
                    writer.write(MidiFileSchema.toGroup(factory, record));
                }
            }
            partFiles++;
        }
        catch(IOException | ParquetRuntimeException e)
        {
            throw new WriteFailureException(
                "Could not write Parquet file '" + file + "': " + e.getMessage(), e);
        }
    }

    /**
     * Publishes the dataset at the output path, replacing any previous output if overwriting is
     * enabled.
     *
     * @throws IllegalStateException If nothing has been written.
     * @throws WriteFailureException On any I/O error; the staging directory is then discarded by
     * {@link #close()}.
     */
    public void commit()
    {
        if(!stagingCreated)
        {
            throw new IllegalStateException("Nothing has been written to '" + outputPath + "'");
        }
        try
        {
            if(Files.exists(outputPath, LinkOption.NOFOLLOW_LINKS))
            {
                log.info("Replacing existing output '{}'", outputPath);
                FileUtils.forceDelete(outputPath.toFile());
            }
            try
            {
                Files.move(stagingPath, outputPath, StandardCopyOption.ATOMIC_MOVE);
            }
            catch(AtomicMoveNotSupportedException e)
            {
                log.atDebug().setCause(e).log("Atomic move unsupported; moving '{}' non-atomically", stagingPath);
                Files.move(stagingPath, outputPath);
            }
            committed = true;
            log.debug("Committed {} part file(s) to '{}'", partFiles, outputPath);
        }
        catch(IOException e)
        {
            throw new WriteFailureException(
                "Could not move '" + stagingPath + "' to '" + outputPath + "': " + e.getMessage(), e);
        }
    }

    /**
     * Discards everything written so far, unless already committed.
     */
    public void abort()
    {
        if(committed)
        {
            return;
        }
        if(stagingCreated)
        {
            log.debug("Discarding staging directory '{}'", stagingPath);
            FileUtils.deleteQuietly(stagingPath.toFile());
            if(Files.exists(stagingPath, LinkOption.NOFOLLOW_LINKS))
            {
                log.warn("Could not remove staging directory '{}'", stagingPath);
            }
            stagingCreated = false;
        }
        removeCreatedParents();
    }

    private void removeCreatedParents()
    {
        if(createdParent == null)
        {
            return;
        }
        for(var dir = stagingPath.getParent(); dir != null && dir.startsWith(createdParent); dir = dir.getParent())
        {
            try
            {
                Files.deleteIfExists(dir);
            }
            catch(IOException e)
            {
                // Typically not empty; something else now lives there.
                log.atDebug().setCause(e).log("Leaving output directory '{}' in place", dir);
                break;
            }
        }
        createdParent = null;
    }

    @Override
    public void close()
    {
        abort();
    }
}
