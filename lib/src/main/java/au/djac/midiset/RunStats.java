package au.djac.midiset;

import org.apache.commons.io.FileUtils;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and failure records for one extraction run. Archive readers may run on several
 * threads at once, so every counter is atomic and the collections are thread-safe.
 *
 * <p>"Archives seen" counts every archive whose processing finished, successfully or not.
 * "Archives failed" is the subset that could not be read. "Archives without MIDI" counts readable
 * archives that simply held no MIDI files; these are not failures.
 */
public class RunStats
{
    public static class Failure
    {
        private final Path path;
        private final String memberName;
        private final String message;
        private final Exception exception;

        public Failure(Path path, String memberName, String message, Exception exception)
        {
            this.path = path;
            this.memberName = memberName;
            this.message = message;
            this.exception = exception;
        }

        public Path getPath()           { return path; }

        /** @return The archive member concerned, or null if the whole archive/file failed. */
        public String getMemberName()   { return memberName; }
        public String getMessage()      { return message; }
        public Exception getException() { return exception; }
    }

    public static class GroupTotals
    {
        private final AtomicLong files = new AtomicLong();
        private final AtomicLong bytes = new AtomicLong();

        public long getFiles() { return files.get(); }
        public long getBytes() { return bytes.get(); }
    }

    private final AtomicLong archivesDiscovered = new AtomicLong();
    private final AtomicLong archivesSeen = new AtomicLong();
    private final AtomicLong archivesFailed = new AtomicLong();
    private final AtomicLong archivesWithoutMidi = new AtomicLong();
    private final AtomicLong archivesCancelled = new AtomicLong();
    private final AtomicLong filesExtracted = new AtomicLong();
    private final AtomicLong membersSkipped = new AtomicLong();
    private final AtomicLong bytesWritten = new AtomicLong();

    private final Map<String,GroupTotals> groups = new ConcurrentHashMap<>();
    private final List<Failure> failures = Collections.synchronizedList(new ArrayList<>());
    private final SizeDistribution sizes = new SizeDistribution();

    void archivesDiscovered(long n)
    {
        archivesDiscovered.addAndGet(n);
    }

    /** An archive that could not be read, either during discovery or extraction. */
    void archiveFailed(Path path, String message, Exception exception)
    {
        archivesSeen.incrementAndGet();
        archivesFailed.incrementAndGet();
        failures.add(new Failure(path, null, message, exception));
    }

    void archiveSucceeded(int recordCount)
    {
        archivesSeen.incrementAndGet();
        if(recordCount == 0)
        {
            archivesWithoutMidi.incrementAndGet();
        }
    }

    void archiveCancelled()
    {
        archivesCancelled.incrementAndGet();
    }

    void memberSkipped(Path archivePath, String memberName, String message, Exception exception)
    {
        membersSkipped.incrementAndGet();
        failures.add(new Failure(archivePath, memberName, message, exception));
    }

    /** Called once a record is safely handed to the output writer. */
    void recordWritten(OutputRecord record)
    {
        filesExtracted.incrementAndGet();
        bytesWritten.addAndGet(record.getSize());
        var totals = groups.computeIfAbsent(record.getGroup(), g -> new GroupTotals());
        totals.files.incrementAndGet();
        totals.bytes.addAndGet(record.getSize());
        sizes.add(record.getSize());
    }

    public long getArchivesDiscovered()  { return archivesDiscovered.get(); }
    public long getArchivesSeen()        { return archivesSeen.get(); }
    public long getArchivesFailed()      { return archivesFailed.get(); }
    public long getArchivesProcessed()   { return archivesSeen.get() - archivesFailed.get(); }
    public long getArchivesWithoutMidi() { return archivesWithoutMidi.get(); }
    public long getArchivesCancelled()   { return archivesCancelled.get(); }
    public long getFilesExtracted()      { return filesExtracted.get(); }
    public long getMembersSkipped()      { return membersSkipped.get(); }
    public long getBytesWritten()        { return bytesWritten.get(); }
    public SizeDistribution getSizes()   { return sizes; }

    public Map<String,GroupTotals> getGroups()
    {
        return Collections.unmodifiableMap(groups);
    }

    public List<Failure> getFailures()
    {
        synchronized(failures)
        {
            return List.copyOf(failures);
        }
    }

    /**
     * Produces the end-of-run report: archive and file counts, per-group totals (largest group
     * first) and, optionally, the size distribution chart.
     *
     * @param includeHistogram Whether to append the size distribution.
     * @return The report, one line per element.
     */
    public List<String> summary(boolean includeHistogram)
    {
        var lines = new ArrayList<String>();
        lines.add(String.format("Archives discovered   : %,d", getArchivesDiscovered()));
        lines.add(String.format("Archives processed    : %,d", getArchivesProcessed()));
        lines.add(String.format("Archives failed       : %,d", getArchivesFailed()));
        lines.add(String.format("Archives without MIDI : %,d", getArchivesWithoutMidi()));
        if(getArchivesCancelled() > 0)
        {
            lines.add(String.format("Archives cancelled    : %,d", getArchivesCancelled()));
        }
        lines.add(String.format("Members skipped       : %,d", getMembersSkipped()));
        lines.add(String.format("MIDI files extracted  : %,d", getFilesExtracted()));
        lines.add(String.format("Bytes written         : %,d (%s)",
                                getBytesWritten(),
                                FileUtils.byteCountToDisplaySize(getBytesWritten())));

        if(!groups.isEmpty())
        {
            lines.add("");
            lines.add("Groups:");
            var entries = new ArrayList<>(groups.entrySet());
            entries.sort(
                Comparator.comparingLong((Map.Entry<String,GroupTotals> e) -> e.getValue().getFiles())
                          .reversed()
                          .thenComparing(Map.Entry::getKey));
            for(var entry : entries)
            {
                lines.add(String.format("  %s: %,d files, %s",
                                        entry.getKey(),
                                        entry.getValue().getFiles(),
                                        FileUtils.byteCountToDisplaySize(entry.getValue().getBytes())));
            }
        }

        if(includeHistogram && sizes.getCount() > 0)
        {
            lines.add("");
            lines.add("MIDI file size distribution:");
            lines.addAll(sizes.render());
        }
        return lines;
    }
}
