package au.djac.midiset;
import au.djac.midiset.archive.*;

import java.util.*;

/**
 * The outcome of reading one archive, handed from whichever thread read it to the thread that
 * owns the output writer. An archive either yields its complete batch of records, or fails and
 * yields none; a failure part-way through an archive discards the records read up to that point.
 */
public final class ArchiveResult
{
    public enum Status { OK, FAILED, CANCELLED }

    private final Archive archive;
    private final Status status;
    private final List<OutputRecord> records;
    private final ArchiveUnreadableException failure;

    private ArchiveResult(Archive archive,
                          Status status,
                          List<OutputRecord> records,
                          ArchiveUnreadableException failure)
    {
        this.archive = archive;
        this.status = status;
        this.records = records;
        this.failure = failure;
    }

    public static ArchiveResult ok(Archive archive, List<OutputRecord> records)
    {
        return new ArchiveResult(archive, Status.OK, Collections.unmodifiableList(records), null);
    }

    public static ArchiveResult failed(ArchiveUnreadableException failure)
    {
        return new ArchiveResult(failure.getArchive(), Status.FAILED, List.of(), failure);
    }

    public static ArchiveResult cancelled(Archive archive)
    {
        return new ArchiveResult(archive, Status.CANCELLED, List.of(), null);
    }

    public Archive getArchive()                     { return archive; }
    public Status getStatus()                       { return status; }
    public List<OutputRecord> getRecords()          { return records; }

    /** @return The reason for a {@code FAILED} result; null otherwise. */
    public ArchiveUnreadableException getFailure()  { return failure; }

    public long getTotalBytes()
    {
        long total = 0;
        for(var record : records)
        {
            total += record.getSize();
        }
        return total;
    }
}
