package au.djac.midiset.archive;

/**
 * Indicates that an archive as a whole could not be read: it could not be opened, is not in the
 * format its name claims, or is truncated or otherwise corrupt. The run skips the archive and
 * carries on with the next one.
 */
public class ArchiveUnreadableException extends Exception
{
    private final Archive archive;

    public ArchiveUnreadableException(Archive archive, String msg, Throwable cause)
    {
        super(msg, cause);
        this.archive = archive;
    }

    public Archive getArchive() { return archive; }
}
