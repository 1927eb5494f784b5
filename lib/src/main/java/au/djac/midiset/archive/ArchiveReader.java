package au.djac.midiset.archive;

import java.util.function.Predicate;

/**
 * Reads the members of one archive format, entirely in memory. Nothing is written to disk; each
 * wanted member's content is decompressed into a byte array and handed to a callback.
 *
 * <p>Member names are given exactly as stored in the archive. The archive formats agree on '/'
 * as a directory separator, so names are not converted to filesystem paths.
 */
public abstract class ArchiveReader
{
    @FunctionalInterface
    public interface MemberConsumer
    {
        void accept(String memberName, byte[] content);
    }

    @FunctionalInterface
    public interface MemberErrorHandler
    {
        /**
         * Receives a member that could not be read, where the rest of the archive is still
         * readable. Reading continues with the next member afterwards.
         *
         * @param archive    The archive containing the member.
         * @param memberName The member's name within the archive.
         * @param message    A description of the problem.
         * @param exception  The underlying exception, or null if the reader refused the member
         *                   up front (e.g., an unsupported compression method).
         */
        void memberUnreadable(Archive archive, String memberName, String message, Exception exception);
    }

    /** The largest member that fits in a byte array. */
    public static final long MAX_MEMBER_SIZE = Integer.MAX_VALUE - 8;

    private final long maxMemberSize;

    protected ArchiveReader()
    {
        this(MAX_MEMBER_SIZE);
    }

    /**
     * @param maxMemberSize Wanted members larger than this are reported as unreadable, without
     *                      their content being read.
     */
    protected ArchiveReader(long maxMemberSize)
    {
        if(maxMemberSize < 0 || maxMemberSize > MAX_MEMBER_SIZE)
        {
            throw new IllegalArgumentException(String.format(
                "maximum member size must be between 0 and %d, not %d", MAX_MEMBER_SIZE, maxMemberSize));
        }
        this.maxMemberSize = maxMemberSize;
    }

    public long getMaxMemberSize() { return maxMemberSize; }

    /**
     * Checks a member's declared size against the limit, reporting it if too large.
     *
     * @param size The size from the member's header, or -1 if unknown.
     * @return True if the member may be read.
     */
    protected boolean checkSize(Archive archive, String memberName, long size, MemberErrorHandler errorHandler)
    {
        if(size > maxMemberSize)
        {
            errorHandler.memberUnreadable(
                archive,
                memberName,
                String.format("Entry '%s' in archive '%s' is too large to read into memory (%,d bytes; limit %,d)",
                              memberName, archive.getPath(), size, maxMemberSize),
                null);
            return false;
        }
        return true;
    }

    /**
     * @return The archive format handled by this reader.
     */
    public abstract ArchiveFormat getFormat();

    /**
     * Reads every regular-file member of an archive, in archive order. Directories, links and
     * other special entries are skipped.
     *
     * @param archive      The archive to read.
     * @param wanted       Tests each member name; content is read only for accepted members.
     * @param consumer     Receives each accepted member's name and full content.
     * @param errorHandler Receives members that are individually unreadable.
     * @throws ArchiveUnreadableException If the archive cannot be opened, or is corrupt in a way
     * that prevents reading the rest of it.
     */
    public abstract void read(Archive archive,
                              Predicate<String> wanted,
                              MemberConsumer consumer,
                              MemberErrorHandler errorHandler) throws ArchiveUnreadableException;
}
