package au.djac.midiset.archive;

import java.util.*;

/**
 * Represents a supported archive format, along with the file-name suffixes that identify it.
 * Suffixes are matched case-insensitively, and the longest matching suffix wins.
 */
public final class ArchiveFormat
{
    public static final ArchiveFormat TAR_GZIP = new ArchiveFormat("tar+gzip", ".tar.gz", ".tgz");
    public static final ArchiveFormat ZIP      = new ArchiveFormat("zip",      ".zip");

    private static final List<ArchiveFormat> ALL = List.of(TAR_GZIP, ZIP);

    /**
     * Reports the format implied by a file name, or null if the name does not end with any
     * recognised archive suffix.
     *
     * @param fileName A file name (not a full path).
     * @return The corresponding {@code ArchiveFormat}, or null.
     */
    public static ArchiveFormat forFileName(String fileName)
    {
        ArchiveFormat best = null;
        int bestLength = 0;
        for(var format : ALL)
        {
            var suffix = format.matchingSuffix(fileName);
            if(suffix != null && suffix.length() > bestLength)
            {
                best = format;
                bestLength = suffix.length();
            }
        }
        return best;
    }

    public static List<ArchiveFormat> values()
    {
        return ALL;
    }


    private final String label;
    private final List<String> suffixes;

    private ArchiveFormat(String label, String... suffixes)
    {
        this.label = label;
        this.suffixes = List.of(suffixes);
    }

    public String getLabel()          { return label; }
    public List<String> getSuffixes() { return suffixes; }

    /**
     * Returns the longest suffix of this format that ends the given file name, or null.
     */
    public String matchingSuffix(String fileName)
    {
        var lName = fileName.toLowerCase(Locale.ROOT);
        String match = null;
        for(var suffix : suffixes)
        {
            if(lName.endsWith(suffix) && (match == null || suffix.length() > match.length()))
            {
                match = suffix;
            }
        }
        return match;
    }

    /**
     * Removes this format's suffix from a file name; e.g., "jazz_collection.zip" becomes
     * "jazz_collection". The original casing of the remaining part is preserved.
     *
     * @throws IllegalArgumentException If the name does not carry one of this format's suffixes.
     */
    public String stripSuffix(String fileName)
    {
        var suffix = matchingSuffix(fileName);
        if(suffix == null)
        {
            throw new IllegalArgumentException(
                "'" + fileName + "' does not end with a " + label + " suffix " + suffixes);
        }
        return fileName.substring(0, fileName.length() - suffix.length());
    }

    @Override
    public String toString() { return label; }
}
