package au.djac.midiset.archive;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One input archive file, as found by {@link ArchiveDiscoverer}. The group is the file name minus
 * its archive suffix, and becomes the partition value of every MIDI file taken from the archive.
 */
public final class Archive
{
    private final Path path;
    private final ArchiveFormat format;
    private final String group;

    public Archive(Path path, ArchiveFormat format, String group)
    {
        if(group == null || group.isEmpty())
        {
            throw new IllegalArgumentException("Archive '" + path + "' has an empty group name");
        }
        this.path = path;
        this.format = format;
        this.group = group;
    }

    public Path getPath()            { return path; }
    public ArchiveFormat getFormat() { return format; }
    public String getGroup()         { return group; }

    @Override
    public boolean equals(Object o)
    {
        if(this == o) { return true; }
        if(!(o instanceof Archive)) { return false; }
        var other = (Archive) o;
        return path.equals(other.path) && format == other.format && group.equals(other.group);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(path, group);
    }

    @Override
    public String toString()
    {
        return path.toString();
    }
}
