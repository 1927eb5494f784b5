package au.djac.midiset;

import java.util.Arrays;
import java.util.Objects;

/**
 * One MIDI file as stored in the output dataset: the group of the archive it came from, its name
 * within that archive, and its exact bytes.
 */
public final class OutputRecord
{
    private final String group;
    private final String fileName;
    private final byte[] content;

    public OutputRecord(String group, String fileName, byte[] content)
    {
        this.group = Objects.requireNonNull(group);
        this.fileName = Objects.requireNonNull(fileName);
        this.content = Objects.requireNonNull(content);
    }

    public String getGroup()    { return group; }
    public String getFileName() { return fileName; }
    public byte[] getContent()  { return content; }
    public int getSize()        { return content.length; }

    @Override
    public boolean equals(Object o)
    {
        if(this == o) { return true; }
        if(!(o instanceof OutputRecord)) { return false; }
        var other = (OutputRecord) o;
        return group.equals(other.group)
            && fileName.equals(other.fileName)
            && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode()
    {
        return 31 * Objects.hash(group, fileName) + Arrays.hashCode(content);
    }

    @Override
    public String toString()
    {
        return group + ":" + fileName + " (" + content.length + " bytes)";
    }
}
