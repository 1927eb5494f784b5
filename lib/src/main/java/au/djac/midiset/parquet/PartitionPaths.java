package au.djac.midiset.parquet;

import java.util.BitSet;

/**
 * Maps group values to and from Hive-style partition directory names ("group=value"), as
 * understood by Spark, DuckDB, Polars, Arrow and others.
 *
 * <p>Characters that are unsafe in a path component are percent-encoded the way Hive does it, so
 * that every group value becomes exactly one directory.
 */
public final class PartitionPaths
{
    public static final String PREFIX = MidiFileSchema.GROUP + "=";

    private static final BitSet ESCAPED = new BitSet(128);
    static
    {
        for(char c = 0; c < ' '; c++)
        {
            ESCAPED.set(c);
        }
        for(char c : "\"#%'*/:=?\\\u007f{[]^".toCharArray())
        {
            ESCAPED.set(c);
        }
    }

    private PartitionPaths() {}

    public static String directoryName(String group)
    {
        return PREFIX + escape(group);
    }

    /**
     * @return The group encoded by a partition directory name, or null if the name is not of the
     * form "group=...".
     */
    public static String groupOf(String directoryName)
    {
        if(!directoryName.startsWith(PREFIX))
        {
            return null;
        }
        return unescape(directoryName.substring(PREFIX.length()));
    }

    static String escape(String value)
    {
        var sb = new StringBuilder(value.length());
        for(int i = 0; i < value.length(); i++)
        {
            char c = value.charAt(i);
            if(c < 128 && ESCAPED.get(c))
            {
                sb.append('%').append(String.format("%02X", (int) c));
            }
            else
            {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String unescape(String value)
    {
        var sb = new StringBuilder(value.length());
        for(int i = 0; i < value.length(); i++)
        {
            char c = value.charAt(i);
            if(c == '%' && i + 2 < value.length() && isHex(value.charAt(i + 1)) && isHex(value.charAt(i + 2)))
            {
                sb.append((char) Integer.parseInt(value.substring(i + 1, i + 3), 16));
                i += 2;
            }
            else
            {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isHex(char c)
    {
        return Character.digit(c, 16) != -1;
    }
}
