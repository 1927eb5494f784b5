package au.djac.midiset;

import java.util.Set;

/**
 * Decides whether an archive member is a MIDI file, by its name alone.
 *
 * <p>The final extension (whatever follows the last '.') must be exactly "mid", "MID", "midi" or
 * "MIDI". The comparison is case-sensitive: mixed-case forms such as "Mid" are not accepted.
 */
public class MidiFileMatcher
{
    public static final Set<String> EXTENSIONS = Set.of("mid", "MID", "midi", "MIDI");

    public boolean matches(String memberName)
    {
        var extIndex = memberName.lastIndexOf('.');
        return extIndex != -1 && EXTENSIONS.contains(memberName.substring(extIndex + 1));
    }
}
