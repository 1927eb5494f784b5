package au.djac.midiset;

/**
 * Archives were found and read, but none of them contained a MIDI file.
 */
public class NoMidiFilesFoundException extends MidiSetException
{
    private final RunStats stats;

    public NoMidiFilesFoundException(String msg, RunStats stats)
    {
        super(msg);
        this.stats = stats;
    }

    public RunStats getStats() { return stats; }
}
