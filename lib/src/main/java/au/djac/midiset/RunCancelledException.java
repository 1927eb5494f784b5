package au.djac.midiset;

/**
 * Thrown by {@link MidiSet#extract} when {@link MidiSet#cancel()} was called during the run.
 */
public class RunCancelledException extends MidiSetException
{
    private final RunStats stats;

    public RunCancelledException(String msg, RunStats stats)
    {
        super(msg);
        this.stats = stats;
    }

    public RunStats getStats() { return stats; }
}
