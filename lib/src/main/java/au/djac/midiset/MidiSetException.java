package au.djac.midiset;

/**
 * Base class of the fatal conditions that abort an extraction run. Recoverable problems (an
 * unreadable archive or archive member) never surface as exceptions from {@link MidiSet}; they are
 * logged and counted in {@link RunStats} instead.
 */
public class MidiSetException extends RuntimeException
{
    public MidiSetException()                            { super(); }
    public MidiSetException(String msg)                  { super(msg); }
    public MidiSetException(Throwable cause)             { super(cause); }
    public MidiSetException(String msg, Throwable cause) { super(msg, cause); }
}
