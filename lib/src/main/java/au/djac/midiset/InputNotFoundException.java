package au.djac.midiset;

/**
 * The input directory does not exist, is not a directory, or cannot be listed.
 */
public class InputNotFoundException extends MidiSetException
{
    public InputNotFoundException(String msg)                  { super(msg); }
    public InputNotFoundException(String msg, Throwable cause) { super(msg, cause); }
}
