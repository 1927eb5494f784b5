package au.djac.midiset;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MidiFileMatcherTest
{
    private final MidiFileMatcher matcher = new MidiFileMatcher();

    @ParameterizedTest
    @ValueSource(strings = {"song.mid", "SONG.MID", "a/b/c.midi", "Track 01.MIDI", "archive.tar.mid"})
    void matches_acceptsExactMidiExtensions(String name)
    {
        assertThat(matcher.matches(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"song.Mid", "song.mIdI", "song.txt", "song", "mid", "song.mid.txt",
                            "song.mid/", "song.", "readme.md"})
    void matches_rejectsEverythingElse(String name)
    {
        assertThat(matcher.matches(name)).isFalse();
    }
}
