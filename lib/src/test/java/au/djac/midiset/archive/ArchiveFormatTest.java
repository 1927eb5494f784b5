package au.djac.midiset.archive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ArchiveFormatTest
{
    @Test
    void forFileName_recognisesSuffixesCaseInsensitively()
    {
        assertThat(ArchiveFormat.forFileName("classical_music.tar.gz")).isSameAs(ArchiveFormat.TAR_GZIP);
        assertThat(ArchiveFormat.forFileName("classical_music.TGZ")).isSameAs(ArchiveFormat.TAR_GZIP);
        assertThat(ArchiveFormat.forFileName("jazz_collection.zip")).isSameAs(ArchiveFormat.ZIP);
        assertThat(ArchiveFormat.forFileName("jazz_collection.Zip")).isSameAs(ArchiveFormat.ZIP);
    }

    @Test
    void forFileName_returnsNullForOtherFiles()
    {
        assertThat(ArchiveFormat.forFileName("notes.txt")).isNull();
        assertThat(ArchiveFormat.forFileName("music.gz")).isNull();
        assertThat(ArchiveFormat.forFileName("music.tar")).isNull();
        assertThat(ArchiveFormat.forFileName("music.7z")).isNull();
    }

    @Test
    void stripSuffix_givesTheGroupName()
    {
        assertThat(ArchiveFormat.TAR_GZIP.stripSuffix("classical_music.tar.gz")).isEqualTo("classical_music");
        assertThat(ArchiveFormat.TAR_GZIP.stripSuffix("pop.v2.TAR.GZ")).isEqualTo("pop.v2");
        assertThat(ArchiveFormat.TAR_GZIP.stripSuffix("rock.tgz")).isEqualTo("rock");
        assertThat(ArchiveFormat.ZIP.stripSuffix("jazz_collection.zip")).isEqualTo("jazz_collection");
        assertThat(ArchiveFormat.ZIP.stripSuffix(".zip")).isEmpty();
    }

    @Test
    void stripSuffix_rejectsNamesOfAnotherFormat()
    {
        assertThatThrownBy(() -> ArchiveFormat.ZIP.stripSuffix("rock.tgz"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
