package au.djac.midiset.archive;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.Files;
import java.util.function.Predicate;

/**
 * Reads gzip-compressed tar archives (.tar.gz, .tgz) as a single stream, using the Apache Commons
 * Compress GzipCompressorInputStream and TarArchiveInputStream classes.
 *
 * <p>Tar is a sequential format, with no index, so once an error occurs within the stream there is
 * no way to locate the next member. Hence an I/O error while reading a member's data fails the
 * whole archive. Members that Commons Compress declines to read (e.g., unsupported sparse
 * entries) are reported individually, and skipped.
 *
 * For reference, the TAR standard is available here:
 * https://www.gnu.org/software/tar/manual/html_node/Standard.html
 */
public class TarGzReader extends ArchiveReader
{
    private static final Logger log = LoggerFactory.getLogger(TarGzReader.class);

    public TarGzReader() {}

    public TarGzReader(long maxMemberSize)
    {
        super(maxMemberSize);
    }

    @Override
    public ArchiveFormat getFormat()
    {
        return ArchiveFormat.TAR_GZIP;
    }

    @Override
    public void read(Archive archive,
                     Predicate<String> wanted,
                     MemberConsumer consumer,
                     MemberErrorHandler errorHandler) throws ArchiveUnreadableException
    {
        var path = archive.getPath();
        log.debug("Reading tar.gz archive '{}'", path);

        // 'true' = keep decompressing concatenated gzip members, as gunzip does.
        try(var tis = new TarArchiveInputStream(
                new GzipCompressorInputStream(
                    new BufferedInputStream(Files.newInputStream(path)), true)))
        {
            TarArchiveEntry entry;
            while((entry = tis.getNextEntry()) != null)
            {
                var name = entry.getName();
                if(!isRegularFile(entry))
                {
                    log.debug("Skipping non-file entry '{}' in '{}'", name, path);
                    continue;
                }
                if(!wanted.test(name))
                {
                    log.trace("Ignoring '{}' in '{}'", name, path);
                    continue;
                }
                if(!tis.canReadEntryData(entry))
                {
                    errorHandler.memberUnreadable(
                        archive,
                        name,
                        String.format("Cannot read entry '%s' from archive '%s' (unsupported entry type)",
                                      name, path),
                        null);
                    continue;
                }
                // The stream skips the unread data of an oversized entry on the next getNextEntry().
                if(!checkSize(archive, name, entry.getSize(), errorHandler))
                {
                    continue;
                }
                consumer.accept(name, IOUtils.toByteArray(tis));
            }
        }
        catch(IOException e)
        {
            throw new ArchiveUnreadableException(
                archive,
                "Could not read tar.gz archive '" + path + "': " + e.getMessage(),
                e);
        }
    }

    private static boolean isRegularFile(TarArchiveEntry entry)
    {
        // isFile() is true for most non-directory entries, including links and devices.
        return entry.isFile()
            && !entry.isSymbolicLink()
            && !entry.isLink()
            && !entry.isCharacterDevice()
            && !entry.isBlockDevice()
            && !entry.isFIFO();
    }
}
