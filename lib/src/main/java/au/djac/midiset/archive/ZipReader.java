package au.djac.midiset.archive;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;
import java.util.function.Predicate;

/**
 * Reads ZIP archives, using the Apache Commons Compress ZipFile class.
 *
 * This is a slight improvement on the standard java.util.zip.ZipFile, and the Commons Compress
 * docs advise the use of ZipFile over ZipArchiveInputStream:
 * https://commons.apache.org/proper/commons-compress/javadocs/api-release/index.html
 *
 * <p>Entries are located through the central directory, so each one can be read independently. An
 * entry whose data cannot be read is reported and skipped, and the remaining entries are still
 * read. A file with no readable central directory (e.g., a truncated download) fails as a whole.
 *
 * For reference, the ZIP specification is available here:
 * https://pkware.cachefly.net/webdocs/casestudies/APPNOTE.TXT
 */
public class ZipReader extends ArchiveReader
{
    private static final Logger log = LoggerFactory.getLogger(ZipReader.class);

    public ZipReader() {}

    public ZipReader(long maxMemberSize)
    {
        super(maxMemberSize);
    }

    @Override
    public ArchiveFormat getFormat()
    {
        return ArchiveFormat.ZIP;
    }

    @Override
    public void read(Archive archive,
                     Predicate<String> wanted,
                     MemberConsumer consumer,
                     MemberErrorHandler errorHandler) throws ArchiveUnreadableException
    {
        var path = archive.getPath();
        log.debug("Reading ZIP archive '{}'", path);

        try(var zipFile = ZipFile.builder().setPath(path).get())
        {
            Enumeration<ZipArchiveEntry> en = zipFile.getEntries();
            while(en.hasMoreElements())
            {
                var entry = en.nextElement();
                var name = entry.getName();
                if(entry.isDirectory() || entry.isUnixSymlink())
                {
                    log.debug("Skipping non-file entry '{}' in '{}'", name, path);
                    continue;
                }
                if(!wanted.test(name))
                {
                    log.trace("Ignoring '{}' in '{}'", name, path);
                    continue;
                }
                if(!zipFile.canReadEntryData(entry))
                {
                    // Encrypted, or compressed with a method Commons Compress doesn't support.
                    errorHandler.memberUnreadable(
                        archive,
                        name,
                        String.format("Cannot read entry '%s' from archive '%s' (method %d, encrypted: %s)",
                                      name, path, entry.getMethod(),
                                      entry.getGeneralPurposeBit().usesEncryption()),
                        null);
                    continue;
                }

                if(!checkSize(archive, name, entry.getSize(), errorHandler))
                {
                    continue;
                }

                byte[] content;
                try(var in = zipFile.getInputStream(entry))
                {
                    content = IOUtils.toByteArray(in);
                }
                // IllegalArgumentException: more data than fits in an array, despite the header.
                catch(IOException | IllegalArgumentException e)
                {
                    errorHandler.memberUnreadable(
                        archive,
                        name,
                        String.format("Could not read entry '%s' from archive '%s': %s",
                                      name, path, e.getMessage()),
                        e);
                    continue;
                }
                consumer.accept(name, content);
            }
        }
        catch(IOException e)
        {
            throw new ArchiveUnreadableException(
                archive,
                "Could not read ZIP archive '" + path + "': " + e.getMessage(),
                e);
        }
    }
}
