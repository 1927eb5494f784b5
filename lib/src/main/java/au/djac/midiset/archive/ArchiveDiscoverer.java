package au.djac.midiset.archive;
import au.djac.midiset.InputNotFoundException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Finds the archives in an input directory. By default only the directory's direct entries are
 * considered; optionally, the whole tree beneath it is walked.
 *
 * <p>Only regular files count, and they're classified by file-name suffix alone (see
 * {@link ArchiveFormat}). The result is sorted by path, so that it's the same on every run over
 * the same directory.
 */
public class ArchiveDiscoverer
{
    private static final Logger log = LoggerFactory.getLogger(ArchiveDiscoverer.class);

    @FunctionalInterface
    public interface ErrorHandler
    {
        /**
         * Receives a file or sub-directory that had to be skipped. Discovery carries on.
         *
         * @param path      The skipped path.
         * @param message   A description of the problem.
         * @param exception The underlying exception, or null.
         */
        void skipped(Path path, String message, Exception exception);
    }

    private final boolean recursive;

    public ArchiveDiscoverer(boolean recursive)
    {
        this.recursive = recursive;
    }

    /**
     * Checks that a path is an existing, listable directory.
     *
     * @throws InputNotFoundException If it isn't.
     */
    public static void checkInputDirectory(Path inputDir)
    {
        if(!Files.exists(inputDir))
        {
            throw new InputNotFoundException("Input directory '" + inputDir + "' does not exist");
        }
        if(!Files.isDirectory(inputDir))
        {
            throw new InputNotFoundException("Input path '" + inputDir + "' is not a directory");
        }
        if(!Files.isReadable(inputDir))
        {
            throw new InputNotFoundException("Input directory '" + inputDir + "' is not readable");
        }
    }

    /**
     * Lists the archives in a directory.
     *
     * @param inputDir     The directory to scan.
     * @param errorHandler Receives individual archive files (or, when recursive, sub-directories)
     *                     that cannot be read.
     * @return The archives found, sorted by path; possibly empty.
     * @throws InputNotFoundException If the directory itself is missing or cannot be listed.
     */
    public List<Archive> discover(Path inputDir, ErrorHandler errorHandler)
    {
        checkInputDirectory(inputDir);
        log.debug("Scanning '{}' for archives (recursive: {})", inputDir, recursive);

        var archives = new ArrayList<Archive>();
        if(recursive)
        {
            walk(inputDir, archives, errorHandler);
        }
        else
        {
            list(inputDir, archives, errorHandler);
        }
        archives.sort(Comparator.comparing(Archive::getPath));
        return archives;
    }

    private void list(Path inputDir, List<Archive> archives, ErrorHandler errorHandler)
    {
        try(var stream = Files.newDirectoryStream(inputDir))
        {
            for(var path : stream)
            {
                if(Files.isRegularFile(path))
                {
                    consider(path, archives, errorHandler);
                }
            }
        }
        catch(IOException | DirectoryIteratorException e)
        {
            throw new InputNotFoundException(
                "Cannot list input directory '" + inputDir + "': " + e.getMessage(), e);
        }
    }

    private void walk(Path inputDir, List<Archive> archives, ErrorHandler errorHandler)
    {
        try
        {
            Files.walkFileTree(
                inputDir,
                new SimpleFileVisitor<>()
                {
                    @Override
                    public FileVisitResult visitFile(Path path, BasicFileAttributes attrs)
                    {
                        if(attrs.isRegularFile())
                        {
                            consider(path, archives, errorHandler);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path path, IOException e) throws IOException
                    {
                        if(path.equals(inputDir))
                        {
                            throw e;
                        }
                        errorHandler.skipped(
                            path,
                            String.format("Cannot visit '%s': %s", path, e.getMessage()),
                            e);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException e) throws IOException
                    {
                        if(e != null)
                        {
                            if(dir.equals(inputDir))
                            {
                                throw e;
                            }
                            errorHandler.skipped(
                                dir,
                                String.format("Cannot list directory '%s': %s", dir, e.getMessage()),
                                e);
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
        }
        catch(IOException e)
        {
            throw new InputNotFoundException(
                "Cannot traverse input directory '" + inputDir + "': " + e.getMessage(), e);
        }
    }

    /**
     * Tests whether a candidate archive file can be opened for reading.
     */
    protected boolean isReadable(Path path)
    {
        return Files.isReadable(path);
    }

    private void consider(Path path, List<Archive> archives, ErrorHandler errorHandler)
    {
        var name = path.getFileName().toString();
        var format = ArchiveFormat.forFileName(name);
        if(format == null)
        {
            log.debug("Ignoring '{}': not a .tar.gz, .tgz or .zip file", path);
            return;
        }

        var group = format.stripSuffix(name);
        if(group.isEmpty())
        {
            log.warn("Ignoring '{}': nothing is left of the name to use as a group", path);
            return;
        }

        if(!isReadable(path))
        {
            errorHandler.skipped(path, String.format("Archive '%s' is not readable", path), null);
            return;
        }

        log.debug("Found {} archive '{}' (group '{}')", format, path, group);
        archives.add(new Archive(path, format, group));
    }
}
