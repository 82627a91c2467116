package com.seiscatalog.scan;

import com.seiscatalog.AppLogger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recursive, single-threaded listing of the files under a root directory.
 *
 * Symbolic links to directories are not followed, so link cycles cannot
 * loop the walk; a root that is itself a link is resolved first. Links to
 * regular files are listed. The result is sorted
 * by path so repeated scans of an unchanged tree agree.
 */
public class FileScanner {

    private final AppLogger logger = AppLogger.get();

    public List<Path> listFiles(Path root) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            logger.warn("[FileScanner] " + root + " is not a directory, nothing to scan");
            return files;
        }
        logger.info("[FileScanner] Searching for files in " + root);
        Path start = root;
        if (Files.isSymbolicLink(root)) {
            try {
                start = root.toRealPath();
            } catch (IOException e) {
                logger.error("[FileScanner] Cannot resolve linked root " + root + ": " + e.getMessage());
                return files;
            }
            logger.debug("[FileScanner] " + root + " links to " + start);
        }
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() || (attrs.isSymbolicLink() && Files.isRegularFile(file))) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    logger.warn("[FileScanner] Skipping unreadable entry " + file + " (" + e.getMessage() + ")");
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.error("[FileScanner] Failed to walk " + root + ": " + e.getMessage());
        }
        // report paths under the root as given so {home} still matches them
        for (Path file : found) {
            files.add(start == root ? file : root.resolve(start.relativize(file)));
        }
        Collections.sort(files);
        logger.info("[FileScanner] " + files.size() + " files found in " + root);
        return files;
    }
}
