package com.keypointcensus.core.traversal;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Lists the entries of one directory.
 */
@FunctionalInterface
public interface DirectoryLister {

    /**
     * @param directory directory to list
     * @return every entry, in the order the traversal should visit them
     * @throws IOException if the directory cannot be read
     */
    List<Path> list(Path directory) throws IOException;
}
