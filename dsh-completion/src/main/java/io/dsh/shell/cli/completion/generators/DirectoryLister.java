package io.dsh.shell.cli.completion.generators;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Reads the entries of one directory. */
@FunctionalInterface
public interface DirectoryLister {

  /**
   * One directory entry.
   *
   * @param name file name
   * @param directory whether it is a directory (following links)
   * @param executable whether it is a regular file the current user may execute
   */
  record Entry(String name, boolean directory, boolean executable) {}

  /**
   * Lists {@code dir}, sorted by name.
   *
   * @param dir directory to list
   * @return its entries
   * @throws IOException if the directory cannot be read
   */
  List<Entry> list(Path dir) throws IOException;

  /** Lister backed by the default file system. */
  static DirectoryLister fileSystem() {
    return dir -> {
      try (Stream<Path> stream = Files.list(dir)) {
        return entries(stream);
      }
    };
  }

  /**
   * Reads entries from a directory stream, rethrowing errors raised during iteration as the
   * checked {@link IOException} they wrap.
   */
  static List<Entry> entries(Stream<Path> stream) throws IOException {
    try {
      return stream
          .map(
              p ->
                  new Entry(
                      p.getFileName().toString(),
                      Files.isDirectory(p),
                      Files.isRegularFile(p) && Files.isExecutable(p)))
          .sorted((a, b) -> a.name().compareTo(b.name()))
          .collect(Collectors.toList());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }
}
