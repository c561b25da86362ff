package net.certrevoke.client.core.transport;

import java.io.IOException;
import java.nio.file.Path;

/** Filesystem access used to load a pinned local CRL. */
public interface FileSystemReader {
  /**
   * @param path file to inspect
   * @throws IOException if the file does not exist or is not a readable regular file
   */
  void stat(Path path) throws IOException;

  byte[] readAll(Path path) throws IOException;
}
