package net.certrevoke.client.core.transport;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.io.FileUtils;

public class LocalFileSystemReader implements FileSystemReader {
  public static final LocalFileSystemReader INSTANCE = new LocalFileSystemReader();

  @Override
  public void stat(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new FileNotFoundException("File does not exist: " + path);
    }
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new IOException("File is not a readable regular file: " + path);
    }
  }

  @Override
  public byte[] readAll(Path path) throws IOException {
    return FileUtils.readFileToByteArray(path.toFile());
  }
}
