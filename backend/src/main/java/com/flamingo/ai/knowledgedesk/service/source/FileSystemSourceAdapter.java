package com.flamingo.ai.knowledgedesk.service.source;

import com.flamingo.ai.knowledgedesk.exception.PermanentSourceException;
import com.flamingo.ai.knowledgedesk.exception.TransientSourceException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;

/** {@link SourceAdapter} over a local or mounted directory tree. */
@Slf4j
public class FileSystemSourceAdapter implements SourceAdapter {

  private final Tika tika = new Tika();

  @Override
  public List<DocumentDescriptor> list(SourceConfig config) {
    Path root = Paths.get(config.root()).toAbsolutePath().normalize();
    if (!Files.isDirectory(root)) {
      throw PermanentSourceException.notFound(root.toString());
    }
    try (Stream<Path> files = config.recursive() ? Files.walk(root) : Files.list(root)) {
      List<DocumentDescriptor> descriptors =
          files
              .filter(Files::isRegularFile)
              .map(file -> describe(root, file))
              .filter(d -> config.accepts(d.path()))
              .sorted((a, b) -> a.path().compareTo(b.path()))
              .toList();
      log.debug("Listed {} files under {}", descriptors.size(), root);
      return descriptors;
    } catch (UncheckedIOException e) {
      throw translate(root.toString(), e.getCause());
    } catch (IOException e) {
      throw translate(root.toString(), e);
    }
  }

  @Override
  public SourceDocument fetch(DocumentDescriptor descriptor) {
    Path file = Paths.get(descriptor.sourceId());
    try {
      byte[] content = Files.readAllBytes(file);
      return new SourceDocument(descriptor, content, tika.detect(file.getFileName().toString()));
    } catch (IOException e) {
      throw translate(descriptor.path(), e);
    }
  }

  private DocumentDescriptor describe(Path root, Path file) {
    String relative = root.relativize(file).toString().replace('\\', '/');
    try {
      return new DocumentDescriptor(
          relative,
          Files.getLastModifiedTime(file).toInstant(),
          file.getFileName().toString(),
          file.toUri().toString(),
          file.toString());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private RuntimeException translate(String path, IOException e) {
    if (e instanceof NoSuchFileException) {
      return PermanentSourceException.notFound(path);
    }
    if (e instanceof AccessDeniedException) {
      return PermanentSourceException.accessDenied(path);
    }
    return new TransientSourceException("I/O error reading " + path + ": " + e.getMessage(), e);
  }
}
