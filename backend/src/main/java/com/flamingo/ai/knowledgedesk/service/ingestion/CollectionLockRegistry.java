package com.flamingo.ai.knowledgedesk.service.ingestion;

import com.flamingo.ai.knowledgedesk.exception.IngestionAlreadyRunningException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Process-wide registry of collections with an active sync. At most one run holds a collection.
 *
 * <p>Holding is not tied to a thread, so a second acquire from the same thread is refused too.
 */
@Component
@Slf4j
public class CollectionLockRegistry {

  private final Set<String> held = ConcurrentHashMap.newKeySet();

  /**
   * Takes the lock for a collection without waiting.
   *
   * @throws IngestionAlreadyRunningException if another run holds it
   */
  public CollectionLock acquire(String collection) {
    if (!held.add(collection)) {
      throw new IngestionAlreadyRunningException(collection);
    }
    log.debug("Acquired ingestion lock for {}", collection);
    return new CollectionLock(collection);
  }

  public boolean isLocked(String collection) {
    return held.contains(collection);
  }

  /** A held collection lock; closing it releases the collection. Closing twice is a no-op. */
  public final class CollectionLock implements AutoCloseable {

    private final String collection;
    private boolean released;

    private CollectionLock(String collection) {
      this.collection = collection;
    }

    public String getCollection() {
      return collection;
    }

    @Override
    public synchronized void close() {
      if (!released) {
        released = true;
        held.remove(collection);
        log.debug("Released ingestion lock for {}", collection);
      }
    }
  }
}
