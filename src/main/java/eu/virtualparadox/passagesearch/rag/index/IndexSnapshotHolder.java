package eu.virtualparadox.passagesearch.rag.index;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes the current {@link IndexSnapshot}.
 * <p>
 * Queries read the reference once and keep using that snapshot until they finish, so a rebuild
 * never exposes a half-built index.
 */
@Slf4j
@Component
public class IndexSnapshotHolder {

    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>();

    /**
     * @return the published snapshot
     * @throws NotIndexedException if nothing has been published yet
     */
    public IndexSnapshot current() {
        final IndexSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new NotIndexedException();
        }
        return snapshot;
    }

    public Optional<IndexSnapshot> find() {
        return Optional.ofNullable(current.get());
    }

    public boolean isIndexed() {
        return current.get() != null;
    }

    /**
     * Atomically replaces the published snapshot.
     *
     * @return the previous snapshot, if any
     */
    public Optional<IndexSnapshot> publish(final IndexSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        final IndexSnapshot previous = current.getAndSet(snapshot);
        log.info("Published index snapshot v{} ({} chunks)", snapshot.version(), snapshot.size());
        return Optional.ofNullable(previous);
    }
}
