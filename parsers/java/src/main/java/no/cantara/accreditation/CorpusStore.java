package no.cantara.accreditation;

import no.cantara.accreditation.model.CorpusMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the active {@link CorpusSnapshot}.
 *
 * <p>Readers call {@link #current()} once per operation and keep that snapshot for
 * its duration. Loads are serialized; each builds a complete new snapshot and
 * publishes it with a single reference swap, so a reader sees either the old graph
 * or the new one, never a mix. A load that runs out of time is not published.
 */
public class CorpusStore {

    private static final Logger log = LoggerFactory.getLogger(CorpusStore.class);

    private final CorpusLoader loader;
    private final AtomicReference<CorpusSnapshot> current = new AtomicReference<>(CorpusSnapshot.empty());
    private final AtomicLong generations = new AtomicLong();
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Path directory;

    public CorpusStore() {
        this(new CorpusLoader());
    }

    public CorpusStore(CorpusLoader loader) {
        this.loader = loader;
    }

    public CorpusSnapshot current() {
        return current.get();
    }

    public List<CorpusMetadata> metadata() {
        return current().metadata();
    }

    /**
     * Loads {@code directory} and makes it the active corpus.
     *
     * @return the new snapshot, or the unpublished partial snapshot when the load timed out
     */
    public CorpusSnapshot load(Path directory) throws IOException {
        writeLock.lock();
        try {
            CorpusSnapshot next = loader.load(directory, generations.incrementAndGet());
            if (next.timedOut()) {
                log.warn("Corpus load of {} timed out; keeping generation {}", directory, current().generation());
                return next;
            }
            this.directory = directory;
            current.set(next);
            log.info("Published corpus generation {}: {} accreditor(s), {} standard(s)",
                    next.generation(), next.accreditors().size(), next.standardCount());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Rebuilds the corpus from the directory of the last successful load.
     *
     * @throws IllegalStateException if nothing has been loaded from disk yet
     */
    public CorpusSnapshot reload() throws IOException {
        Path dir = directory;
        if (dir == null) {
            throw new IllegalStateException("No corpus directory loaded yet");
        }
        return load(dir);
    }

    /**
     * Publishes a snapshot built in memory, for hosts that assemble corpora themselves.
     */
    public CorpusSnapshot install(CorpusSnapshot.Builder builder) {
        writeLock.lock();
        try {
            CorpusSnapshot next = builder.build(generations.incrementAndGet(), null, false);
            current.set(next);
            log.info("Installed corpus generation {}: {} accreditor(s), {} standard(s)",
                    next.generation(), next.accreditors().size(), next.standardCount());
            return next;
        } finally {
            writeLock.unlock();
        }
    }
}
