package org.learningjava.assessrec.infrastructure.adapter.out.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.learningjava.assessrec.application.port.CatalogIndexPort;
import org.learningjava.assessrec.application.port.CatalogSnapshotPort;
import org.learningjava.assessrec.application.port.EmbeddingPort;
import org.learningjava.assessrec.domain.error.EmbeddingException;
import org.learningjava.assessrec.domain.error.IndexNotFoundException;
import org.learningjava.assessrec.domain.model.catalog.CatalogItem;
import org.learningjava.assessrec.domain.model.retrieval.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * {@link CatalogIndexPort} backed by two files: a vector blob and a JSON metadata array.
 * <p>
 * The in-memory state is a single immutable snapshot behind a volatile reference; searches
 * never lock, and a rebuild replaces vectors and metadata together.
 */
public class FileSystemCatalogIndex implements CatalogIndexPort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemCatalogIndex.class);

    private record State(FlatVectorIndex vectors, List<CatalogItem> meta) {
    }

    private final Path vectorsPath;
    private final Path metaPath;
    private final EmbeddingPort embedding;
    private final CatalogSnapshotPort snapshots;
    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Object lock = new Object();
    private volatile State state; // null until built or loaded

    public FileSystemCatalogIndex(Path vectorsPath,
                                  Path metaPath,
                                  EmbeddingPort embedding,
                                  CatalogSnapshotPort snapshots) {
        this.vectorsPath = vectorsPath;
        this.metaPath = metaPath;
        this.embedding = embedding;
        this.snapshots = snapshots;
    }

    @Override
    public boolean build(Path snapshot, boolean force) {
        synchronized (lock) {
            if (!force && artifactsExist()) {
                log.info("Index already exists at {} / {}. Use force=true to rebuild.", vectorsPath, metaPath);
                return false;
            }

            log.info("Building index from {}", snapshot);
            List<CatalogItem> items = snapshots.read(snapshot);
            List<String> texts = items.stream().map(CatalogItem::textBlob).toList();

            log.info("Embedding {} assessments...", texts.size());
            List<float[]> vectors = embedding.embedBatch(texts);
            if (vectors.size() != items.size()) {
                throw new EmbeddingException("Embedding returned " + vectors.size()
                        + " vectors for " + items.size() + " texts");
            }

            int dim = vectors.isEmpty() ? embedding.dimension() : vectors.get(0).length;
            FlatVectorIndex index = FlatVectorIndex.of(dim, vectors);
            log.info("Index created with {} items (dim={})", index.size(), dim);

            try {
                writeArtifacts(index, items);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write index artifacts to " + vectorsPath.getParent(), e);
            }

            state = new State(index, List.copyOf(items));
            return true;
        }
    }

    @Override
    public void load() {
        if (state != null) return;
        synchronized (lock) {
            if (state != null) return;
            if (!artifactsExist()) {
                throw IndexNotFoundException.missing(vectorsPath, metaPath);
            }

            log.info("Loading index from {}", vectorsPath);
            try {
                VectorIndexCodec.Contents contents = VectorIndexCodec.read(vectorsPath);
                FlatVectorIndex vectors = contents.vectors();
                String current = embedding.modelId();
                if (!contents.modelId().equals(current)) {
                    throw new IndexNotFoundException("Index was built with embedder '" + contents.modelId()
                            + "' (dimension " + vectors.dimension() + ") but the configured embedder is '"
                            + current + "'. Rebuild the index.");
                }
                List<CatalogRow> rows = om.readValue(metaPath.toFile(), new TypeReference<List<CatalogRow>>() {
                });
                if (rows.size() != vectors.size()) {
                    throw new IndexNotFoundException("Index artifacts are corrupt or out of sync: "
                            + vectors.size() + " vectors but " + rows.size() + " metadata rows. Rebuild the index.");
                }
                state = new State(vectors, rows.stream().map(CatalogRow::toItem).toList());
                log.info("Index loaded. Total items: {}", vectors.size());
            } catch (IOException e) {
                throw new IndexNotFoundException("Index artifacts are unreadable: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public List<SearchHit> search(float[] queryVector, int topK) {
        State s = ensureLoaded();
        if (queryVector.length != s.vectors().dimension()) {
            throw new IndexNotFoundException("Index was built with dimension " + s.vectors().dimension()
                    + ", embedder produces " + queryVector.length + ". Rebuild the index.");
        }
        return s.vectors().search(queryVector, topK).stream()
                .map(r -> new SearchHit(r.score(), r.row(), s.meta().get(r.row())))
                .toList();
    }

    @Override
    public int size() {
        return ensureLoaded().meta().size();
    }

    @Override
    public boolean isReady() {
        return state != null;
    }

    @Override
    public boolean artifactsExist() {
        return Files.exists(vectorsPath) && Files.exists(metaPath);
    }

    private State ensureLoaded() {
        State s = state;
        if (s == null) {
            load();
            s = state;
        }
        return s;
    }

    // both files land in temp siblings first so the previous pair stays readable until the moves
    private void writeArtifacts(FlatVectorIndex index, List<CatalogItem> items) throws IOException {
        createParent(vectorsPath);
        createParent(metaPath);

        Path vectorsTmp = vectorsPath.resolveSibling(vectorsPath.getFileName() + ".tmp");
        Path metaTmp = metaPath.resolveSibling(metaPath.getFileName() + ".tmp");
        try {
            VectorIndexCodec.write(index, embedding.modelId(), vectorsTmp);
            om.writeValue(metaTmp.toFile(), items.stream().map(CatalogRow::from).toList());

            move(vectorsTmp, vectorsPath);
            move(metaTmp, metaPath);
        } finally {
            Files.deleteIfExists(vectorsTmp);
            Files.deleteIfExists(metaTmp);
        }
        log.info("Index saved to {}", vectorsPath);
        log.info("Metadata saved to {}", metaPath);
    }

    private static void createParent(Path p) throws IOException {
        Path parent = p.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
