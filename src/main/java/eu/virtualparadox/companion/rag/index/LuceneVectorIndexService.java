package eu.virtualparadox.companion.rag.index;

import eu.virtualparadox.companion.ingest.model.Chunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermInSetQuery;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.util.BytesRef;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static eu.virtualparadox.companion.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 * <p>
 * Each chunk is stored as one Lucene {@link Document}:
 * <ul>
 *   <li>{@code docId}, {@code chunkId} – {@link StringField}, stored; used for filtering and deletion</li>
 *   <li>{@code text}, {@code ordinal}, {@code fromPage}, {@code toPage} – stored only</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField} with cosine similarity (HNSW indexed)</li>
 * </ul>
 *
 * <h3>Consistency</h3>
 * Mutations are serialized by a single lock and end with a commit followed by a searcher refresh.
 * Searches run on whatever point-in-time searcher {@link SearcherManager} holds and never refresh it,
 * so a reader sees a document's chunks either all or not at all.
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an index.
 * Changing the embedding backend requires a fresh index directory.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class LuceneVectorIndexService implements VectorIndexService {

    private static final int OVERSAMPLING = 2;

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    private final ReentrantLock mutationLock = new ReentrantLock();

    /**
     * First-seen vector dimension, validated on subsequent inserts.
     */
    private Integer vectorDim;

    /**
     * Adds or replaces all chunks for a given document in one atomic block.
     *
     * @throws IllegalArgumentException if inputs are empty or the sizes/dimensions disagree
     */
    @Override
    public void upsert(final String docId,
                       final List<Chunk> chunks,
                       final List<float[]> vectors) throws IOException {

        requireNonNullOrEmpty(docId, "docId");
        requireNonNullOrEmpty(chunks, "chunks");
        requireNonNullOrEmpty(vectors, "vectors");

        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }

        final int dim = vectors.get(0).length;
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }

        final List<Document> documents = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            documents.add(buildLuceneDocument(docId, chunks.get(i), vectors.get(i)));
        }

        mutationLock.lock();
        try {
            ensureConsistentDimension(dim);
            writer.updateDocuments(new Term(FIELD_DOC_ID, docId), documents);
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } finally {
            mutationLock.unlock();
        }
        log.debug("Indexed {} chunks for document {}", chunks.size(), docId);
    }

    @Override
    public List<ScoredChunk> search(final float[] queryVector,
                                    final int k,
                                    final Collection<String> docFilter) throws IOException {
        if (k <= 0 || (docFilter != null && docFilter.isEmpty())) {
            return List.of();
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            if (searcher.getIndexReader().numDocs() == 0) {
                return List.of();
            }

            final Query filter = docFilter == null ? null : new TermInSetQuery(FIELD_DOC_ID,
                    docFilter.stream().map(BytesRef::new).toList());
            final int candidates = k * OVERSAMPLING;

            final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, queryVector, candidates, filter);
            final TopDocs topDocs = searcher.search(knn, candidates);
            final StoredFields storedFields = searcher.storedFields();

            final List<ScoredChunk> results = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                results.add(new ScoredChunk(
                        doc.get(FIELD_DOC_ID),
                        doc.get(FIELD_CHUNK_ID),
                        doc.getField(FIELD_ORDINAL).numericValue().intValue(),
                        doc.get(FIELD_TEXT),
                        doc.getField(FIELD_FROM_PAGE).numericValue().intValue(),
                        doc.getField(FIELD_TO_PAGE).numericValue().intValue(),
                        toCosine(sd.score)
                ));
            }

            results.sort(Comparator.comparingDouble(ScoredChunk::score).reversed()
                    .thenComparing(ScoredChunk::chunkId));
            return results.size() > k ? List.copyOf(results.subList(0, k)) : results;
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Deletes all chunks associated with the given {@code docId}.
     *
     * @return number of chunks that were removed
     */
    @Override
    public int deleteByDocument(final String docId) throws IOException {
        requireNonNullOrEmpty(docId, "docId");
        mutationLock.lock();
        try {
            final int existing = countByDocument(docId);
            if (existing == 0) {
                return 0;
            }
            writer.deleteDocuments(new Term(FIELD_DOC_ID, docId));
            writer.commit();
            searcherManager.maybeRefreshBlocking();
            log.debug("Removed {} chunks of document {}", existing, docId);
            return existing;
        } finally {
            mutationLock.unlock();
        }
    }

    @Override
    public int countByDocument(final String docId) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.count(new TermQuery(new Term(FIELD_DOC_ID, docId)));
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Lucene reports cosine similarity as {@code (1 + cos) / 2}.
     */
    private static float toCosine(final float luceneScore) {
        return 2f * luceneScore - 1f;
    }

    private void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private Document buildLuceneDocument(final String docId,
                                         final Chunk c,
                                         final float[] vec) {
        final Document d = new Document();

        d.add(new StringField(FIELD_DOC_ID, docId, Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, c.chunkId(), Field.Store.YES));
        d.add(new StoredField(FIELD_ORDINAL, c.ordinal()));
        d.add(new StoredField(FIELD_TEXT, c.text()));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));
        d.add(new StoredField(FIELD_FROM_PAGE, c.pageStart()));
        d.add(new StoredField(FIELD_TO_PAGE, c.pageEnd()));

        return d;
    }

    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
