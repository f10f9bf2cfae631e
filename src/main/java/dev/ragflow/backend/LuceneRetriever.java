package dev.ragflow.backend;

import dev.ragflow.model.Document;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * BM25 retriever over an in-memory Lucene index. The corpus is fixed at
 * construction; afterwards the retriever is read-only and safe to share.
 *
 * <p>When a {@link Reranker} is configured and a rerank depth is requested, the
 * first {@code rerankTopK} BM25 hits are rescored, sorted by descending reranker
 * score, and only those are returned.
 */
public class LuceneRetriever implements Retriever, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LuceneRetriever.class);

    private static final String CONTENT = "content";
    private static final String ORDINAL = "ordinal";

    private final Directory directory;
    private final Analyzer analyzer;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final List<Document> corpus;
    private final Reranker reranker; // nullable

    public LuceneRetriever(List<Document> documents, Reranker reranker) {
        this.corpus = List.copyOf(documents);
        this.reranker = reranker;
        this.directory = new ByteBuffersDirectory();
        this.analyzer = new StandardAnalyzer();
        try {
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setSimilarity(new BM25Similarity());
            try (IndexWriter writer = new IndexWriter(directory, config)) {
                for (int i = 0; i < corpus.size(); i++) {
                    var doc = new org.apache.lucene.document.Document();
                    doc.add(new StoredField(ORDINAL, i));
                    doc.add(new TextField(CONTENT, corpus.get(i).content(), Field.Store.NO));
                    writer.addDocument(doc);
                }
                writer.commit();
            }
            this.reader = DirectoryReader.open(directory);
        } catch (IOException e) {
            throw new CapabilityException("retriever", "failed to build index", e);
        }
        this.searcher = new IndexSearcher(reader);
        this.searcher.setSimilarity(new BM25Similarity());
        log.info("Indexed {} documents", corpus.size());
    }

    /**
     * Index every {@code .txt} and {@code .md} file of a directory, one document per
     * file, tagged with {@code source=<file name>}.
     */
    public static LuceneRetriever fromDirectory(Path dir, Reranker reranker) throws IOException {
        var documents = new ArrayList<Document>();
        try (Stream<Path> files = Files.list(dir)) {
            List<Path> sorted = files
                .filter(Files::isRegularFile)
                .filter(p -> {
                    String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
                    return name.endsWith(".txt") || name.endsWith(".md");
                })
                .sorted()
                .toList();
            for (Path file : sorted) {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                if (!content.isBlank()) {
                    documents.add(Document.of(content.strip(), file.getFileName().toString()));
                }
            }
        }
        return new LuceneRetriever(documents, reranker);
    }

    public int size() {
        return corpus.size();
    }

    @Override
    public List<Document> retrieve(String query, int nResults, Integer rerankTopK) {
        if (nResults < 1) {
            throw new IllegalArgumentException("nResults must be positive: " + nResults);
        }
        List<Document> hits = search(query, nResults);
        if (reranker == null || rerankTopK == null || hits.isEmpty()) {
            return hits;
        }
        return rerank(query, hits.subList(0, Math.min(rerankTopK, hits.size())));
    }

    private List<Document> search(String query, int nResults) {
        try {
            Query luceneQuery = new QueryParser(CONTENT, analyzer).parse(QueryParser.escape(query));
            TopDocs topDocs = searcher.search(luceneQuery, nResults);
            var results = new ArrayList<Document>(topDocs.scoreDocs.length);
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                int ordinal = searcher.storedFields().document(scoreDoc.doc)
                    .getField(ORDINAL).numericValue().intValue();
                results.add(withScore(corpus.get(ordinal), "bm25_score", scoreDoc.score));
            }
            return results;
        } catch (ParseException | IOException e) {
            throw new CapabilityException("retriever", e.getMessage(), e);
        }
    }

    private List<Document> rerank(String query, List<Document> candidates) {
        log.debug("Reranking top {} results", candidates.size());
        record Scored(Document document, double score) {}
        var scored = new ArrayList<Scored>(candidates.size());
        for (Document candidate : candidates) {
            scored.add(new Scored(candidate, reranker.score(query, candidate.content())));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        return scored.stream()
            .map(s -> withScore(s.document(), "rerank_score", s.score()))
            .toList();
    }

    private static Document withScore(Document document, String key, double score) {
        Map<String, String> metadata = new HashMap<>(document.metadata());
        metadata.put(key, Double.toString(score));
        return new Document(document.content(), metadata);
    }

    @Override
    public void close() throws IOException {
        reader.close();
        directory.close();
        analyzer.close();
    }
}
