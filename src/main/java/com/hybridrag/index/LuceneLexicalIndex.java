package com.hybridrag.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LuceneLexicalIndex implements LexicalIndex {
    private static final Logger log = LoggerFactory.getLogger(LuceneLexicalIndex.class);
    private static final String NAME = "lexical";
    private static final String ID_FIELD = "chunk_id";
    private static final String CONTENT_FIELD = "content";

    private final Directory directory;
    private final Analyzer analyzer;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final Object writeMonitor = new Object();
    private boolean closed;

    public LuceneLexicalIndex() {
        try {
            this.directory = new ByteBuffersDirectory();
            this.analyzer = new EnglishAnalyzer();
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
            config.setSimilarity(new BM25Similarity());
            this.writer = new IndexWriter(directory, config);
            this.searcherManager = new SearcherManager(writer, new SearcherFactory() {
                @Override
                public IndexSearcher newSearcher(IndexReader reader, IndexReader previousReader) {
                    IndexSearcher searcher = new IndexSearcher(reader);
                    searcher.setSimilarity(new BM25Similarity());
                    return searcher;
                }
            });
        } catch (IOException e) {
            throw new IllegalStateException("Unable to open lexical index", e);
        }
    }

    @Override
    public void replace(Collection<Long> removed, Map<Long, String> added) throws IndexUnavailableException {
        synchronized (writeMonitor) {
            try {
                for (Long chunkId : removed) {
                    writer.deleteDocuments(new Term(ID_FIELD, String.valueOf(chunkId)));
                }
                for (Map.Entry<Long, String> entry : added.entrySet()) {
                    writer.addDocument(toDocument(entry.getKey(), entry.getValue()));
                }
                writer.commit();
                searcherManager.maybeRefreshBlocking();
            } catch (IOException | AlreadyClosedException e) {
                throw new IndexUnavailableException(NAME, "write failed", e);
            }
        }
    }

    @Override
    public List<ScoredChunk> query(String text, int k) throws IndexUnavailableException {
        if (text == null || text.isBlank() || k <= 0) {
            return List.of();
        }
        Query query;
        try {
            // lower-cased so AND, OR and NOT are read as words rather than operators
            query = new QueryParser(CONTENT_FIELD, analyzer).parse(QueryParser.escape(text.toLowerCase(Locale.ROOT)));
        } catch (ParseException e) {
            log.debug("Lexical query produced no searchable terms: {}", e.getMessage());
            return List.of();
        }

        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            TopDocs topDocs = searcher.search(query, k);
            List<ScoredChunk> results = new ArrayList<>(topDocs.scoreDocs.length);
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                Document document = searcher.storedFields().document(scoreDoc.doc);
                results.add(new ScoredChunk(Long.parseLong(document.get(ID_FIELD)), scoreDoc.score));
            }
            return results;
        } catch (IOException | AlreadyClosedException e) {
            throw new IndexUnavailableException(NAME, "search failed", e);
        } finally {
            release(searcher);
        }
    }

    @Override
    public void clear() throws IndexUnavailableException {
        synchronized (writeMonitor) {
            try {
                writer.deleteAll();
                writer.commit();
                searcherManager.maybeRefreshBlocking();
            } catch (IOException | AlreadyClosedException e) {
                throw new IndexUnavailableException(NAME, "clear failed", e);
            }
        }
    }

    @Override
    public void close() throws IOException {
        synchronized (writeMonitor) {
            if (closed) {
                return;
            }
            closed = true;
            searcherManager.close();
            writer.close();
            directory.close();
        }
    }

    private void release(IndexSearcher searcher) throws IndexUnavailableException {
        if (searcher == null) {
            return;
        }
        try {
            searcherManager.release(searcher);
        } catch (IOException e) {
            throw new IndexUnavailableException(NAME, "searcher release failed", e);
        }
    }

    private static Document toDocument(long chunkId, String content) {
        Document document = new Document();
        document.add(new StringField(ID_FIELD, String.valueOf(chunkId), Field.Store.YES));
        document.add(new TextField(CONTENT_FIELD, content, Field.Store.NO));
        return document;
    }
}
