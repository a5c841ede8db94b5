package com.telcomax.assistant.rag;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

/**
 * Loads plain-text documents, chunks them and upserts one vector per chunk into a namespace.
 */
@Component
public class CorpusIngestor {

    private static final Logger log = LoggerFactory.getLogger(CorpusIngestor.class);

    private final Embedder embedder;
    private final VectorIndex vectorIndex;
    private final ResourcePatternResolver resolver;

    public CorpusIngestor(Embedder embedder, VectorIndex vectorIndex) {
        this(embedder, vectorIndex, new PathMatchingResourcePatternResolver());
    }

    CorpusIngestor(Embedder embedder, VectorIndex vectorIndex, ResourcePatternResolver resolver) {
        this.embedder = embedder;
        this.vectorIndex = vectorIndex;
        this.resolver = resolver;
    }

    public List<SourceDocument> load(String pattern) throws IOException {
        Resource[] resources = resolver.getResources(pattern);
        Arrays.sort(resources, Comparator.comparing(r -> String.valueOf(r.getFilename())));

        List<SourceDocument> docs = new ArrayList<>();
        for (Resource r : resources) {
            String text = new String(r.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            String filename = r.getFilename() == null ? "unknown" : r.getFilename();
            String docId = filename.replaceFirst("\\.[^.]+$", "");
            docs.add(new SourceDocument(docId, text));
        }
        log.info("Loaded documents pattern={} count={}", pattern, docs.size());
        return docs;
    }

    public int ingest(List<SourceDocument> documents, String namespace, ChunkStrategy chunker) {
        int count = 0;
        for (SourceDocument doc : documents) {
            for (Chunk chunk : chunker.chunk(doc)) {
                Map<String, String> meta = new HashMap<>();
                meta.put(VectorIndex.META_DOC_ID, chunk.docId());
                meta.put(VectorIndex.META_CHUNK_ID, chunk.chunkId());
                meta.put(VectorIndex.META_TEXT, chunk.text());
                meta.put("chunker", chunker.type().label());

                vectorIndex.upsert(namespace, chunk.id(), embedder.embed(chunk.text()), meta);
                count++;
            }
        }
        log.info("Ingested chunks namespace={} chunker={} documents={} chunks={}",
                namespace, chunker.type().label(), documents.size(), count);
        return count;
    }

    /** Clears the namespace, then ingests. */
    public int reingest(List<SourceDocument> documents, String namespace, ChunkStrategy chunker) {
        vectorIndex.deleteNamespace(namespace);
        return ingest(documents, namespace, chunker);
    }
}
