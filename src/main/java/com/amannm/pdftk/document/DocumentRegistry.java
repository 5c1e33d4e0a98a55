package com.amannm.pdftk.document;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amannm.pdftk.range.UnknownHandleException;

/**
 * The documents taking part in one operation, keyed by handle.
 * <p>
 * A registry holding a single document uses it as the default for ranges written without a handle;
 * otherwise a default can be named explicitly. Closing the registry closes every document.
 */
public class DocumentRegistry implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    private final SortedMap<String, DocumentSource> sources;
    private final String defaultHandle;

    public DocumentRegistry(Map<String, ? extends DocumentSource> sources) {
        this(sources, null);
    }

    /**
     * @param sources       documents by handle
     * @param defaultHandle handle used for ranges without one, or {@code null} to fall back
     *                      to the only document when exactly one is registered
     */
    public DocumentRegistry(Map<String, ? extends DocumentSource> sources, String defaultHandle) {
        this.sources = Collections.unmodifiableSortedMap(new TreeMap<>(sources));
        if (defaultHandle != null && !this.sources.containsKey(defaultHandle)) {
            throw new UnknownHandleException(defaultHandle);
        }
        this.defaultHandle = defaultHandle;
    }

    /**
     * Loads every file with PDFBox. Documents already loaded are closed again if a later one fails.
     */
    public static DocumentRegistry open(Map<String, Path> files) throws IOException {
        SortedMap<String, DocumentSource> loaded = new TreeMap<>();
        try {
            for (Map.Entry<String, Path> entry : files.entrySet()) {
                log.debug("Loading {} as {}", entry.getValue(), entry.getKey());
                loaded.put(entry.getKey(), PdfDocumentSource.load(entry.getValue()));
            }
        } catch (IOException | RuntimeException e) {
            closeAll(loaded.values(), e);
            throw e;
        }
        return new DocumentRegistry(loaded);
    }

    public boolean contains(String handle) {
        return sources.containsKey(handle);
    }

    public DocumentSource source(String handle) {
        DocumentSource source = sources.get(handle);
        if (source == null) {
            throw new UnknownHandleException(handle);
        }
        return source;
    }

    public int pageCount(String handle) {
        return source(handle).pageCount();
    }

    /**
     * Handles in ascending order.
     */
    public SortedSet<String> handles() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(sources.keySet()));
    }

    public int size() {
        return sources.size();
    }

    public Optional<String> defaultHandle() {
        if (defaultHandle != null) {
            return Optional.of(defaultHandle);
        }
        if (sources.size() == 1) {
            return Optional.of(sources.firstKey());
        }
        return Optional.empty();
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (DocumentSource source : sources.values()) {
            try {
                source.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static void closeAll(Iterable<DocumentSource> sources, Exception failure) {
        for (DocumentSource source : sources) {
            try {
                source.close();
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
