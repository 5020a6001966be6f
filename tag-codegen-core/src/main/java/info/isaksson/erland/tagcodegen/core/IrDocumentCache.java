package info.isaksson.erland.tagcodegen.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import info.isaksson.erland.tagcodegen.ir.IrDocument;
import info.isaksson.erland.tagcodegen.ir.IrJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Parsed IR documents keyed by {@link FileKey}. An unchanged file is parsed once; a modified file
 * gets a new key and is parsed again.
 */
final class IrDocumentCache {

    private static final Logger log = LoggerFactory.getLogger(IrDocumentCache.class);

    static final int MAX_ENTRIES = 1000;

    private final Cache<FileKey, IrDocument> documents = Caffeine.newBuilder()
            .maximumSize(MAX_ENTRIES)
            .build();

    private final AtomicInteger parses = new AtomicInteger();

    IrDocument load(Path file) throws IOException {
        FileKey key = FileKey.of(file);
        try {
            return documents.get(key, k -> parse(k.path));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private IrDocument parse(Path file) {
        log.debug("Parsing IR {}", file);
        parses.incrementAndGet();
        try {
            return IrJson.read(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    int parseCount() {
        return parses.get();
    }
}
