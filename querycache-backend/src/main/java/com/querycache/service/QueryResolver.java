package com.querycache.service;

import com.querycache.model.ResolvedQuery;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Resolves a query source, either a {@code .sql} file reference or inline SQL, into query text and a cache key.
 *
 * File sources are keyed by their base name, so two files with the same name in different directories share
 * a cache entry. Inline sources are keyed by the MD5 digest of the trimmed text.
 */
public class QueryResolver {

    static final String SQL_EXTENSION = ".sql";
    static final String CACHE_EXTENSION = ".parquet";

    private final Path sqlRoot;

    /**
     * Create a resolver.
     *
     * @param sqlRoot directory relative file references are resolved under
     */
    public QueryResolver(Path sqlRoot) {
        this.sqlRoot = sqlRoot;
    }

    /**
     * Resolve a query source.
     *
     * @param querySource file reference ending in {@code .sql}, or SQL text starting with {@code select} or {@code with}
     * @return resolved query
     * @throws IOException when the SQL file cannot be read
     * @throws SqlFileNotFoundException when the SQL file does not exist
     * @throws QueryValidationException when inline text is not a read-only statement
     */
    public ResolvedQuery resolve(String querySource) throws IOException {
        if (querySource == null) {
            throw new QueryValidationException(invalidSourceMessage());
        }
        if (isFileReference(querySource)) {
            Path file = resolveFile(querySource);
            if (!Files.isRegularFile(file)) {
                throw new SqlFileNotFoundException(file);
            }
            return ResolvedQuery.builder()
                    .text(Files.readString(file, StandardCharsets.UTF_8))
                    .cacheKey(cacheKeyForFile(file))
                    .sourceFile(file)
                    .build();
        }

        String text = inlineText(querySource);
        return ResolvedQuery.builder()
                .text(text)
                .cacheKey(md5Hex(text) + CACHE_EXTENSION)
                .build();
    }

    /**
     * Compute the cache key of a query source without reading it.
     *
     * File references need not exist, so entries of deleted files can still be addressed.
     *
     * @param querySource file reference or inline SQL text
     * @return cache key
     * @throws QueryValidationException when inline text is not a read-only statement
     */
    public String cacheKeyOf(String querySource) {
        if (querySource == null) {
            throw new QueryValidationException(invalidSourceMessage());
        }
        if (isFileReference(querySource)) {
            return cacheKeyForFile(resolveFile(querySource));
        }
        return md5Hex(inlineText(querySource)) + CACHE_EXTENSION;
    }

    /**
     * Whether a source names a SQL file rather than carrying SQL text.
     *
     * @param querySource source
     * @return true for {@code *.sql} references (case-insensitive)
     */
    public static boolean isFileReference(String querySource) {
        return querySource.toLowerCase(Locale.ROOT).endsWith(SQL_EXTENSION);
    }

    /**
     * Place a file reference under the SQL root unless it is already there.
     *
     * Absolute paths are used as given.
     *
     * @param reference file reference
     * @return resolved path
     */
    Path resolveFile(String reference) {
        Path path = Path.of(reference);
        if (path.isAbsolute() || path.normalize().startsWith(sqlRoot.normalize())) {
            return path;
        }
        return sqlRoot.resolve(path);
    }

    static boolean isReadOnlyStatement(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.startsWith("select") || lower.startsWith("with");
    }

    static String cacheKeyForFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem + CACHE_EXTENSION;
    }

    static String md5Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }

    private static String inlineText(String querySource) {
        String text = querySource.trim();
        if (!isReadOnlyStatement(text)) {
            throw new QueryValidationException(invalidSourceMessage());
        }
        return text;
    }

    private static String invalidSourceMessage() {
        return "The input must be a filename ending with '.sql' or a SQL query starting with 'select' or 'with'";
    }
}
