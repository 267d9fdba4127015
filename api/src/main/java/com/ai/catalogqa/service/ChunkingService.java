package com.ai.catalogqa.service;

import com.ai.catalogqa.dto.ChunkRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for splitting text content into overlapping chunks.
 * Splits on a prioritized list of separators (paragraph, line, space, character),
 * recursing into any piece that is still too long, then merges neighbouring pieces
 * back up to {@code chunkSize} characters with up to {@code chunkOverlap} characters
 * carried over between consecutive chunks.
 */
@Service
public class ChunkingService {

    private static final Logger log = LoggerFactory.getLogger(ChunkingService.class);

    static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;

    public ChunkingService(
            @Value("${chunking.chunk-size:512}") int chunkSize,
            @Value("${chunking.chunk-overlap:50}") int chunkOverlap) {
        if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(String.format(
                    "Invalid chunking parameters: chunkSize=%d, chunkOverlap=%d", chunkSize, chunkOverlap));
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    /**
     * Split text into ordered, overlapping segments.
     *
     * @param text The text content to chunk
     * @return Segments in document order; empty for null or empty input
     */
    public List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> chunks = splitRecursive(text, SEPARATORS);
        log.debug("[ChunkingService] Split {} chars into {} chunks (size={}, overlap={})",
                text.length(), chunks.size(), chunkSize, chunkOverlap);
        return chunks;
    }

    /**
     * Chunk every record, carrying its non-text fields onto each resulting chunk.
     * {@code sectionIndex} is the 0-based position of the chunk within its record.
     */
    public List<ChunkRecord> transform(List<Map<String, Object>> records) {
        List<ChunkRecord> chunked = new ArrayList<>();
        for (Map<String, Object> record : records) {
            Object rawText = record.get("text");
            String text = rawText == null ? "" : String.valueOf(rawText);

            Map<String, Object> base = new LinkedHashMap<>(record);
            base.remove("text");
            Object docId = record.get("doc_id");
            String sourceDocId = docId == null ? null : String.valueOf(docId);

            List<String> pieces = split(text);
            for (int i = 0; i < pieces.size(); i++) {
                chunked.add(new ChunkRecord(pieces.get(i), sourceDocId, i, base));
            }
        }
        log.info("[ChunkingService] Transformed {} records into {} chunks", records.size(), chunked.size());
        return chunked;
    }

    private List<String> splitRecursive(String text, List<String> separators) {
        List<String> finalChunks = new ArrayList<>();

        String separator = separators.get(separators.size() - 1);
        List<String> remaining = List.of();
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                remaining = separators.subList(i + 1, separators.size());
                break;
            }
        }

        List<String> goodSplits = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                goodSplits.add(piece);
                continue;
            }
            if (!goodSplits.isEmpty()) {
                finalChunks.addAll(mergeSplits(goodSplits));
                goodSplits = new ArrayList<>();
            }
            if (remaining.isEmpty()) {
                // atomic unit longer than chunkSize
                finalChunks.add(piece);
            } else {
                finalChunks.addAll(splitRecursive(piece, remaining));
            }
        }
        if (!goodSplits.isEmpty()) {
            finalChunks.addAll(mergeSplits(goodSplits));
        }
        return finalChunks;
    }

    /**
     * Split on a literal separator, attaching each separator to the start of the piece
     * that follows it so no characters are lost. The empty separator splits into code points.
     */
    static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
            return pieces;
        }
        int start = 0;
        int idx = text.indexOf(separator);
        while (idx >= 0) {
            if (idx > start) {
                pieces.add(text.substring(start, idx));
            }
            start = idx;
            idx = text.indexOf(separator, idx + separator.length());
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }

    private List<String> mergeSplits(List<String> splits) {
        List<String> docs = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int total = 0;

        for (String piece : splits) {
            int len = piece.length();
            if (total + len > chunkSize && !current.isEmpty()) {
                if (total > chunkSize) {
                    log.warn("[ChunkingService] Created a chunk of size {}, which is longer than the specified {}",
                            total, chunkSize);
                }
                addIfNotBlank(docs, String.join("", current));
                while (total > chunkOverlap || (total + len > chunkSize && total > 0)) {
                    total -= current.remove(0).length();
                }
            }
            current.add(piece);
            total += len;
        }
        addIfNotBlank(docs, String.join("", current));
        return docs;
    }

    private static void addIfNotBlank(List<String> docs, String doc) {
        if (!doc.isBlank()) {
            docs.add(doc);
        }
    }
}
