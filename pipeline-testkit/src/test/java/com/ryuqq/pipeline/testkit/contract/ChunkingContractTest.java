package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.chunking.Chunk;
import com.ryuqq.pipeline.core.chunking.ChunkStrategy;
import com.ryuqq.pipeline.core.chunking.TextChunker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: fixed-window chunking (Scenario D, round trip and overlap equality).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class ChunkingContractTest {

    private final TextChunker chunker = new TextChunker();

    private static String document(int length) {
        StringBuilder builder = new StringBuilder(length);
        String alphabet = "abcdefghijklmnopqrstuvwxyz ";
        for (int i = 0; i < length; i++) {
            builder.append(alphabet.charAt((i * 7) % alphabet.length()));
        }
        return builder.toString();
    }

    @Test
    void testScenarioD_ThousandChars_FourChunksWithIncreasingOffsets() {
        // Given
        String content = document(1000);

        // When
        List<Chunk> chunks = chunker.chunk(content, ChunkStrategy.FIXED_WINDOW, 300, 50);

        // Then
        assertEquals(4, chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            assertEquals(i, chunks.get(i).chunkIndex());
            if (i > 0) {
                assertTrue(chunks.get(i).startOffset() > chunks.get(i - 1).startOffset());
            }
        }
        assertEquals(List.of(0, 250, 500, 750), chunks.stream().map(Chunk::startOffset).toList());
        assertEquals(1000, chunks.get(3).endOffset());
    }

    @ParameterizedTest
    @CsvSource({"1000, 300", "1000, 1000", "999, 100", "17, 5", "5, 64"})
    void testFixedWindow_NoOverlap_ConcatenationRestoresInput(int length, int size) {
        // Given
        String content = document(length);

        // When
        List<Chunk> chunks = chunker.chunk(content, ChunkStrategy.FIXED_WINDOW, size, 0);

        // Then
        assertEquals(content, chunks.stream().map(Chunk::content).collect(Collectors.joining()));
        for (Chunk chunk : chunks) {
            assertEquals(content.substring(chunk.startOffset(), chunk.endOffset()), chunk.content());
        }
    }

    @ParameterizedTest
    @CsvSource({"1000, 300, 50", "1000, 100, 99", "640, 64, 16", "301, 300, 1"})
    void testFixedWindow_WithOverlap_ConsecutiveChunksShareOverlap(int length, int size, int overlap) {
        // Given
        String content = document(length);

        // When
        List<Chunk> chunks = chunker.chunk(content, ChunkStrategy.FIXED_WINDOW, size, overlap);

        // Then
        assertTrue(chunks.size() > 1);
        for (int i = 0; i + 1 < chunks.size(); i++) {
            String previous = chunks.get(i).content();
            String next = chunks.get(i + 1).content();
            assertEquals(previous.substring(previous.length() - overlap), next.substring(0, overlap),
                "Overlap mismatch between chunk " + i + " and " + (i + 1));
        }
    }
}
