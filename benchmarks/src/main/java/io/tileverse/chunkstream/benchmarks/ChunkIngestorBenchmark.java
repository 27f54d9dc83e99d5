/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chunkstream.benchmarks;

import io.tileverse.chunkstream.ChunkIngestor;
import io.tileverse.chunkstream.IngestConfig;
import io.tileverse.chunkstream.IngestContext;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

/**
 * Measures ingestion throughput of an in-memory source of delimited records.
 * <p>
 * The source is generated once per trial: records of random printable bytes, each ended by
 * {@link #DELIMITER}. Processors count the records in each chunk, so the work per chunk is
 * proportional to its length, like a line parser would be.
 */
@BenchmarkMode({Mode.Throughput})
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
public class ChunkIngestorBenchmark {

    static final byte DELIMITER = '\n';

    /**
     * Maximum number of chunks processed concurrently.
     */
    @Param({"1", "4", "16"})
    public int workers;

    /**
     * Buffers allocated before reading starts.
     */
    @Param({"0", "16"})
    public int bufferSeed;

    /**
     * Initial chunk size.
     */
    @Param({"65536", "1048576"}) // 64KB, 1MB
    public int bufferSize;

    /**
     * Size of the generated source.
     */
    @Param({"67108864"}) // 64MB
    public int sourceSize;

    /**
     * Average record length, records vary from half to one and a half times this.
     */
    @Param({"300"})
    public int recordLength;

    private byte[] source;

    private long expectedRecords;

    @Setup(Level.Trial)
    public void setupTrial() {
        Random random = new Random(42); // Fixed seed for reproducibility
        source = new byte[sourceSize];
        int next = nextRecordEnd(random, 0);
        for (int i = 0; i < sourceSize; i++) {
            if (i == next) {
                source[i] = DELIMITER;
                expectedRecords++;
                next = nextRecordEnd(random, i + 1);
            } else {
                source[i] = (byte) (' ' + random.nextInt(95));
            }
        }
    }

    private int nextRecordEnd(Random random, int start) {
        int half = Math.max(1, recordLength / 2);
        return start + half + random.nextInt(recordLength);
    }

    /**
     * Delimiter-aligned chunks, each scanned for record ends.
     */
    @Benchmark
    public long ingestRecords() throws IOException {
        LongAdder records = new LongAdder();
        IngestConfig config = config()
                .processor((context, chunk) -> records.add(countDelimiters(chunk.buffer())))
                .build();

        ChunkIngestor.ingest(config, IngestContext.background(), new ByteArrayInputStream(source));
        long count = records.sum();
        if (count != expectedRecords) {
            throw new IllegalStateException("Expected %d records, got %d".formatted(expectedRecords, count));
        }
        return count;
    }

    /**
     * Fixed-size chunks, touching every byte but ignoring record boundaries.
     */
    @Benchmark
    public long ingestFixedSizeChunks() throws IOException {
        LongAdder checksum = new LongAdder();
        IngestConfig config = config()
                .noDelimiter(true)
                .processor((context, chunk) -> checksum.add(sum(chunk.buffer())))
                .build();

        ChunkIngestor.ingest(config, IngestContext.background(), new ByteArrayInputStream(source));
        return checksum.sum();
    }

    private IngestConfig.Builder config() {
        return IngestConfig.builder()
                .workers(workers)
                .bufferSeed(bufferSeed)
                .bufferSize(bufferSize)
                .delimiter(DELIMITER);
    }

    private static long countDelimiters(ByteBuffer buffer) {
        long count = 0;
        while (buffer.hasRemaining()) {
            if (buffer.get() == DELIMITER) {
                count++;
            }
        }
        return count;
    }

    private static long sum(ByteBuffer buffer) {
        long sum = 0;
        while (buffer.hasRemaining()) {
            sum += buffer.get();
        }
        return sum;
    }
}
