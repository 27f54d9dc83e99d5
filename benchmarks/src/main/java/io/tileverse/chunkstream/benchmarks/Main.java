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

import java.util.Collection;
import org.openjdk.jmh.profile.GCProfiler;
import org.openjdk.jmh.results.RunResult;
import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

/**
 * Main entry point for running the chunk ingestion benchmarks, specified in the JAR manifest.
 * <p>
 * Options override the JMH defaults and the {@code @Param} values of
 * {@link ChunkIngestorBenchmark}; run with {@code --help} for the list.
 */
public class Main {

    private int forks = 1;
    private int warmupIterations = 3;
    private int measurementIterations = 5;
    private int warmupTime = 5;
    private int measurementTime = 10;
    private boolean enableProfiler;
    private String outputFile;
    private ResultFormatType resultFormat = ResultFormatType.TEXT;

    // benchmark parameter overrides, comma separated lists
    private String workers;
    private String bufferSeed;
    private String bufferSize;
    private String sourceSize;
    private String recordLength;

    /**
     * Main method for running benchmarks from command line.
     *
     * @param args command line options
     * @throws RunnerException if an error occurs during benchmark execution
     */
    public static void main(String[] args) throws RunnerException {
        System.out.println("Starting chunk ingestion benchmarks...");
        Main main = parseArgs(args);
        Collection<RunResult> results = main.run();
        if (results.isEmpty()) {
            System.out.println("Benchmarks did not produce results.");
        } else {
            System.out.println("Benchmarks completed successfully!");
        }
    }

    private static Main parseArgs(String[] args) {
        Main config = new Main();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            try {
                switch (arg) {
                    case "--forks" -> config.forks = Integer.parseInt(value(args, ++i, arg));
                    case "--warmup-iterations" -> config.warmupIterations = Integer.parseInt(value(args, ++i, arg));
                    case "--measurement-iterations" ->
                        config.measurementIterations = Integer.parseInt(value(args, ++i, arg));
                    case "--warmup-time" -> config.warmupTime = Integer.parseInt(value(args, ++i, arg));
                    case "--measurement-time" -> config.measurementTime = Integer.parseInt(value(args, ++i, arg));
                    case "--output-format" -> config.resultFormat =
                            ResultFormatType.valueOf(value(args, ++i, arg).toUpperCase());
                    case "--output-file" -> config.outputFile = value(args, ++i, arg);
                    case "--profiler" -> config.enableProfiler = true;
                    case "--workers" -> config.workers = value(args, ++i, arg);
                    case "--buffer-seed" -> config.bufferSeed = value(args, ++i, arg);
                    case "--buffer-size" -> config.bufferSize = value(args, ++i, arg);
                    case "--source-size" -> config.sourceSize = value(args, ++i, arg);
                    case "--record-length" -> config.recordLength = value(args, ++i, arg);
                    case "--help" -> {
                        printUsage();
                        System.exit(0);
                    }
                    default -> {
                        System.err.println("Unknown option: " + arg);
                        printUsage();
                        System.exit(1);
                    }
                }
            } catch (IllegalArgumentException e) {
                System.err.println("Error parsing argument '" + arg + "': " + e.getMessage());
                printUsage();
                System.exit(1);
            }
        }
        return config;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static void printUsage() {
        System.out.println("Chunk Ingestion Benchmark Runner");
        System.out.println("--------------------------------");
        System.out.println("Usage: java -jar <your-benchmark-jar>.jar [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --forks <n>                   Number of forks to use. Default: 1");
        System.out.println("  --warmup-iterations <n>       Number of warmup iterations. Default: 3");
        System.out.println("  --measurement-iterations <n>  Number of measurement iterations. Default: 5");
        System.out.println("  --warmup-time <seconds>       Warmup time per iteration in seconds. Default: 5");
        System.out.println("  --measurement-time <seconds>  Measurement time per iteration in seconds. Default: 10");
        System.out.println("  --output-format <format>      Output format (CSV, JSON, SCSV, TEXT). Default: TEXT");
        System.out.println("  --output-file <file>          Output file for results. Default: none");
        System.out.println("  --profiler                    Enable GC profiling. Default: false");
        System.out.println();
        System.out.println("  Benchmark Parameters (override @Param defaults, comma separated):");
        System.out.println("  --workers <n,...>             Maximum concurrent chunks");
        System.out.println("  --buffer-seed <n,...>         Buffers allocated up front");
        System.out.println("  --buffer-size <bytes,...>     Initial chunk size");
        System.out.println("  --source-size <bytes,...>     Size of the generated source");
        System.out.println("  --record-length <bytes,...>   Average record length");
        System.out.println();
        System.out.println("  --help                        Print this help message");
    }

    private Collection<RunResult> run() throws RunnerException {
        ChainedOptionsBuilder options = new OptionsBuilder()
                .include(ChunkIngestorBenchmark.class.getSimpleName())
                .warmupIterations(warmupIterations)
                .warmupTime(TimeValue.seconds(warmupTime))
                .measurementIterations(measurementIterations)
                .measurementTime(TimeValue.seconds(measurementTime))
                .forks(forks)
                .shouldFailOnError(true)
                .shouldDoGC(true);

        if (enableProfiler) {
            options.addProfiler(GCProfiler.class);
        }
        if (outputFile != null) {
            options.resultFormat(resultFormat);
            options.result(outputFile);
        }
        param(options, "workers", workers);
        param(options, "bufferSeed", bufferSeed);
        param(options, "bufferSize", bufferSize);
        param(options, "sourceSize", sourceSize);
        param(options, "recordLength", recordLength);

        return new Runner(options.build()).run();
    }

    private static void param(ChainedOptionsBuilder options, String name, String values) {
        if (values != null) {
            options.param(name, values.split(","));
        }
    }
}
