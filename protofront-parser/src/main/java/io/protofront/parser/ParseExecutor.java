/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.protofront.parser;

import io.protofront.common.FileUtils;
import io.protofront.common.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Parses many files on a fixed pool, one task per file. Tasks share nothing: each gets
 * its own lexer, file info and error handler.
 */
public class ParseExecutor {

    static final Logger logger = LoggerFactory.getLogger(ParseExecutor.class);

    public static final String PARALLELISM_PROPERTY = "protofront.parse.parallelism";

    private final int maxParallelism;
    private final ParseConfig config;
    private final Supplier<ErrorReporter> reporters;

    public ParseExecutor() {
        this(defaultParallelism(), ParseConfig.defaults(), ErrorReporter::collecting);
    }

    public ParseExecutor(int maxParallelism, ParseConfig config, Supplier<ErrorReporter> reporters) {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + maxParallelism);
        }
        this.maxParallelism = maxParallelism;
        this.config = config;
        this.reporters = reporters;
    }

    static int defaultParallelism() {
        String value = System.getProperty(PARALLELISM_PROPERTY);
        int processors = Runtime.getRuntime().availableProcessors();
        if (value == null) {
            return processors;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("invalid {}: {}, using {}", PARALLELISM_PROPERTY, e.getMessage(), processors);
            return processors;
        }
        if (parsed < 1) {
            logger.warn("invalid {}: '{}', using {}", PARALLELISM_PROPERTY, value, processors);
            return processors;
        }
        return parsed;
    }

    public int getMaxParallelism() {
        return maxParallelism;
    }

    /**
     * Parses every {@code .proto} file under the directory, names relative to it.
     */
    public ParsedFiles parseDirectory(Path dir) {
        List<Resource> resources = new ArrayList<>();
        for (Path path : FileUtils.findFiles(dir, "proto")) {
            resources.add(Resource.path(path, dir));
        }
        logger.debug("found {} files under {}", resources.size(), dir);
        return parseAll(resources);
    }

    public ParsedFiles parseAll(List<Resource> resources) {
        AtomicInteger counter = new AtomicInteger();
        int threads = Math.min(maxParallelism, Math.max(1, resources.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "protofront-parse-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        long startTime = System.currentTimeMillis();
        boolean completed = false;
        try {
            List<Future<ParseResult>> futures = new ArrayList<>(resources.size());
            for (Resource resource : resources) {
                futures.add(executor.submit(() -> Parser.parse(resource, new ErrorHandler(reporters.get()), config)));
            }
            List<ParseResult> results = new ArrayList<>(futures.size());
            for (Future<ParseResult> future : futures) {
                results.add(future.get());
            }
            ParsedFiles parsed = new ParsedFiles(results);
            logger.debug("parsed {} files on {} threads in {} ms", parsed.size(), threads,
                    System.currentTimeMillis() - startTime);
            completed = true;
            return parsed;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        } finally {
            if (completed) {
                shutdown(executor);
            } else {
                // the remaining parses are abandoned, their threads are daemons
                executor.shutdownNow();
            }
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warn("parse executor did not complete in time");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

}
