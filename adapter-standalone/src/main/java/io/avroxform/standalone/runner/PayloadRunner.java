package io.avroxform.standalone.runner;

import io.avroxform.core.engine.TransformPlugin;
import io.avroxform.core.model.TransformResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transforms payload files concurrently with one shared, initialized {@link TransformPlugin}.
 *
 * <p>
 * Payloads are submitted to a fixed worker pool; outputs are written in submission order once
 * each result is available, so the byte stream on {@code out} does not depend on scheduling. A
 * failed payload contributes no bytes and is logged; the remaining payloads still run.
 */
public final class PayloadRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PayloadRunner.class);

    /** Exit status when every payload succeeded. */
    public static final int EXIT_OK = 0;

    /** Exit status when at least one payload failed. */
    public static final int EXIT_PAYLOAD_FAILED = 1;

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final TransformPlugin plugin;
    private final ExecutorService workers;

    /**
     * @param plugin  an initialized plugin
     * @param workers worker pool size
     */
    public PayloadRunner(TransformPlugin plugin, int workers) {
        this.plugin = Objects.requireNonNull(plugin, "plugin must not be null");
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive, got: " + workers);
        }
        this.workers = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
    }

    /**
     * Transforms every file and writes the outputs to {@code out} in argument order.
     *
     * @return {@link #EXIT_OK} or {@link #EXIT_PAYLOAD_FAILED}
     * @throws IOException if writing to {@code out} fails
     */
    public int runFiles(List<Path> payloadFiles, OutputStream out) throws IOException {
        List<Future<TransformResult>> futures = new ArrayList<>(payloadFiles.size());
        for (Path file : payloadFiles) {
            futures.add(workers.submit(() -> plugin.transform(read(file))));
        }
        boolean failed = false;
        for (int i = 0; i < futures.size(); i++) {
            failed |= !write(payloadFiles.get(i).toString(), futures.get(i), out);
        }
        out.flush();
        return failed ? EXIT_PAYLOAD_FAILED : EXIT_OK;
    }

    /**
     * Transforms the whole of {@code in} as a single payload.
     *
     * @return {@link #EXIT_OK} or {@link #EXIT_PAYLOAD_FAILED}
     * @throws IOException if reading {@code in} or writing {@code out} fails
     */
    public int runStream(InputStream in, OutputStream out) throws IOException {
        byte[] payload = in.readAllBytes();
        boolean ok = write("<stdin>", workers.submit(() -> plugin.transform(payload)), out);
        out.flush();
        return ok ? EXIT_OK : EXIT_PAYLOAD_FAILED;
    }

    /**
     * Transforms in-memory payloads; results are returned in input order.
     *
     * @throws ExecutionException if a worker failed outside the transform contract
     */
    public List<TransformResult> transformAll(List<byte[]> payloads) throws ExecutionException {
        List<Future<TransformResult>> futures = new ArrayList<>(payloads.size());
        for (byte[] payload : payloads) {
            futures.add(workers.submit(() -> plugin.transform(payload)));
        }
        List<TransformResult> results = new ArrayList<>(futures.size());
        for (Future<TransformResult> future : futures) {
            results.add(await(future));
        }
        return results;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Workers did not finish within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private boolean write(String source, Future<TransformResult> future, OutputStream out) throws IOException {
        TransformResult result;
        try {
            result = await(future);
        } catch (ExecutionException e) {
            LOG.error("Payload failed: source={}, reason={}", source, e.getCause().getMessage(), e.getCause());
            return false;
        }
        if (result.isError()) {
            LOG.error("Payload failed: source={}, code={}, detail={}",
                    source, result.errorCode(), result.error().getMessage());
            return false;
        }
        LOG.debug("Payload done: source={}, rows={}", source, result.rowCount());
        out.write(result.output());
        return true;
    }

    private static TransformResult await(Future<TransformResult> future) throws ExecutionException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExecutionException("interrupted while waiting for payload", e);
        }
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read payload file " + file, e);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "xform-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
