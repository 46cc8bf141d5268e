package com.ttennebkram.astrostack.processing;

import com.ttennebkram.astrostack.model.PixelGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs a FrameProcessor over independent frames on a fixed pool of worker threads.
 * Each task owns its own grid, so no locking is needed. Results come back in
 * input order; the call returns only once every frame has finished.
 */
public class BatchProcessor implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(BatchProcessor.class.getName());

    private final FrameProcessor processor;
    private final ExecutorService executor;
    private final int threadCount;

    public BatchProcessor(FrameProcessor processor, int threadCount) {
        if (processor == null) {
            throw new IllegalArgumentException("Processor must not be null");
        }
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threadCount);
        }
        this.processor = processor;
        this.threadCount = threadCount;
        this.executor = Executors.newFixedThreadPool(threadCount, new WorkerThreadFactory());
    }

    public int getThreadCount() {
        return threadCount;
    }

    /**
     * Process every frame, labelling them by index.
     */
    public List<PixelGrid> processAll(List<PixelGrid> frames) throws InterruptedException {
        List<String> labels = new ArrayList<>();
        for (int i = 0; i < frames.size(); i++) {
            labels.add("#" + i);
        }
        return processAll(frames, labels);
    }

    /**
     * Process every frame concurrently.
     *
     * @param frames frames to transform in place
     * @param labels one label per frame, used in error messages
     * @return the processed grids, in input order
     * @throws FrameProcessingException if any frame fails; remaining tasks are cancelled
     */
    public List<PixelGrid> processAll(List<PixelGrid> frames, List<String> labels) throws InterruptedException {
        if (frames.size() != labels.size()) {
            throw new IllegalArgumentException("Expected " + frames.size() + " labels, got " + labels.size());
        }

        List<Future<PixelGrid>> futures = new ArrayList<>();
        for (PixelGrid frame : frames) {
            futures.add(executor.submit(() -> processor.process(frame)));
        }

        List<PixelGrid> results = new ArrayList<>(frames.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    throw new FrameProcessingException(labels.get(i), e.getCause());
                }
            }
        } finally {
            if (results.size() < futures.size()) {
                for (Future<PixelGrid> future : futures) {
                    future.cancel(true);
                }
            }
        }

        LOG.fine(() -> "Processed " + frames.size() + " frames on " + threadCount + " threads");
        return results;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Daemon worker threads named FrameWorker-N.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "FrameWorker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
