package org.metalad.conduct;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.metalad.filestore.FileStoreUtility;

/**
 * Conductor runs a pipeline: the items of one provider flow through an ordered chain of
 * processors. Items are fed through a bounded queue to a fixed pool of workers; each item passes
 * the processors in order, different items run in parallel. The feeding thread blocks while the
 * queue is full.
 *
 * A conductor runs once. Per-item exceptions become `error` outcomes; only a failing provider
 * ends the run as FAILED. {@link #requestStop()} stops feeding, drops queued items and lets
 * running items finish. When this drops or skips items the run reports FAILED with
 * {@link RunSummary#isStopped()}; a stop that arrives after every item was scheduled and
 * processed does not change the result.
 *
 * Finished items are reduced to {@link ItemResult}s, the records they carried are released.
 */
public class Conductor {
    private static final Log logConductor = LogFactory.getLog(Conductor.class);
    private static final PipelineData END_OF_ITEMS = new PipelineData("end-of-items", null);

    private final Provider provider;
    private final List<Processor> processors;
    private final int jobs;
    private final int queueSize;
    private final Map<Long, ItemResult> finished = new TreeMap<>();
    private final AtomicInteger droppedItems = new AtomicInteger();
    private volatile boolean stopRequested = false;
    private volatile RunState state = RunState.PENDING;

    public Conductor(Provider provider, List<Processor> processors) {
        this(provider, processors, 1);
    }

    public Conductor(Provider provider, List<Processor> processors, int jobs) {
        this(provider, processors, jobs, 2 * jobs);
    }

    /**
     * @param provider   Item source
     * @param processors Processor chain, in order
     * @param jobs       Number of workers, at least 1
     * @param queueSize  Capacity of the queue between provider and workers, at least 1
     */
    public Conductor(Provider provider, List<Processor> processors, int jobs, int queueSize) {
        FileStoreUtility.ensureNotNull(provider, "provider", "Conductor");
        FileStoreUtility.ensureNotNull(processors, "processors", "Conductor");
        if (jobs < 1 || queueSize < 1) {
            String errMsg = "Conductor - jobs and queueSize must be >= 1, got jobs=" + jobs
                + ", queueSize=" + queueSize;
            logConductor.error(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        this.provider = provider;
        this.processors = List.copyOf(processors);
        this.jobs = jobs;
        this.queueSize = queueSize;
    }

    public RunState getState() {
        return state;
    }

    /**
     * Ask a running pipeline to stop. No new items are scheduled, queued items are dropped and
     * items in progress complete.
     */
    public void requestStop() {
        logConductor.info("Conductor - stop requested");
        stopRequested = true;
    }

    /**
     * Run the pipeline and wait for its end
     *
     * @return Summary of the run
     * @throws IllegalStateException When the conductor already ran
     * @throws InterruptedException  When the calling thread is interrupted
     */
    public RunSummary run() throws InterruptedException {
        synchronized (this) {
            if (state != RunState.PENDING) {
                String errMsg = "Conductor - a conductor runs only once, state is " + state;
                logConductor.error(errMsg);
                throw new IllegalStateException(errMsg);
            }
            state = RunState.RUNNING;
        }
        logConductor.info(
            "Conductor - running " + provider.getName() + " -> " + processorNames() + " with "
                + jobs + " job(s)");

        BlockingQueue<PipelineData> queue = new ArrayBlockingQueue<>(queueSize);
        ExecutorService workers = Executors.newFixedThreadPool(jobs);
        for (int i = 0; i < jobs; i++) {
            workers.submit(() -> work(queue));
        }

        String providerFault = null;
        boolean exhausted = false;
        long sequence = 0;
        try {
            Iterator<PipelineData> items = provider.provide();
            while (!stopRequested) {
                if (!items.hasNext()) {
                    exhausted = true;
                    break;
                }
                PipelineData item = items.next();
                item.setSequence(sequence++);
                queue.put(item);
            }

        } catch (InterruptedException ie) {
            stopRequested = true;
            state = RunState.FAILED;
            queue.clear();
            endWorkers(queue, workers);
            throw ie;

        } catch (Exception e) {
            providerFault = "Provider " + provider.getName() + " failed: " + e.getMessage();
            logConductor.error("Conductor - " + providerFault, e);
        }

        if (stopRequested) {
            int dropped = queue.size();
            queue.clear();
            droppedItems.addAndGet(dropped);
            if (dropped > 0) {
                logConductor.info("Conductor - dropped " + dropped + " queued item(s)");
            }
        }
        endWorkers(queue, workers);

        boolean stopped = stopRequested && (!exhausted || droppedItems.get() > 0);
        if (stopRequested && !stopped) {
            logConductor.info("Conductor - stop requested after all items were processed");
        }
        RunState finalState = providerFault == null && !stopped
            ? RunState.COMPLETED : RunState.FAILED;
        String message = providerFault != null ? providerFault
            : stopped ? "Stopped on request" : null;
        RunSummary summary = new RunSummary(finalState, stopped, message, orderedResults());
        state = finalState;
        logConductor.info("Conductor - " + summary);
        return summary;
    }

    private void endWorkers(BlockingQueue<PipelineData> queue, ExecutorService workers)
        throws InterruptedException {
        for (int i = 0; i < jobs; i++) {
            queue.put(END_OF_ITEMS);
        }
        workers.shutdown();
        while (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
            logConductor.debug("Conductor - waiting for running items");
        }
    }

    private void work(BlockingQueue<PipelineData> queue) {
        while (true) {
            PipelineData item;
            try {
                item = queue.take();

            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (item == END_OF_ITEMS) {
                return;
            }
            if (stopRequested) {
                logConductor.debug("Conductor - dropping " + item.getLabel());
                droppedItems.incrementAndGet();
                continue;
            }
            process(item);
            ItemResult result = item.toResult();
            synchronized (finished) {
                finished.put(item.getSequence(), result);
            }
        }
    }

    private void process(PipelineData item) {
        for (Processor processor : processors) {
            try {
                if (processor.isConcurrent()) {
                    processor.process(item);
                } else {
                    synchronized (processor) {
                        processor.process(item);
                    }
                }

            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                item.setOutcome(Outcome.ERROR, processor.getName() + ": interrupted");
                return;

            } catch (Exception e) {
                String errMsg = processor.getName() + ": " + e.getMessage();
                logConductor.error("Conductor - " + item.getLabel() + " failed in " + errMsg);
                item.setOutcome(Outcome.ERROR, errMsg);
                return;
            }
            if (item.getOutcome() != Outcome.OK) {
                logConductor.debug(
                    "Conductor - " + item.getLabel() + " ended in " + processor.getName() + " as "
                        + item.getOutcome().getName());
                return;
            }
        }
    }

    private List<ItemResult> orderedResults() {
        synchronized (finished) {
            return new ArrayList<>(finished.values());
        }
    }

    private List<String> processorNames() {
        List<String> names = new ArrayList<>();
        for (Processor processor : processors) {
            names.add(processor.getName());
        }
        return names;
    }
}
