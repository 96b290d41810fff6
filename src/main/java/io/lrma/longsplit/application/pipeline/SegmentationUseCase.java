package io.lrma.longsplit.application.pipeline;

import io.lrma.longsplit.application.port.ArrayElementSink;
import io.lrma.longsplit.application.port.MetricsPort;
import io.lrma.longsplit.application.port.ReadSource;
import io.lrma.longsplit.domain.read.Read;
import io.lrma.longsplit.domain.read.SegmentedRead;
import io.lrma.longsplit.domain.split.DelimiterMatcher;
import io.lrma.longsplit.domain.split.SplitResult;
import io.lrma.longsplit.infrastructure.exec.ExecutorFactories;
import io.lrma.longsplit.logging.Logs;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Splits every read of a {@link ReadSource} into array elements using a pool of
 * decoding workers and a single writer.
 * <p><strong>Flow:</strong> the calling thread produces reads into a bounded input queue whose capacity
 * equals the worker count; workers decode segment tags and push {@link SegmentedRead}s into an unbounded
 * result queue; the writer applies the {@link DelimiterMatcher} and writes elements through the
 * {@link ArrayElementWriter}. Only the writer touches the sink.</p>
 * <p><strong>Shutdown:</strong> once the source is exhausted the producer enqueues one end-of-input token
 * per worker. After every worker has exited, one end-of-results token is enqueued for the writer, which
 * flushes and closes the sink.</p>
 * <p><strong>Failure:</strong> the first exception raised by the producer, a worker, or the writer is
 * recorded and stops every stage. Each queue wait is bounded and re-checks the failure flag, so no thread
 * blocks after a failure; the recorded exception is rethrown from {@link #run()}. Nothing is retried.</p>
 * <p><strong>Threads:</strong> workers and the writer run on named non-daemon threads
 * ({@code segment-<id>-N}). Instances are not reusable; invoke {@link #run()} at most once.</p>
 * <p><strong>Observability:</strong> metrics under {@code segment.*}; progress logged every
 * {@link PipelineSettings#progressInterval()} reads; MDC key {@code pipeline=segment}.</p>
 *
 * @since 0.1.0
 */
public final class SegmentationUseCase {
  private static final Logger log = LoggerFactory.getLogger(SegmentationUseCase.class);

  /** Default number of reads between progress log lines. */
  public static final int DEFAULT_PROGRESS_INTERVAL = 10_000;

  private static final long QUEUE_POLL_MILLIS = 25L;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final String PIPELINE = "segment";

  private final ReadSource source;
  private final SegmentDecoder decoder;
  private final DelimiterMatcher matcher;
  private final ArrayElementWriter elementWriter;
  private final ArrayElementSink sink;
  private final MetricsPort metrics;
  private final PipelineSettings settings;

  private final BlockingQueue<WorkItem> inputQueue;
  private final BlockingQueue<ResultItem> resultQueue = new LinkedBlockingQueue<>();
  private final AtomicReference<Exception> failure = new AtomicReference<>();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean sinkClosed = new AtomicBoolean();
  private final CountDownLatch workersDone;
  private final CountDownLatch writerDone = new CountDownLatch(1);
  private final AtomicLong readsProcessed = new AtomicLong();
  private final AtomicLong elementsWritten = new AtomicLong();
  private final AtomicLong readsWithoutBoundaries = new AtomicLong();
  private final String threadPrefix;
  private final UncaughtExceptionHandler stageCrashHandler;

  private volatile ExecutorService executor;

  /**
   * Creates the pipeline.
   *
   * @param source reads to segment; closed when the run ends
   * @param decoder worker-side segment decoder
   * @param matcher delimiter matching policy applied by the writer
   * @param sink destination for element reads; closed when the run ends
   * @param metrics metrics sink for pipeline counters
   * @param settings worker count and progress cadence
   */
  public SegmentationUseCase(
      ReadSource source,
      SegmentDecoder decoder,
      DelimiterMatcher matcher,
      ArrayElementSink sink,
      MetricsPort metrics,
      PipelineSettings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.elementWriter = new ArrayElementWriter(sink, decoder.segmentsTag());
    this.inputQueue = new ArrayBlockingQueue<>(settings.workers());
    this.workersDone = new CountDownLatch(settings.workers());
    this.threadPrefix = PIPELINE + "-" + Integer.toHexString(System.identityHashCode(this));
    this.stageCrashHandler = this::handleStageCrash;
  }

  /**
   * Runs the pipeline until the source is exhausted or a stage fails.
   *
   * @return run totals
   * @throws Exception the first failure raised by the source, a worker, the writer, or the sink
   * @throws IllegalStateException if the pipeline was already run
   */
  public SegmentationSummary run() throws Exception {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Segmentation pipeline already started");
    }
    MDC.put("pipeline", PIPELINE);
    try {
      Exception primaryFailure = null;
      long readsQueued = 0;
      try {
        startStages();
        log.info(
            "Segmentation pipeline started with {} workers ({} matching)",
            settings.workers(),
            matcher.mode());
        readsQueued = produce();
        if (failure.get() == null) {
          log.info("Read source exhausted after {} reads; signalling {} workers", readsQueued, settings.workers());
          finishStages();
        }
      } catch (Exception runFailure) {
        signalFailure(runFailure);
      } catch (Error fatal) {
        signalFailure(new IllegalStateException("Read producer crashed", fatal));
        shutdownStages(true);
        closeQuietly(null);
        throw fatal;
      }
      primaryFailure = failure.get();
      shutdownStages(primaryFailure != null);
      // a stage may fail while the pool drains
      if (primaryFailure == null) {
        primaryFailure = failure.get();
      }
      primaryFailure = closeQuietly(primaryFailure);

      if (primaryFailure != null) {
        log.debug(
            "Segmentation pipeline terminating after {} reads queued and {} processed due to failure",
            readsQueued,
            readsProcessed.get());
        throw primaryFailure;
      }
      SegmentationSummary summary =
          new SegmentationSummary(readsProcessed.get(), elementsWritten.get(), readsWithoutBoundaries.get());
      log.info(
          "Segmentation pipeline completed; {} reads processed, {} elements written, {} reads without boundaries",
          summary.readsProcessed(),
          summary.elementsWritten(),
          summary.readsWithoutBoundaries());
      return summary;
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void startStages() {
    int threads = settings.workers() + 1;
    executor = ExecutorFactories.newStagePool(threads, threadPrefix, stageCrashHandler);
    for (int i = 0; i < settings.workers(); i++) {
      executor.execute(new Worker());
    }
    executor.execute(new Writer());
    log.debug("Started {} worker threads and one writer thread", settings.workers());
  }

  private long produce() throws Exception {
    long queued = 0;
    while (failure.get() == null) {
      Read read = source.next();
      if (read == null) {
        break;
      }
      if (!offerInput(new Payload(read))) {
        break;
      }
      queued++;
      metrics.observe("segment.input.queue.depth", inputQueue.size());
    }
    return queued;
  }

  private void finishStages() throws InterruptedException {
    for (int i = 0; i < settings.workers(); i++) {
      if (!offerInput(EndOfInput.INSTANCE)) {
        return;
      }
    }
    if (!await(workersDone)) {
      return;
    }
    log.debug("All workers finished; signalling writer");
    resultQueue.add(EndOfResults.INSTANCE);
    await(writerDone);
  }

  private boolean offerInput(WorkItem item) throws InterruptedException {
    while (failure.get() == null) {
      if (inputQueue.offer(item, QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  private boolean await(CountDownLatch latch) throws InterruptedException {
    while (failure.get() == null) {
      if (latch.await(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      MDC.put("pipeline", PIPELINE);
      try {
        while (failure.get() == null) {
          WorkItem item = inputQueue.poll(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (item == null) {
            continue;
          }
          if (item instanceof Payload payload) {
            resultQueue.add(new Decoded(decoder.decode(payload.read())));
          } else {
            return;
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (failure.get() == null) {
          signalFailure(interrupted);
        }
      } catch (Exception ex) {
        metrics.increment("segment.worker.error");
        signalFailure(ex);
      } catch (Error error) {
        metrics.increment("segment.worker.error");
        signalFailure(new IllegalStateException("Worker thread crashed", error));
        throw error;
      } finally {
        workersDone.countDown();
        MDC.remove("pipeline");
      }
    }
  }

  private final class Writer implements Runnable {
    @Override
    public void run() {
      MDC.put("pipeline", PIPELINE);
      try {
        while (failure.get() == null) {
          ResultItem item = resultQueue.poll(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (item == null) {
            continue;
          }
          if (item instanceof Decoded decoded) {
            writeRead(decoded.segmented());
          } else {
            sink.flush();
            closeSink();
            return;
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (failure.get() == null) {
          signalFailure(interrupted);
        }
      } catch (Exception ex) {
        metrics.increment("segment.writer.error");
        signalFailure(ex);
      } catch (Error error) {
        metrics.increment("segment.writer.error");
        signalFailure(new IllegalStateException("Writer thread crashed", error));
        throw error;
      } finally {
        writerDone.countDown();
        MDC.remove("pipeline");
      }
    }
  }

  private void writeRead(SegmentedRead segmented) throws Exception {
    Read read = segmented.read();
    SplitResult result = matcher.split(segmented.segments(), read.length());
    int written = elementWriter.writeAll(segmented, result);

    long reads = readsProcessed.incrementAndGet();
    long elements = elementsWritten.addAndGet(written);
    metrics.increment("segment.reads.processed");
    metrics.observe("segment.boundaries.found", result.boundaries());
    for (int i = 0; i < written; i++) {
      metrics.increment("segment.elements.written");
    }
    if (result.boundaries() == 0) {
      readsWithoutBoundaries.incrementAndGet();
      metrics.increment("segment.reads.unsplit");
    }
    metrics.observe("segment.results.queue.depth", resultQueue.size());

    if (log.isDebugEnabled()) {
      log.debug(
          "Read {} [{}]: {} boundaries, {} elements",
          read.name(),
          Logs.segments(segmented.segments()),
          result.boundaries(),
          written);
    }
    if (settings.progressInterval() > 0 && reads % settings.progressInterval() == 0) {
      log.info("Segmented {} reads ({} elements)", reads, elements);
    }
  }

  private void closeSink() throws Exception {
    if (sinkClosed.compareAndSet(false, true)) {
      sink.close();
      log.info("Element sink closed");
    }
  }

  private void shutdownStages(boolean failed) {
    ExecutorService current = executor;
    if (current == null) {
      return;
    }
    if (failed) {
      current.shutdownNow();
    } else {
      current.shutdown();
    }
    boolean terminated = false;
    try {
      terminated = current.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Pipeline threads active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        current.shutdownNow();
        terminated = current.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Pipeline threads failed to terminate cleanly");
    }
    executor = null;
    inputQueue.clear();
    resultQueue.clear();
  }

  private Exception closeQuietly(Exception primaryFailure) {
    Exception result = primaryFailure;
    try {
      closeSink();
    } catch (Exception sinkCloseFailure) {
      log.error("Failed to close element sink", sinkCloseFailure);
      if (result == null) {
        result = sinkCloseFailure;
      }
    }
    try {
      source.close();
      log.info("Read source closed");
    } catch (Exception sourceCloseFailure) {
      log.error("Failed to close read source", sourceCloseFailure);
      if (result == null) {
        result = sourceCloseFailure;
      }
    }
    return result;
  }

  private void handleStageCrash(Thread thread, Throwable throwable) {
    Exception crash =
        throwable instanceof Exception ex ? ex : new RuntimeException("Pipeline thread crash", throwable);
    log.error("Pipeline thread {} threw an uncaught exception", thread.getName(), throwable);
    signalFailure(crash);
  }

  private void signalFailure(Exception ex) {
    if (failure.compareAndSet(null, ex)) {
      log.error("Segmentation stage on thread {} failed", Thread.currentThread().getName(), ex);
    }
  }

  /**
   * Pipeline tuning parameters.
   *
   * @param workers number of decoding workers; also the input queue capacity
   * @param progressInterval reads between progress log lines; zero disables progress logging
   */
  public record PipelineSettings(int workers, int progressInterval) {
    /**
     * Clamps the worker count to at least one and rejects negative progress intervals.
     *
     * @param workers requested worker count
     * @param progressInterval requested progress cadence
     */
    public PipelineSettings {
      workers = Math.max(1, workers);
      if (progressInterval < 0) {
        throw new IllegalArgumentException("progressInterval must be >= 0");
      }
    }

    /**
     * Derives settings from the processors visible to the JVM.
     *
     * @return default settings
     */
    public static PipelineSettings defaults() {
      return new PipelineSettings(
          ExecutorFactories.defaultWorkerCount(Runtime.getRuntime().availableProcessors()),
          DEFAULT_PROGRESS_INTERVAL);
    }
  }

  private sealed interface WorkItem permits Payload, EndOfInput {}

  private record Payload(Read read) implements WorkItem {}

  private enum EndOfInput implements WorkItem {
    INSTANCE
  }

  private sealed interface ResultItem permits Decoded, EndOfResults {}

  private record Decoded(SegmentedRead segmented) implements ResultItem {}

  private enum EndOfResults implements ResultItem {
    INSTANCE
  }
}
