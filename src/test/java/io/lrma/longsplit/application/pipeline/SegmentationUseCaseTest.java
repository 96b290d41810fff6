package io.lrma.longsplit.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.lrma.longsplit.application.pipeline.SegmentationUseCase.PipelineSettings;
import io.lrma.longsplit.application.port.ArrayElementSink;
import io.lrma.longsplit.application.port.MetricsPort;
import io.lrma.longsplit.application.port.ReadSource;
import io.lrma.longsplit.domain.read.Read;
import io.lrma.longsplit.domain.read.ReadTags;
import io.lrma.longsplit.domain.segment.MissingSegmentTagException;
import io.lrma.longsplit.domain.segment.Segment;
import io.lrma.longsplit.domain.split.DelimiterMatcher;
import io.lrma.longsplit.domain.split.SimpleDelimiterMatcher;
import io.lrma.longsplit.domain.split.SplitMode;
import io.lrma.longsplit.domain.split.SplitResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class SegmentationUseCaseTest {
  private static final String TAGGED = "A:0-9|B:10-19|x:20-29|x:30-39|Y:40-49|Z:50-59";
  private static final Duration TIMEOUT = Duration.ofSeconds(20);

  @Test
  void terminatesForEveryWorkerCountAndInputSize() {
    for (int workers = 1; workers <= 4; workers++) {
      for (int reads : new int[] {0, 1, 7, 200}) {
        int w = workers;
        int m = reads;
        ListSource source = new ListSource(reads(m, TAGGED));
        RecordingSink sink = new RecordingSink();

        SegmentationSummary summary =
            assertTimeoutPreemptively(TIMEOUT, () -> useCase(source, sink, MetricsPort.NO_OP, w, 0).run());

        assertEquals(m, summary.readsProcessed(), "workers=" + w + " reads=" + m);
        assertEquals(m, summary.elementsWritten());
        assertEquals(0, summary.readsWithoutBoundaries());
        assertEquals(m, sink.written.size());
        assertTrue(sink.closed.get(), "sink closed");
        assertTrue(source.closed.get(), "source closed");
      }
    }
  }

  @Test
  void writesEveryReadExactlyOnce() throws Exception {
    ListSource source = new ListSource(reads(50, TAGGED));
    RecordingSink sink = new RecordingSink();

    useCase(source, sink, MetricsPort.NO_OP, 3, 0).run();

    Set<String> names = new HashSet<>();
    for (Read element : sink.written) {
      names.add(element.name());
      assertEquals(20, element.length());
    }
    assertEquals(50, names.size());
    assertTrue(names.contains("read7_20-39_A/B-Y/Z"));
    assertTrue(sink.flushed.get());
  }

  @Test
  void countsReadsWithoutBoundaries() throws Exception {
    List<Read> input = new ArrayList<>(reads(3, TAGGED));
    input.add(read("plain", "q:0-59"));
    RecordingMetrics metrics = new RecordingMetrics();

    SegmentationSummary summary = useCase(new ListSource(input), new RecordingSink(), metrics, 2, 0).run();

    assertEquals(4, summary.readsProcessed());
    // the unsplit read still yields its whole length as one element
    assertEquals(4, summary.elementsWritten());
    assertEquals(1, summary.readsWithoutBoundaries());
    assertEquals(4L, metrics.counter("segment.reads.processed"));
    assertEquals(4L, metrics.counter("segment.elements.written"));
    assertEquals(1L, metrics.counter("segment.reads.unsplit"));
  }

  @Test
  void missingSegmentTagFailsTheRun() {
    List<Read> input = new ArrayList<>(reads(20, TAGGED));
    input.add(10, new Read("untagged", bases(60), null, ReadTags.empty(), true, 255));
    ListSource source = new ListSource(input);
    RecordingSink sink = new RecordingSink();
    RecordingMetrics metrics = new RecordingMetrics();

    MissingSegmentTagException ex = assertTimeoutPreemptively(
        TIMEOUT,
        () -> assertThrows(MissingSegmentTagException.class, () -> useCase(source, sink, metrics, 2, 0).run()));

    assertEquals("untagged", ex.readName());
    assertEquals(1L, metrics.counter("segment.worker.error"));
    assertTrue(sink.closed.get());
    assertTrue(source.closed.get());
  }

  @Test
  void sinkFailureFailsTheRun() {
    RecordingSink sink = new RecordingSink();
    sink.failAfter = 5;
    RecordingMetrics metrics = new RecordingMetrics();

    IOException ex = assertTimeoutPreemptively(
        TIMEOUT,
        () -> assertThrows(
            IOException.class, () -> useCase(new ListSource(reads(100, TAGGED)), sink, metrics, 4, 0).run()));

    assertEquals("disk full", ex.getMessage());
    assertEquals(1L, metrics.counter("segment.writer.error"));
    assertTrue(sink.closed.get());
  }

  @Test
  void sourceFailureFailsTheRun() {
    ListSource source = new ListSource(reads(10, TAGGED));
    source.failAfter = 4;
    RecordingSink sink = new RecordingSink();

    IOException ex = assertTimeoutPreemptively(
        TIMEOUT, () -> assertThrows(IOException.class, () -> useCase(source, sink, MetricsPort.NO_OP, 2, 0).run()));

    assertEquals("truncated BGZF block", ex.getMessage());
    assertTrue(sink.closed.get());
    assertTrue(source.closed.get());
  }

  @Test
  void errorInWriterFailsTheRun() {
    for (int attempt = 0; attempt < 20; attempt++) {
      RecordingSink sink = new RecordingSink();
      RecordingMetrics metrics = new RecordingMetrics();
      DelimiterMatcher matcher = new CrashingMatcher(defaultMatcher(), 2);
      SegmentationUseCase useCase = new SegmentationUseCase(
          new ListSource(reads(5, TAGGED)), new SegmentDecoder(), matcher, sink, metrics, new PipelineSettings(2, 0));

      IllegalStateException ex = assertTimeoutPreemptively(
          TIMEOUT, () -> assertThrows(IllegalStateException.class, useCase::run));

      assertInstanceOf(StackOverflowError.class, ex.getCause());
      assertEquals(1L, metrics.counter("segment.writer.error"));
      assertTrue(sink.closed.get());
    }
  }

  @Test
  void errorInWorkerFailsTheRun() {
    List<Read> input = new ArrayList<>(reads(10, TAGGED));
    input.add(3, new Read("poisoned", bases(60), null, ReadTags.of(Map.of("SG", new CrashingTag())), true, 255));
    RecordingMetrics metrics = new RecordingMetrics();
    ListSource source = new ListSource(input);

    IllegalStateException ex = assertTimeoutPreemptively(
        TIMEOUT,
        () -> assertThrows(
            IllegalStateException.class, () -> useCase(source, new RecordingSink(), metrics, 3, 0).run()));

    assertInstanceOf(AssertionError.class, ex.getCause());
    assertEquals(1L, metrics.counter("segment.worker.error"));
    assertTrue(source.closed.get());
  }

  @Test
  void runsOnlyOnce() throws Exception {
    SegmentationUseCase useCase = useCase(new ListSource(List.of()), new RecordingSink(), MetricsPort.NO_OP, 1, 0);
    useCase.run();

    assertThrows(IllegalStateException.class, useCase::run);
  }

  @Test
  void logsProgressAtConfiguredInterval() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(SegmentationUseCase.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    logger.setLevel(Level.INFO);
    appender.start();
    logger.addAppender(appender);
    try {
      useCase(new ListSource(reads(6, TAGGED)), new RecordingSink(), MetricsPort.NO_OP, 2, 2).run();
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    long progressLines = appender.list.stream()
        .map(ILoggingEvent::getFormattedMessage)
        .filter(message -> message.startsWith("Segmented "))
        .count();
    assertEquals(3, progressLines);
  }

  @Test
  void settingsClampWorkersAndRejectNegativeInterval() {
    assertEquals(1, new PipelineSettings(0, 10).workers());
    assertEquals(1, new PipelineSettings(-3, 10).workers());
    assertThrows(IllegalArgumentException.class, () -> new PipelineSettings(2, -1));
    assertTrue(PipelineSettings.defaults().workers() >= 1);
  }

  private static SegmentationUseCase useCase(
      ReadSource source, ArrayElementSink sink, MetricsPort metrics, int workers, int progressInterval) {
    return new SegmentationUseCase(
        source, new SegmentDecoder(), defaultMatcher(), sink, metrics, new PipelineSettings(workers, progressInterval));
  }

  private static SimpleDelimiterMatcher defaultMatcher() {
    return new SimpleDelimiterMatcher(List.of(List.of("A", "B"), List.of("Y", "Z")), false);
  }

  private static List<Read> reads(int count, String segments) {
    List<Read> reads = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      reads.add(read("read" + i, segments));
    }
    return reads;
  }

  private static Read read(String name, String segments) {
    return new Read(name, bases(60), null, ReadTags.of(Map.of("SG", segments)), true, 255);
  }

  private static byte[] bases(int length) {
    return "ACGT".repeat(length / 4).getBytes(StandardCharsets.US_ASCII);
  }

  private static final class ListSource implements ReadSource {
    private final Iterator<Read> reads;
    private final AtomicBoolean closed = new AtomicBoolean();
    private int served;
    private int failAfter = -1;

    ListSource(List<Read> reads) {
      this.reads = reads.iterator();
    }

    @Override
    public Read next() throws IOException {
      if (served == failAfter) {
        throw new IOException("truncated BGZF block");
      }
      if (!reads.hasNext()) {
        return null;
      }
      served++;
      return reads.next();
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }

  private static final class RecordingSink implements ArrayElementSink {
    private final List<Read> written = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean flushed = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile int failAfter = -1;

    @Override
    public void write(Read element) throws IOException {
      if (written.size() == failAfter) {
        throw new IOException("disk full");
      }
      written.add(element);
    }

    @Override
    public void flush() {
      flushed.set(true);
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }

  /** Delegates to a real matcher but throws an {@link Error} on the given call. */
  private static final class CrashingMatcher implements DelimiterMatcher {
    private final DelimiterMatcher delegate;
    private final int crashOnCall;
    private int calls;

    CrashingMatcher(DelimiterMatcher delegate, int crashOnCall) {
      this.delegate = delegate;
      this.crashOnCall = crashOnCall;
    }

    @Override
    public SplitResult split(List<Segment> segments, int readLength) {
      if (++calls == crashOnCall) {
        throw new StackOverflowError();
      }
      return delegate.split(segments, readLength);
    }

    @Override
    public SplitMode mode() {
      return delegate.mode();
    }
  }

  /** Tag value whose text cannot be produced. */
  private static final class CrashingTag implements CharSequence {
    @Override
    public int length() {
      return 0;
    }

    @Override
    public char charAt(int index) {
      throw new IndexOutOfBoundsException(index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
      return this;
    }

    @Override
    public String toString() {
      throw new AssertionError("tag text unavailable");
    }
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {}

    long counter(String key) {
      AtomicLong value = counters.get(key);
      return value == null ? 0L : value.get();
    }
  }
}
