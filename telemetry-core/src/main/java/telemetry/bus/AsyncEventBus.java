package telemetry.bus;

import telemetry.ErrorEvent;
import telemetry.EventConsumer;
import telemetry.TransportException;
import telemetry.spi.MetricsExporter;
import telemetry.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process event bus that hands {@link ErrorEvent}s from producers to registered
 * {@link EventConsumer}s on background threads.
 *
 * <p>{@link #publish(ErrorEvent)} is a non-blocking {@code offer} onto a bounded queue: it
 * returns {@code false} when the queue is full or the bus is closed, and never waits. Worker
 * threads drain the queue and deliver each event to every consumer. Consumers that
 * {@linkplain EventConsumer#supportsBatching() support batching} receive up to
 * {@code batchSize} events collected for at most {@code batchTimeout}; the others receive
 * events one at a time.
 *
 * <p>Unless disabled, repeats of an event published within the deduplication TTL are
 * suppressed before they are queued; see {@link EventDeduplicator}.
 *
 * <p>Consumer failures are logged and never reach the producer.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 */
public final class AsyncEventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AsyncEventBus.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 50;

  public static final Duration DEFAULT_DEDUPLICATION_TTL = Duration.ofMinutes(5);
  public static final int DEFAULT_DEDUPLICATION_MAX_ENTRIES = 1000;

  private final BlockingQueue<ErrorEvent> queue;
  private final List<EventConsumer> consumers = new CopyOnWriteArrayList<>();
  private final ExecutorService workers;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final LongAdder published = new LongAdder();
  private final LongAdder rejected = new LongAdder();
  private final LongAdder deduplicated = new LongAdder();
  private final LongAdder consumerFailures = new LongAdder();

  private final MetricsExporter metrics;
  private final EventDeduplicator deduplicator;
  private final int batchSize;
  private final long batchTimeoutMs;
  private final long drainTimeoutMs;

  private AsyncEventBus(Builder builder) {
    if (builder.workerCount < 1) {
      throw new IllegalArgumentException("workerCount must be >= 1, got: " + builder.workerCount);
    }
    if (builder.queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be > 0, got: " + builder.queueCapacity);
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, got: " + builder.batchSize);
    }
    Objects.requireNonNull(builder.batchTimeout, "batchTimeout");
    Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    Objects.requireNonNull(builder.deduplicationTtl, "deduplicationTtl");
    if (builder.batchTimeout.isNegative() || builder.drainTimeout.isNegative()
        || builder.deduplicationTtl.isNegative()) {
      throw new IllegalArgumentException("timeouts must not be negative");
    }
    this.deduplicator = builder.deduplicationTtl.isZero()
        ? null
        : new EventDeduplicator(builder.deduplicationTtl, builder.deduplicationMaxEntries,
            builder.clock != null ? builder.clock : Clock.systemUTC());
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.batchSize = builder.batchSize;
    this.batchTimeoutMs = builder.batchTimeout.toMillis();
    this.drainTimeoutMs = builder.drainTimeout.toMillis();
    this.queue = new ArrayBlockingQueue<>(builder.queueCapacity);

    this.workers = Executors.newFixedThreadPool(builder.workerCount,
        new DaemonThreadFactory(builder.threadNamePrefix));
    for (int i = 0; i < builder.workerCount; i++) {
      workers.submit(this::workerLoop);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a consumer for all subsequently delivered events.
   *
   * @param consumer the consumer
   * @return {@code false} if a consumer with the same name is already registered or the bus
   *     is closed
   */
  public synchronized boolean register(EventConsumer consumer) {
    Objects.requireNonNull(consumer, "consumer");
    if (!accepting.get()) {
      return false;
    }
    for (EventConsumer existing : consumers) {
      if (existing.name().equals(consumer.name())) {
        logger.warning("Consumer already registered: " + consumer.name());
        return false;
      }
    }
    consumers.add(consumer);
    logger.info("Registered event consumer " + consumer.name()
        + (consumer.supportsBatching() ? " (batching)" : ""));
    return true;
  }

  /**
   * Removes the consumer with the given name.
   *
   * @return {@code true} if a consumer was removed
   */
  public synchronized boolean unregister(String name) {
    return consumers.removeIf(c -> c.name().equals(name));
  }

  /**
   * Offers an event for asynchronous delivery. Never blocks.
   *
   * @param event the event
   * @return {@code true} if the event was queued, {@code false} if it repeats a recent event,
   *     the queue is full or the bus is closed
   */
  public boolean publish(ErrorEvent event) {
    Objects.requireNonNull(event, "event");
    if (!accepting.get()) {
      reject();
      return false;
    }
    if (deduplicator != null && !deduplicator.tryAcquire(event)) {
      deduplicated.increment();
      metrics.incrementBusDeduplicated();
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Suppressed duplicate event " + event.eventId() + " from " + event.component());
      }
      return false;
    }
    if (!queue.offer(event)) {
      if (deduplicator != null) {
        deduplicator.release(event);
      }
      reject();
      return false;
    }
    published.increment();
    metrics.recordBusQueueDepth(queue.size());
    return true;
  }

  private void reject() {
    rejected.increment();
    metrics.incrementBusRejected();
  }

  public int queueDepth() {
    return queue.size();
  }

  public long publishedCount() {
    return published.sum();
  }

  public long rejectedCount() {
    return rejected.sum();
  }

  /**
   * Returns how many publishes were suppressed as repeats of a recent event.
   */
  public long deduplicatedCount() {
    return deduplicated.sum();
  }

  /**
   * Returns how many consumer invocations ended in an exception.
   */
  public long consumerFailureCount() {
    return consumerFailures.sum();
  }

  public List<String> consumerNames() {
    List<String> names = new ArrayList<>(consumers.size());
    for (EventConsumer consumer : consumers) {
      names.add(consumer.name());
    }
    return names;
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        if (!running.get() && queue.isEmpty()) {
          break;
        }
        ErrorEvent first = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (first == null) {
          if (!running.get()) break;
          continue;
        }
        List<ErrorEvent> events = anyBatching() ? collectBatch(first) : List.of(first);
        deliver(events);
        metrics.recordBusQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Event bus loop error", t);
      }
    }
  }

  private boolean anyBatching() {
    for (EventConsumer consumer : consumers) {
      if (consumer.supportsBatching()) {
        return true;
      }
    }
    return false;
  }

  private List<ErrorEvent> collectBatch(ErrorEvent first) throws InterruptedException {
    List<ErrorEvent> batch = new ArrayList<>(batchSize);
    batch.add(first);
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(batchTimeoutMs);
    while (batch.size() < batchSize) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0 || !running.get()) {
        queue.drainTo(batch, batchSize - batch.size());
        break;
      }
      ErrorEvent next = queue.poll(remaining, TimeUnit.NANOSECONDS);
      if (next == null) {
        break;
      }
      batch.add(next);
    }
    return batch;
  }

  private void deliver(List<ErrorEvent> events) {
    for (EventConsumer consumer : consumers) {
      if (consumer.supportsBatching() && events.size() > 1) {
        try {
          consumer.processBatch(events);
        } catch (TransportException | RuntimeException e) {
          onConsumerFailure(consumer, events.size() + " events", e);
        }
        continue;
      }
      for (ErrorEvent event : events) {
        try {
          consumer.processEvent(event);
        } catch (TransportException | RuntimeException e) {
          onConsumerFailure(consumer, "event " + event.eventId(), e);
        }
      }
    }
  }

  private void onConsumerFailure(EventConsumer consumer, String what, Exception e) {
    consumerFailures.increment();
    logger.log(Level.WARNING, "Consumer " + consumer.name() + " failed to process " + what
        + ": " + e.getClass().getName());
    logger.log(Level.FINE, "Consumer failure detail", e);
  }

  /**
   * Initiates graceful shutdown: stops accepting new events, drains remaining queued
   * events within the configured drain timeout, then shuts down worker threads.
   */
  @Override
  public void close() {
    if (!accepting.getAndSet(false)) {
      return;
    }
    running.set(false);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + queue.size());
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link AsyncEventBus}. */
  public static final class Builder {
    private int workerCount = 2;
    private int queueCapacity = 1000;
    private int batchSize = 10;
    private Duration batchTimeout = Duration.ofMillis(100);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private String threadNamePrefix = "telemetry-bus-";
    private Duration deduplicationTtl = DEFAULT_DEDUPLICATION_TTL;
    private int deduplicationMaxEntries = DEFAULT_DEDUPLICATION_MAX_ENTRIES;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the number of threads delivering events to consumers.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &ge; 1.
     *
     * @param workerCount number of delivery threads
     * @return this builder
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the bounded capacity of the event queue.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param queueCapacity maximum number of queued events
     * @return this builder
     */
    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    /**
     * Sets the largest batch handed to a batching consumer.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &ge; 1.
     *
     * @param batchSize maximum batch size
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how long a worker waits to fill a batch once it holds the first event.
     *
     * <p>Optional. Defaults to 100 ms.
     *
     * @param batchTimeout batch fill timeout
     * @return this builder
     */
    public Builder batchTimeout(Duration batchTimeout) {
      this.batchTimeout = batchTimeout;
      return this;
    }

    /**
     * Sets the maximum time to wait for queued events during shutdown.
     *
     * <p>Optional. Defaults to 5 seconds.
     *
     * @param drainTimeout drain timeout
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Optional. Defaults to {@code "telemetry-bus-"}.
     *
     * @param threadNamePrefix prefix of worker thread names
     * @return this builder
     */
    public Builder threadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = threadNamePrefix;
      return this;
    }

    /**
     * Sets how long an event suppresses identical events published after it.
     *
     * <p>Optional. Defaults to 5 minutes. {@link Duration#ZERO} disables deduplication.
     *
     * @param deduplicationTtl deduplication window
     * @return this builder
     */
    public Builder deduplicationTtl(Duration deduplicationTtl) {
      this.deduplicationTtl = deduplicationTtl;
      return this;
    }

    /**
     * Sets how many recent events are remembered for deduplication.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &ge; 1.
     *
     * @param deduplicationMaxEntries maximum number of remembered events
     * @return this builder
     */
    public Builder deduplicationMaxEntries(int deduplicationMaxEntries) {
      this.deduplicationMaxEntries = deduplicationMaxEntries;
      return this;
    }

    /**
     * Sets the time source of the deduplication window.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter for rejected publishes and queue depth.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds and starts the bus. Worker threads begin draining immediately.
     *
     * @return a new {@link AsyncEventBus}
     * @throws IllegalArgumentException if {@code workerCount < 1}, {@code queueCapacity <= 0},
     *     {@code batchSize < 1}, {@code deduplicationMaxEntries < 1} with deduplication enabled,
     *     or a timeout is negative
     */
    public AsyncEventBus build() {
      return new AsyncEventBus(this);
    }
  }
}
