package io.b2mash.jasper.mcpserver.execution;

import io.b2mash.jasper.mcpserver.exception.McpErrorType;
import io.b2mash.jasper.mcpserver.exception.NormalizedError;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of open and finished executions plus aggregate counters.
 *
 * <p>All state is guarded by a single lock so that {@code totalExecutions == successfulExecutions
 * + failedExecutions} holds for every snapshot. Each record is finalized at most once; counters
 * move only on that transition.
 */
@Component
public class ExecutionTracker {

  private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

  private final int historyLimit;
  private final Clock clock;
  private final Object lock = new Object();

  private final Map<String, ExecutionRecord> active = new LinkedHashMap<>();
  private final Deque<ExecutionRecord> history = new ArrayDeque<>();
  private final Map<String, ExecutionRecord> finishedById = new HashMap<>();
  private final Map<String, FormatCounters> formatCounters = new LinkedHashMap<>();
  private long totalExecutions;
  private long successfulExecutions;
  private long failedExecutions;
  private long cancelledExecutions;
  private long totalExecutionTimeMs;

  @Autowired
  public ExecutionTracker(@Value("${jasper.execution.history-limit:100}") int historyLimit) {
    this(historyLimit, Clock.systemUTC());
  }

  ExecutionTracker(int historyLimit, Clock clock) {
    if (historyLimit < 1) {
      throw new IllegalArgumentException("historyLimit must be positive, got " + historyLimit);
    }
    this.historyLimit = historyLimit;
    this.clock = clock;
  }

  /** Registers an open execution. Statistics are untouched until it is finalized. */
  public String begin(ExecutionRequest request, ExecutionMode mode) {
    return beginWithinLimit(request, mode, Integer.MAX_VALUE).orElseThrow();
  }

  /**
   * Registers an open execution unless {@code maxActive} executions of the same mode are already
   * open.
   *
   * @return the new execution id, or empty when the limit is reached
   */
  public Optional<String> beginWithinLimit(
      ExecutionRequest request, ExecutionMode mode, int maxActive) {
    String executionId = "exec_" + UUID.randomUUID().toString().replace("-", "");
    var record = ExecutionRecord.open(executionId, mode, request, clock.instant());
    synchronized (lock) {
      if (countActiveLocked(mode) >= maxActive) {
        return Optional.empty();
      }
      active.put(executionId, record);
    }
    log.debug(
        "Execution {} registered: mode={}, reportUri={}", executionId, mode, request.reportUri());
    return Optional.of(executionId);
  }

  public int countActive(ExecutionMode mode) {
    synchronized (lock) {
      return countActiveLocked(mode);
    }
  }

  /** Moves an open execution to another non-terminal state. */
  public Optional<ExecutionRecord> transition(String executionId, ExecutionState state) {
    if (state.isTerminal()) {
      throw new IllegalArgumentException(
          "Terminal state " + state + " must be reached through complete, fail or cancel");
    }
    return updateOpen(executionId, record -> record.withState(state));
  }

  /** Links an open asynchronous execution to the server-side request and marks it pending. */
  public Optional<ExecutionRecord> attachRemoteRequest(String executionId, String requestId) {
    return updateOpen(
        executionId,
        record -> record.withRemoteRequestId(requestId).withState(ExecutionState.PENDING));
  }

  /** Stores the latest progress reported for an open execution. */
  public Optional<ExecutionRecord> recordProgress(
      String executionId, ExecutionProgress progress) {
    return updateOpen(executionId, record -> record.withProgress(progress));
  }

  /**
   * Finalizes an open execution as successful.
   *
   * @return the terminal record, or empty when the execution was not open
   */
  public Optional<ExecutionRecord> complete(String executionId, ExecutionOutput output) {
    return finish(executionId, record -> record.completed(output, clock.instant()));
  }

  /**
   * Finalizes an open execution as failed.
   *
   * @return the terminal record, or empty when the execution was not open
   */
  public Optional<ExecutionRecord> fail(String executionId, NormalizedError error) {
    return finish(executionId, record -> record.failed(error, clock.instant()));
  }

  /** Finalizes an open execution as cancelled. Cancellations count as failures. */
  public Optional<ExecutionRecord> cancel(String executionId) {
    return finish(executionId, record -> record.cancelled(clock.instant()));
  }

  public Optional<ExecutionRecord> find(String executionId) {
    synchronized (lock) {
      var record = active.get(executionId);
      return Optional.ofNullable(record != null ? record : finishedById.get(executionId));
    }
  }

  public List<ExecutionRecord> getActiveExecutions() {
    synchronized (lock) {
      return List.copyOf(active.values());
    }
  }

  /** Finished executions, oldest first. */
  public List<ExecutionRecord> getExecutionHistory() {
    synchronized (lock) {
      return List.copyOf(history);
    }
  }

  /** The {@code limit} most recent finished executions, oldest first. */
  public List<ExecutionRecord> getExecutionHistory(int limit) {
    synchronized (lock) {
      var all = new ArrayList<>(history);
      int from = Math.max(0, all.size() - Math.max(0, limit));
      return List.copyOf(all.subList(from, all.size()));
    }
  }

  public ExecutionStatistics getStatistics() {
    synchronized (lock) {
      var formats = new LinkedHashMap<String, FormatStatistics>();
      formatCounters.forEach((format, counters) -> formats.put(format, counters.snapshot()));
      return new ExecutionStatistics(
          totalExecutions,
          successfulExecutions,
          failedExecutions,
          cancelledExecutions,
          active.size(),
          totalExecutions == 0 ? 0 : (double) totalExecutionTimeMs / totalExecutions,
          Collections.unmodifiableMap(formats));
    }
  }

  /** Drops open and finished executions and resets every counter to zero. */
  public void clear() {
    synchronized (lock) {
      active.clear();
      history.clear();
      finishedById.clear();
      formatCounters.clear();
      totalExecutions = 0;
      successfulExecutions = 0;
      failedExecutions = 0;
      cancelledExecutions = 0;
      totalExecutionTimeMs = 0;
    }
    log.info("Execution history and statistics cleared");
  }

  /**
   * Drops finished executions that ended more than {@code maxAge} ago and fails asynchronous
   * executions still open after {@code maxAge} with {@code TimeoutError}. Counters are never
   * decremented.
   */
  public ExecutionCleanupResult cleanupOldExecutions(Duration maxAge) {
    var now = clock.instant();
    var cutoff = now.minus(maxAge);
    int removed = 0;
    var expired = new ArrayList<String>();
    synchronized (lock) {
      var iterator = history.iterator();
      while (iterator.hasNext()) {
        var record = iterator.next();
        if (record.finishedAt().isBefore(cutoff)) {
          iterator.remove();
          finishedById.remove(record.executionId());
          removed++;
        }
      }

      for (var record : List.copyOf(active.values())) {
        if (record.mode() == ExecutionMode.ASYNC && record.startedAt().isBefore(cutoff)) {
          var error =
              NormalizedError.of(
                  McpErrorType.TIMEOUT,
                  "Execution "
                      + record.executionId()
                      + " did not finish within "
                      + maxAge.toMillis()
                      + " ms",
                  Map.of("executionId", record.executionId()));
          finishLocked(record.executionId(), open -> open.failed(error, now));
          expired.add(record.executionId());
        }
      }
    }
    if (removed > 0 || !expired.isEmpty()) {
      log.info(
          "Cleaned up {} finished executions, expired {} open executions: {}",
          removed,
          expired.size(),
          expired);
    }
    return new ExecutionCleanupResult(removed, expired.size());
  }

  private int countActiveLocked(ExecutionMode mode) {
    int count = 0;
    for (var record : active.values()) {
      if (record.mode() == mode) {
        count++;
      }
    }
    return count;
  }

  private Optional<ExecutionRecord> updateOpen(
      String executionId, UnaryOperator<ExecutionRecord> update) {
    synchronized (lock) {
      var record = active.get(executionId);
      if (record == null) {
        return Optional.empty();
      }
      var updated = update.apply(record);
      active.put(executionId, updated);
      log.debug("Execution {} -> {}", executionId, updated.state());
      return Optional.of(updated);
    }
  }

  private Optional<ExecutionRecord> finish(
      String executionId, UnaryOperator<ExecutionRecord> terminal) {
    ExecutionRecord finished;
    synchronized (lock) {
      finished = finishLocked(executionId, terminal);
    }
    if (finished == null) {
      return Optional.empty();
    }
    log.debug("Execution {} finished: {}", executionId, finished.state());
    return Optional.of(finished);
  }

  private ExecutionRecord finishLocked(
      String executionId, UnaryOperator<ExecutionRecord> terminal) {
    var record = active.remove(executionId);
    if (record == null) {
      return null;
    }
    var finished = terminal.apply(record);
    updateCounters(finished);
    history.addLast(finished);
    finishedById.put(executionId, finished);
    while (history.size() > historyLimit) {
      finishedById.remove(history.removeFirst().executionId());
    }
    return finished;
  }

  private void updateCounters(ExecutionRecord finished) {
    long elapsed = Duration.between(finished.startedAt(), finished.finishedAt()).toMillis();
    String format =
        finished.outputFormat() == null
            ? "unknown"
            : finished.outputFormat().toLowerCase(Locale.ROOT);
    var counters = formatCounters.computeIfAbsent(format, key -> new FormatCounters());

    totalExecutions++;
    totalExecutionTimeMs += elapsed;
    counters.executions++;
    counters.totalTimeMs += elapsed;
    if (finished.success()) {
      successfulExecutions++;
      counters.successes++;
      counters.totalBytes += finished.fileSize();
    } else {
      failedExecutions++;
      counters.failures++;
      if (finished.state() == ExecutionState.CANCELLED) {
        cancelledExecutions++;
      }
    }
  }

  private static final class FormatCounters {
    private long executions;
    private long successes;
    private long failures;
    private long totalTimeMs;
    private long totalBytes;

    private FormatStatistics snapshot() {
      return new FormatStatistics(
          executions,
          successes,
          failures,
          executions == 0 ? 0 : (double) totalTimeMs / executions,
          successes == 0 ? 0 : (double) totalBytes / successes);
    }
  }
}
