package org.waabox.crossfilter;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.crossfilter.metrics.CrossFilterMetrics;
import org.waabox.crossfilter.metrics.NoopCrossFilterMetrics;

/**
 * The main entry point of the cross-filter library.
 *
 * <p>The engine owns the lifecycle of one dataset at a time: it builds the
 * {@link FilterIndex} in the background, installs it atomically, keeps the
 * user's {@link FilterState} and answers eligibility and availability
 * queries over both.
 *
 * <p>Submitting a dataset moves the engine to {@link EngineState#INDEXING}
 * and cancels any build still running for an older dataset. Only the build
 * of the latest submission may install its index; results of superseded
 * builds are discarded. A successful install resets the filter state to
 * one empty selection per column and moves the engine to
 * {@link EngineState#READY}; a failure moves it to
 * {@link EngineState#FAILED} until the next submission.
 *
 * <p>The installed index and the filter state are published together as
 * one immutable view, so every query sees a consistent pair. Queries are
 * lock-free.
 *
 * <p>Usage example:
 * <pre>{@code
 * CrossFilterEngine engine = CrossFilterEngine.builder()
 *     .idField("id")
 *     .loadWith(new CsvRowLoader(path))
 *     .build();
 *
 * engine.refresh().join();
 * engine.setFilter("mod3", List.of(1));
 * List<Double> numbers = engine.availableValues("number");
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CrossFilterEngine {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CrossFilterEngine.class);

  /** The default identifier field name. */
  private static final String DEFAULT_ID_FIELD = "id";

  /** The name of the identifier field, excluded from column discovery. */
  private final String idField;

  /** The fixed filterable columns, null to discover them per dataset. */
  private final List<String> columns;

  /** The row loader, null if datasets are only pushed through load(). */
  private final RowLoader rowLoader;

  /** The metrics reporter. */
  private final CrossFilterMetrics metrics;

  /** The executor running index builds. */
  private final ExecutorService executor;

  /** Whether the executor was created by this engine. */
  private final boolean ownsExecutor;

  /** The current state, index and filters, atomically swapped. */
  private final AtomicReference<View> view;

  /** The lock used to serialize build submissions and installs. */
  private final ReentrantLock buildLock;

  /** The dataset version counter; only the latest version may install. */
  private final AtomicLong versionCounter;

  /** Whether this engine has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /** The running build task, guarded by the build lock. */
  private Future<?> inFlight;

  /** The result of the running build, guarded by the build lock. */
  private CompletableFuture<FilterIndex> inFlightResult;

  /** The version of the running build, guarded by the build lock. */
  private long inFlightVersion;

  /**
   * Creates a new engine.
   *
   * @param idField      the identifier field name, never null
   * @param columns      the fixed columns, may be null
   * @param rowLoader    the row loader, may be null
   * @param metrics      the metrics reporter, never null
   * @param executor     the build executor, never null
   * @param ownsExecutor whether stop() must shut the executor down
   */
  private CrossFilterEngine(final String idField,
      final List<String> columns,
      final RowLoader rowLoader,
      final CrossFilterMetrics metrics,
      final ExecutorService executor,
      final boolean ownsExecutor) {
    this.idField = idField;
    this.columns = columns;
    this.rowLoader = rowLoader;
    this.metrics = metrics;
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
    this.view = new AtomicReference<>(View.INITIAL);
    this.buildLock = new ReentrantLock();
    this.versionCounter = new AtomicLong(0);
  }

  /**
   * Creates a new builder for constructing a CrossFilterEngine.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  // -----------------------------------------------------------------------
  // Dataset lifecycle
  // -----------------------------------------------------------------------

  /**
   * Submits a new dataset for indexing.
   *
   * <p>The filterable columns are the ones configured on the builder, or,
   * if none were, the numeric fields of the first row except the
   * identifier field. The rows are copied before this method returns.
   *
   * @param rows the dataset rows, never null
   *
   * @return a future completed with the installed index, or exceptionally
   *         with the build error, or with a {@link CancellationException}
   *         if a newer dataset superseded this one; never null
   *
   * @throws IllegalStateException if the engine has been stopped
   */
  public CompletableFuture<FilterIndex> load(final List<Row> rows) {
    Objects.requireNonNull(rows, "rows must not be null");
    final List<Row> dataset = List.copyOf(rows);
    return submit(() -> dataset, columns);
  }

  /**
   * Submits a new dataset for indexing over the given columns.
   *
   * @param rows         the dataset rows, never null
   * @param indexColumns the filterable columns, never null
   *
   * @return a future completed with the installed index, never null
   *
   * @throws IllegalStateException if the engine has been stopped
   *
   * @see #load(List)
   */
  public CompletableFuture<FilterIndex> load(final List<Row> rows,
      final List<String> indexColumns) {
    Objects.requireNonNull(rows, "rows must not be null");
    Objects.requireNonNull(indexColumns, "indexColumns must not be null");
    final List<Row> dataset = List.copyOf(rows);
    return submit(() -> dataset, List.copyOf(indexColumns));
  }

  /**
   * Re-executes the RowLoader and indexes its rows as a new dataset.
   *
   * <p>The loader runs on the build executor, so a slow source does not
   * block the caller.
   *
   * @return a future completed with the installed index, never null
   *
   * @throws IllegalStateException if no RowLoader is configured, or if the
   *                               engine has been stopped
   */
  public CompletableFuture<FilterIndex> refresh() {
    if (rowLoader == null) {
      throw new IllegalStateException(
          "Cannot refresh an engine without a RowLoader. "
              + "Use load(List<Row>) to provide rows explicitly.");
    }
    return submit(rowLoader::load, columns);
  }

  /**
   * Stops the engine.
   *
   * <p>Any running build is cancelled and will not install its index. An
   * executor created by the engine is shut down; one passed to the builder
   * is left running. The installed index, if any, stays queryable.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    buildLock.lock();
    try {
      versionCounter.incrementAndGet();
      cancelInFlight("engine stopped");
      view.updateAndGet(current -> current.state() == EngineState.INDEXING
          ? View.INITIAL : current);
    } finally {
      buildLock.unlock();
    }
    if (ownsExecutor) {
      executor.shutdownNow();
    }
  }

  // -----------------------------------------------------------------------
  // Queries
  // -----------------------------------------------------------------------

  /**
   * Returns the current lifecycle state.
   *
   * @return the state, never null
   */
  public EngineState state() {
    return view.get().state();
  }

  /**
   * Returns the error of the latest build, if it failed.
   *
   * @return the failure cause, or empty if the engine is not in
   *         {@link EngineState#FAILED}
   */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(view.get().failure());
  }

  /**
   * Returns the name of the identifier field.
   *
   * @return the identifier field name, never null
   */
  public String idField() {
    return idField;
  }

  /**
   * Returns the installed index.
   *
   * @return the index, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   */
  public FilterIndex index() {
    return requireReady().index();
  }

  /**
   * Returns statistics about the installed index.
   *
   * @return the index info, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   */
  public IndexInfo info() {
    return index().info();
  }

  /**
   * Returns the current filter state.
   *
   * @return the filter state, never null
   */
  public FilterState filters() {
    return view.get().filters();
  }

  /**
   * Computes the identifiers of the rows passing every active filter.
   *
   * @return an unmodifiable set of row identifiers, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   *
   * @see IntersectionEngine#eligibleIds(FilterIndex, FilterState)
   */
  public Set<Long> eligibleIds() {
    final View current = requireReady();
    final long start = System.nanoTime();
    final Set<Long> ids = IntersectionEngine.eligibleIds(current.index(),
        current.filters());
    recordQuery("eligibleIds", start);
    return ids;
  }

  /**
   * Returns the rows passing every active filter, by ascending identifier.
   *
   * @return an unmodifiable list of rows, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   */
  public List<Row> eligibleRows() {
    final View current = requireReady();
    final long start = System.nanoTime();
    final List<Row> rows = IntersectionEngine.eligibleRows(current.index(),
        current.filters());
    recordQuery("eligibleRows", start);
    return rows;
  }

  /**
   * Computes the values still selectable in a column under the filters of
   * every other column.
   *
   * @param column the column name, never null
   *
   * @return an unmodifiable ascending list of values, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   * @throws UnknownColumnException if the column is not indexed
   *
   * @see IntersectionEngine#availableValues(FilterIndex, FilterState,
   *      String)
   */
  public List<Double> availableValues(final String column) {
    Objects.requireNonNull(column, "column must not be null");
    final View current = requireReady();
    final long start = System.nanoTime();
    final List<Double> values = IntersectionEngine.availableValues(
        current.index(), current.filters(), column);
    recordQuery("availableValues", start);
    return values;
  }

  /**
   * Computes the selectable values of every column against one consistent
   * index and filter state.
   *
   * @return an unmodifiable map of column to available values, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   */
  public Map<String, List<Double>> availableValues() {
    final View current = requireReady();
    final long start = System.nanoTime();
    final Map<String, List<Double>> values =
        IntersectionEngine.availableValues(current.index(),
            current.filters());
    recordQuery("availableValuesAll", start);
    return values;
  }

  /**
   * Returns the available values of a column whose display text contains
   * the search term.
   *
   * @param column the column name, never null
   * @param term   the search term, may be null or empty
   *
   * @return the matching available values, ascending, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   * @throws UnknownColumnException if the column is not indexed
   */
  public List<Double> searchOptions(final String column, final String term) {
    return ValueSearch.matching(availableValues(column), term);
  }

  // -----------------------------------------------------------------------
  // Filter state mutations
  // -----------------------------------------------------------------------

  /**
   * Replaces the selection of a column.
   *
   * @param column the column name, never null
   * @param values the selected values, never null
   *
   * @return the resulting filter state, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   * @throws UnknownColumnException if the column is not indexed
   */
  public FilterState setFilter(final String column,
      final Collection<? extends Number> values) {
    Objects.requireNonNull(column, "column must not be null");
    Objects.requireNonNull(values, "values must not be null");
    return updateFilters(column, f -> f.setFilter(column, values));
  }

  /**
   * Toggles a single value in the selection of a column.
   *
   * @param column the column name, never null
   * @param value  the value, never null
   *
   * @return the resulting filter state, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   * @throws UnknownColumnException if the column is not indexed
   */
  public FilterState toggle(final String column, final Number value) {
    Objects.requireNonNull(column, "column must not be null");
    Objects.requireNonNull(value, "value must not be null");
    return updateFilters(column, f -> f.toggle(column, value));
  }

  /**
   * Selects all visible values of a column, or clears it.
   *
   * @param column        the column name, never null
   * @param visibleValues the values currently offered, never null
   *
   * @return the resulting filter state, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   * @throws UnknownColumnException if the column is not indexed
   *
   * @see FilterState#toggleAll(String, Collection)
   */
  public FilterState toggleAll(final String column,
      final Collection<? extends Number> visibleValues) {
    Objects.requireNonNull(column, "column must not be null");
    Objects.requireNonNull(visibleValues, "visibleValues must not be null");
    return updateFilters(column, f -> f.toggleAll(column, visibleValues));
  }

  /**
   * Clears the selection of a column.
   *
   * @param column the column name, never null
   *
   * @return the resulting filter state, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   * @throws UnknownColumnException if the column is not indexed
   */
  public FilterState clearFilter(final String column) {
    Objects.requireNonNull(column, "column must not be null");
    return updateFilters(column, f -> f.clearFilter(column));
  }

  /**
   * Clears the selection of every column.
   *
   * @return the resulting filter state, never null
   *
   * @throws IndexNotReadyException if the engine is not ready
   */
  public FilterState clearAll() {
    return updateFilters(null, FilterState::clearAll);
  }

  // -----------------------------------------------------------------------
  // Internals
  // -----------------------------------------------------------------------

  /**
   * Registers a new build as the only one allowed to install.
   *
   * @param source         supplies the dataset rows, never null
   * @param requestedColumns the columns to index, null to discover them
   *
   * @return the future of the new build, never null
   */
  private CompletableFuture<FilterIndex> submit(
      final Supplier<List<Row>> source, final List<String> requestedColumns) {
    if (stopped.get()) {
      throw new IllegalStateException(
          "Cannot load a dataset after stop() has been called");
    }
    final CompletableFuture<FilterIndex> result = new CompletableFuture<>();
    buildLock.lock();
    try {
      final long version = versionCounter.incrementAndGet();
      cancelInFlight("superseded by version " + version);
      view.set(View.INDEXING);

      inFlightVersion = version;
      inFlightResult = result;
      try {
        inFlight = executor.submit(
            () -> runBuild(version, source, requestedColumns, result));
      } catch (final RejectedExecutionException e) {
        log.error("Index build for version {} rejected by executor",
            version, e);
        view.set(View.failed(e));
        inFlight = null;
        result.completeExceptionally(e);
      }
    } finally {
      buildLock.unlock();
    }
    return result;
  }

  /**
   * Loads the rows, builds the index and tries to install it.
   *
   * @param version          the dataset version of this build
   * @param source           supplies the dataset rows, never null
   * @param requestedColumns the columns to index, null to discover them
   * @param result           the future to complete, never null
   */
  private void runBuild(final long version,
      final Supplier<List<Row>> source,
      final List<String> requestedColumns,
      final CompletableFuture<FilterIndex> result) {
    final long start = System.nanoTime();
    try {
      final List<Row> rows = Objects.requireNonNull(source.get(),
          "RowLoader.load() must not return null");
      final List<String> indexColumns = requestedColumns != null
          ? requestedColumns
          : ColumnDiscovery.numericColumns(rows, idField);

      final FilterIndex index = IndexBuilder.build(rows, indexColumns,
          version, () -> isSuperseded(version)
              || Thread.currentThread().isInterrupted());

      final long durationMs = TimeUnit.NANOSECONDS.toMillis(
          System.nanoTime() - start);

      if (install(version, index)) {
        log.info("Installed index version {}: {} rows, {} columns in {} ms",
            version, index.size(), index.columnNames().size(), durationMs);
        metrics.indexBuilt(version, index.size(), durationMs);
        result.complete(index);
      } else {
        log.warn("Discarded index version {}, a newer dataset was submitted",
            version);
      }
    } catch (final CancellationException e) {
      if (isSuperseded(version)) {
        log.debug("Index build for version {} cancelled: {}", version,
            e.getMessage());
      } else {
        settleFailure(version, e, result);
      }
    } catch (final RuntimeException e) {
      settleFailure(version, e, result);
    } catch (final Error e) {
      settleFailure(version, e, result);
      throw e;
    }
  }

  /**
   * Moves the engine to {@link EngineState#FAILED} and fails the build's
   * future, unless a newer dataset superseded the build.
   *
   * @param version the dataset version of the build
   * @param cause   the failure, never null
   * @param result  the future to complete, never null
   */
  private void settleFailure(final long version, final Throwable cause,
      final CompletableFuture<FilterIndex> result) {
    if (fail(version, cause)) {
      log.error("Index build for version {} failed: {}", version,
          cause.getMessage(), cause);
      metrics.buildFailed(cause);
      result.completeExceptionally(cause);
    } else {
      log.debug("Superseded index build for version {} failed: {}",
          version, cause.getMessage());
    }
  }

  /**
   * Installs a built index if its build is still the latest one.
   *
   * <p>Once installed, the build is no longer in flight and its future is
   * left for the caller to complete.
   *
   * @param version the dataset version of the build
   * @param index   the built index, never null
   *
   * @return true if the index was installed
   */
  private boolean install(final long version, final FilterIndex index) {
    buildLock.lock();
    try {
      if (isSuperseded(version)) {
        return false;
      }
      view.set(View.ready(index));
      inFlight = null;
      return true;
    } finally {
      buildLock.unlock();
    }
  }

  /**
   * Records a build failure if its build is still the latest one.
   *
   * @param version the dataset version of the build
   * @param cause   the failure, never null
   *
   * @return true if the failure was recorded
   */
  private boolean fail(final long version, final Throwable cause) {
    buildLock.lock();
    try {
      if (isSuperseded(version)) {
        return false;
      }
      view.set(View.failed(cause));
      inFlight = null;
      return true;
    } finally {
      buildLock.unlock();
    }
  }

  /**
   * Cancels the running build, if any. Must hold the build lock.
   *
   * @param reason the reason reported to the build's future, never null
   */
  private void cancelInFlight(final String reason) {
    if (inFlight == null || inFlightResult.isDone()) {
      return;
    }
    inFlight.cancel(true);
    inFlightResult.completeExceptionally(new CancellationException(
        "Index build for version " + inFlightVersion + " " + reason));
    log.info("Cancelled index build for version {}: {}", inFlightVersion,
        reason);
    metrics.buildSuperseded(inFlightVersion);
    inFlight = null;
  }

  private boolean isSuperseded(final long version) {
    return versionCounter.get() != version;
  }

  private View requireReady() {
    final View current = view.get();
    if (current.state() != EngineState.READY) {
      throw new IndexNotReadyException(current.state());
    }
    return current;
  }

  /**
   * Applies a change to the filter state of the installed index.
   *
   * @param column the column the change targets, null if it targets all
   * @param change the change to apply, never null
   *
   * @return the resulting filter state, never null
   */
  private FilterState updateFilters(final String column,
      final UnaryOperator<FilterState> change) {
    final View next = view.updateAndGet(current -> {
      if (current.state() != EngineState.READY) {
        throw new IndexNotReadyException(current.state());
      }
      if (column != null && !current.index().hasColumn(column)) {
        throw new UnknownColumnException(column);
      }
      return current.withFilters(change.apply(current.filters()));
    });
    return next.filters();
  }

  private void recordQuery(final String query, final long start) {
    final long durationNs = System.nanoTime() - start;
    metrics.queryExecuted(query, durationNs);
    if (log.isDebugEnabled()) {
      log.debug("{} took {} us", query,
          TimeUnit.NANOSECONDS.toMicros(durationNs));
    }
  }

  /**
   * The state, index and filters published together to readers.
   *
   * @param state   the lifecycle state, never null
   * @param index   the installed index, null unless ready
   * @param filters the filter state, never null
   * @param failure the build failure, null unless failed
   */
  private record View(EngineState state, FilterIndex index,
      FilterState filters, Throwable failure) {

    /** The view before any dataset was submitted. */
    static final View INITIAL = new View(EngineState.NO_INDEX, null,
        FilterState.empty(), null);

    /** The view while a build is running. */
    static final View INDEXING = new View(EngineState.INDEXING, null,
        FilterState.empty(), null);

    static View ready(final FilterIndex index) {
      return new View(EngineState.READY, index,
          FilterState.forColumns(index.columnNames()), null);
    }

    static View failed(final Throwable cause) {
      return new View(EngineState.FAILED, null, FilterState.empty(), cause);
    }

    View withFilters(final FilterState next) {
      return new View(state, index, next, failure);
    }
  }

  /**
   * A fluent builder for constructing {@link CrossFilterEngine} instances.
   *
   * <p>All configuration is optional. Defaults:
   * <ul>
   *   <li>idField: {@code "id"}</li>
   *   <li>columns: discovered per dataset</li>
   *   <li>rowLoader: none, datasets are pushed with load()</li>
   *   <li>metrics: {@link NoopCrossFilterMetrics}</li>
   *   <li>executor: a single daemon thread named
   *       {@code crossfilter-indexer}</li>
   * </ul>
   */
  public static final class Builder {

    /** The identifier field name. */
    private String idField = DEFAULT_ID_FIELD;

    /** The optional fixed columns. */
    private List<String> columns;

    /** The optional row loader. */
    private RowLoader rowLoader;

    /** The optional metrics reporter. */
    private CrossFilterMetrics metrics;

    /** The optional build executor. */
    private ExecutorService executor;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the name of the identifier field.
     *
     * @param theIdField the field name, never null or empty
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if theIdField is null
     * @throws IllegalArgumentException if theIdField is empty
     */
    public Builder idField(final String theIdField) {
      Objects.requireNonNull(theIdField, "idField must not be null");
      if (theIdField.isEmpty()) {
        throw new IllegalArgumentException("idField must not be empty");
      }
      this.idField = theIdField;
      return this;
    }

    /**
     * Fixes the filterable columns instead of discovering them from each
     * dataset.
     *
     * @param theColumns the column names, never null or empty
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException     if theColumns is null
     * @throws IllegalArgumentException if theColumns is empty
     */
    public Builder columns(final List<String> theColumns) {
      Objects.requireNonNull(theColumns, "columns must not be null");
      if (theColumns.isEmpty()) {
        throw new IllegalArgumentException("columns must not be empty");
      }
      this.columns = List.copyOf(theColumns);
      return this;
    }

    /**
     * Configures the engine to load its datasets via a {@link RowLoader}.
     *
     * @param loader the row loader, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if loader is null
     */
    public Builder loadWith(final RowLoader loader) {
      Objects.requireNonNull(loader, "loader must not be null");
      this.rowLoader = loader;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theMetrics is null
     */
    public Builder metrics(final CrossFilterMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Sets the executor that runs index builds. The engine does not shut
     * it down.
     *
     * @param theExecutor the executor, never null
     *
     * @return this builder for chaining, never null
     *
     * @throws NullPointerException if theExecutor is null
     */
    public Builder executor(final ExecutorService theExecutor) {
      Objects.requireNonNull(theExecutor, "executor must not be null");
      this.executor = theExecutor;
      return this;
    }

    /**
     * Builds the engine with the configured settings.
     *
     * @return a new engine in {@link EngineState#NO_INDEX}, never null
     */
    public CrossFilterEngine build() {
      final CrossFilterMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopCrossFilterMetrics();
      final boolean ownsExecutor = executor == null;
      final ExecutorService resolvedExecutor = ownsExecutor
          ? Executors.newSingleThreadExecutor(r -> {
            final Thread thread = new Thread(r, "crossfilter-indexer");
            thread.setDaemon(true);
            return thread;
          })
          : executor;

      return new CrossFilterEngine(idField, columns, rowLoader,
          resolvedMetrics, resolvedExecutor, ownsExecutor);
    }
  }
}
