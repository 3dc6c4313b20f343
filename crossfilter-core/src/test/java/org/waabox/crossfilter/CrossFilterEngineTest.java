package org.waabox.crossfilter;

import static org.easymock.EasyMock.anyLong;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.isA;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.crossfilter.metrics.CrossFilterMetrics;

/**
 * Tests for {@link CrossFilterEngine}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CrossFilterEngineTest {

  /** The engine under test, stopped after each test. */
  private CrossFilterEngine engine;

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.stop();
    }
  }

  @Test
  void whenCreated_givenNoDataset_shouldHaveNoIndex() {
    engine = CrossFilterEngine.builder().build();

    assertEquals(EngineState.NO_INDEX, engine.state());
    assertTrue(engine.failure().isEmpty());
    assertEquals("id", engine.idField());
    assertThrows(IndexNotReadyException.class, engine::eligibleIds);
    assertThrows(IndexNotReadyException.class, engine::index);
    assertThrows(IndexNotReadyException.class,
        () -> engine.setFilter("number", List.of(1)));
  }

  @Test
  void whenLoading_givenRows_shouldDiscoverColumnsAndBecomeReady() {
    engine = CrossFilterEngine.builder().build();

    final FilterIndex index = engine.load(Rows.numbers(3)).join();

    assertEquals(EngineState.READY, engine.state());
    assertEquals(List.of("number", "mod3"), index.columnNames());
    assertEquals(Set.of("number", "mod3"), engine.filters().columns());
    assertFalse(engine.filters().hasActiveFilters());
    assertEquals(Set.of(1L, 2L, 3L), engine.eligibleIds());
  }

  @Test
  void whenFiltering_givenThreeRowExample_shouldCrossFilter() {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(3)).join();

    engine.setFilter("number", List.of(1));

    assertEquals(Set.of(1L), engine.eligibleIds());
    assertEquals(List.of(1.0d), engine.availableValues("mod3"));
    assertEquals(List.of(1.0d, 2.0d, 3.0d), engine.availableValues("number"));

    engine.clearFilter("number");

    assertEquals(List.of(0.0d, 1.0d, 2.0d), engine.availableValues("mod3"));
  }

  @Test
  void whenMutatingFilters_givenToggleAndToggleAll_shouldUpdateState() {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(9)).join();

    engine.toggle("mod3", 1);
    engine.toggle("mod3", 2);
    assertEquals(6, engine.eligibleRows().size());

    final FilterState toggled = engine.toggle("mod3", 1);
    assertEquals(Set.of(2.0d), toggled.selected("mod3"));
    assertEquals(toggled, engine.filters());

    engine.toggleAll("mod3", engine.availableValues("mod3"));
    assertEquals(9, engine.eligibleIds().size());
    assertTrue(engine.filters().isActive("mod3"));

    engine.toggleAll("mod3", engine.availableValues("mod3"));
    assertFalse(engine.filters().isActive("mod3"));

    engine.setFilter("number", List.of(1, 2));
    engine.setFilter("mod3", List.of(2));
    assertEquals(List.of(2L),
        engine.eligibleRows().stream().map(Row::id).toList());

    engine.clearAll();
    assertFalse(engine.filters().hasActiveFilters());
  }

  @Test
  void whenMutatingFilters_givenUnknownColumn_shouldFail() {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(3)).join();

    assertThrows(UnknownColumnException.class,
        () -> engine.setFilter("price", List.of(1)));
    assertThrows(UnknownColumnException.class,
        () -> engine.toggle("price", 1));
    assertThrows(UnknownColumnException.class,
        () -> engine.availableValues("price"));
    assertFalse(engine.filters().columns().contains("price"));
  }

  @Test
  void whenSearchingOptions_givenTerm_shouldNarrowAvailableValues() {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(12)).join();

    assertEquals(List.of(1.0d, 10.0d, 11.0d, 12.0d),
        engine.searchOptions("number", "1"));

    engine.setFilter("mod3", List.of(0));
    assertEquals(List.of(12.0d), engine.searchOptions("number", "1"));
    assertEquals(4, engine.searchOptions("number", "").size());
  }

  @Test
  void whenQueryingAllColumns_givenFilter_shouldReturnEveryColumn() {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(6)).join();
    engine.setFilter("number", List.of(3, 6));

    final Map<String, List<Double>> available = engine.availableValues();

    assertEquals(List.of(0.0d), available.get("mod3"));
    assertEquals(6, available.get("number").size());
  }

  @Test
  void whenLoading_givenNewDataset_shouldResetFilters() {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(3)).join();
    engine.setFilter("number", List.of(1));

    final FilterIndex second = engine.load(Rows.numbers(5)).join();

    assertEquals(2L, second.version());
    assertFalse(engine.filters().hasActiveFilters());
    assertEquals(5, engine.eligibleIds().size());
  }

  @Test
  void whenLoading_givenConfiguredColumns_shouldIndexOnlyThose() {
    engine = CrossFilterEngine.builder()
        .idField("id")
        .columns(List.of("mod3"))
        .build();

    final FilterIndex index = engine.load(Rows.numbers(4)).join();

    assertEquals(List.of("mod3"), index.columnNames());

    final FilterIndex explicit = engine.load(Rows.numbers(4),
        List.of("number")).join();
    assertEquals(List.of("number"), explicit.columnNames());
  }

  @Test
  void whenLoading_givenCustomIdField_shouldExcludeItFromColumns() {
    engine = CrossFilterEngine.builder().idField("number").build();

    final FilterIndex index = engine.load(Rows.numbers(3)).join();

    assertEquals(List.of("id", "mod3"), index.columnNames());
  }

  @Test
  void whenLoading_givenEmptyRows_shouldFailWithoutIndex() {
    engine = CrossFilterEngine.builder().build();

    final CompletableFuture<FilterIndex> result = engine.load(List.of());

    final CompletionException e = assertThrows(CompletionException.class,
        result::join);
    assertInstanceOf(EmptyDatasetException.class, e.getCause());
    assertEquals(EngineState.FAILED, engine.state());
    assertInstanceOf(EmptyDatasetException.class,
        engine.failure().orElseThrow());
    assertThrows(IndexNotReadyException.class, engine::index);
  }

  @Test
  void whenLoading_givenMalformedRows_shouldFailThenRecover() {
    engine = CrossFilterEngine.builder().columns(List.of("number")).build();

    final List<Row> bad = List.of(Rows.row(1, "number", "one"));
    assertThrows(CompletionException.class, () -> engine.load(bad).join());
    assertEquals(EngineState.FAILED, engine.state());

    engine.load(Rows.numbers(2)).join();
    assertEquals(EngineState.READY, engine.state());
    assertTrue(engine.failure().isEmpty());
  }

  @Test
  void whenRefreshing_givenNoRowLoader_shouldFail() {
    engine = CrossFilterEngine.builder().build();

    assertThrows(IllegalStateException.class, engine::refresh);
  }

  @Test
  void whenRefreshing_givenRowLoader_shouldReloadRows() {
    final AtomicInteger calls = new AtomicInteger();
    engine = CrossFilterEngine.builder()
        .loadWith(() -> Rows.numbers(calls.incrementAndGet() * 2))
        .build();

    assertEquals(2, engine.refresh().join().size());
    assertEquals(4, engine.refresh().join().size());
    assertEquals(2, calls.get());
  }

  @Test
  void whenRefreshing_givenFailingRowLoader_shouldMoveToFailed() {
    engine = CrossFilterEngine.builder()
        .loadWith(() -> {
          throw new IllegalStateException("source unavailable");
        })
        .build();

    assertThrows(CompletionException.class, () -> engine.refresh().join());
    assertEquals(EngineState.FAILED, engine.state());
    assertEquals("source unavailable",
        engine.failure().orElseThrow().getMessage());
  }

  @Test
  void whenRefreshing_givenLoaderThrowingCancellation_shouldMoveToFailed() {
    engine = CrossFilterEngine.builder()
        .loadWith(() -> {
          throw new CancellationException("upstream request cancelled");
        })
        .build();

    final CompletableFuture<FilterIndex> result = engine.refresh();

    assertThrows(CancellationException.class,
        () -> result.get(5, TimeUnit.SECONDS));
    assertEquals(EngineState.FAILED, engine.state());
    assertInstanceOf(CancellationException.class,
        engine.failure().orElseThrow());
  }

  @Test
  void whenRefreshing_givenLoaderThrowingError_shouldMoveToFailed() {
    final CrossFilterMetrics metrics = createMock(CrossFilterMetrics.class);
    metrics.buildFailed(isA(LinkageError.class));
    expectLastCall().once();
    metrics.indexBuilt(eq(2L), eq(2), anyLong());
    expectLastCall().once();
    replay(metrics);

    engine = CrossFilterEngine.builder()
        .metrics(metrics)
        .loadWith(() -> {
          throw new LinkageError("missing row class");
        })
        .build();

    final CompletableFuture<FilterIndex> result = engine.refresh();

    final ExecutionException e = assertThrows(ExecutionException.class,
        () -> result.get(5, TimeUnit.SECONDS));
    assertInstanceOf(LinkageError.class, e.getCause());
    assertEquals(EngineState.FAILED, engine.state());

    final FilterIndex recovered = engine.load(Rows.numbers(2)).join();
    assertEquals(2, recovered.size());
    verify(metrics);
  }

  @Test
  void whenLoading_givenBuildInFlight_shouldDiscardSupersededBuild()
      throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger calls = new AtomicInteger();

    final CrossFilterMetrics metrics = createMock(CrossFilterMetrics.class);
    metrics.buildSuperseded(1L);
    expectLastCall().once();
    metrics.indexBuilt(eq(2L), eq(6), anyLong());
    expectLastCall().once();
    replay(metrics);

    engine = CrossFilterEngine.builder()
        .metrics(metrics)
        .loadWith(() -> {
          if (calls.incrementAndGet() == 1) {
            started.countDown();
            await(release);
            return Rows.numbers(3);
          }
          return Rows.numbers(6);
        })
        .build();

    final CompletableFuture<FilterIndex> first = engine.refresh();
    assertTrue(started.await(5, TimeUnit.SECONDS));
    assertEquals(EngineState.INDEXING, engine.state());

    final CompletableFuture<FilterIndex> second = engine.refresh();

    assertThrows(CancellationException.class, first::join);
    assertEquals(6, second.join().size());
    assertEquals(EngineState.READY, engine.state());
    assertEquals(2L, engine.index().version());

    verify(metrics);
  }

  @Test
  void whenQuerying_givenMetrics_shouldReportBuildAndQueries() {
    final CrossFilterMetrics metrics = createMock(CrossFilterMetrics.class);
    metrics.indexBuilt(eq(1L), eq(3), anyLong());
    expectLastCall().once();
    metrics.queryExecuted(eq("eligibleIds"), anyLong());
    expectLastCall().once();
    metrics.queryExecuted(eq("availableValues"), anyLong());
    expectLastCall().once();
    replay(metrics);

    engine = CrossFilterEngine.builder().metrics(metrics).build();
    engine.load(Rows.numbers(3)).join();
    engine.eligibleIds();
    engine.availableValues("mod3");

    verify(metrics);
  }

  @Test
  void whenLoading_givenFailure_shouldReportIt() {
    final CrossFilterMetrics metrics = createMock(CrossFilterMetrics.class);
    metrics.buildFailed(isA(EmptyDatasetException.class));
    expectLastCall().once();
    replay(metrics);

    engine = CrossFilterEngine.builder().metrics(metrics).build();
    assertThrows(CompletionException.class,
        () -> engine.load(List.of()).join());

    verify(metrics);
  }

  @Test
  void whenStopping_givenInstalledIndex_shouldKeepItQueryable() {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(3)).join();

    engine.stop();
    engine.stop();

    assertEquals(EngineState.READY, engine.state());
    assertEquals(3, engine.eligibleIds().size());
    assertThrows(IllegalStateException.class,
        () -> engine.load(Rows.numbers(1)));
  }

  @Test
  void whenStopping_givenSharedExecutor_shouldLeaveItRunning() {
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      engine = CrossFilterEngine.builder().executor(executor).build();
      engine.load(Rows.numbers(3)).join();

      engine.stop();

      assertFalse(executor.isShutdown());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenStopping_givenBuildInFlight_shouldCancelIt() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    engine = CrossFilterEngine.builder()
        .loadWith(() -> {
          started.countDown();
          await(release);
          return Rows.numbers(3);
        })
        .build();

    final CompletableFuture<FilterIndex> result = engine.refresh();
    assertTrue(started.await(5, TimeUnit.SECONDS));

    engine.stop();

    assertThrows(CancellationException.class, result::join);
    assertEquals(EngineState.NO_INDEX, engine.state());
  }

  @Test
  void whenBuilding_givenInvalidConfiguration_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> CrossFilterEngine.builder().idField(""));
    assertThrows(IllegalArgumentException.class,
        () -> CrossFilterEngine.builder().columns(List.of()));
    assertThrows(NullPointerException.class,
        () -> CrossFilterEngine.builder().loadWith(null));
  }

  @Test
  void whenQueryingConcurrently_givenReloads_shouldSeeConsistentViews()
      throws Exception {
    engine = CrossFilterEngine.builder().build();
    engine.load(Rows.numbers(30)).join();

    final AtomicInteger errors = new AtomicInteger();
    final Thread reader = new Thread(() -> {
      for (int i = 0; i < 2000; i++) {
        try {
          final Set<Long> ids = engine.eligibleIds();
          if (ids.size() != 30 && ids.size() != 60) {
            errors.incrementAndGet();
          }
        } catch (final IndexNotReadyException e) {
          // a build is running
        }
      }
    });
    reader.start();
    for (int i = 0; i < 10; i++) {
      engine.load(Rows.numbers(i % 2 == 0 ? 60 : 30)).join();
    }
    reader.join();

    assertEquals(0, errors.get());
  }

  /**
   * Waits on a latch, returning early if the thread is interrupted.
   *
   * @param latch the latch to wait on, never null
   */
  private static void await(final CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
