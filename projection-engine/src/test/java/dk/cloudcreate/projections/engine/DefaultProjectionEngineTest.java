package dk.cloudcreate.projections.engine;

import dk.cloudcreate.projections.bus.*;
import dk.cloudcreate.projections.checkpoint.RecordingCheckpointStore;
import dk.cloudcreate.projections.common.types.CheckpointKey;
import dk.cloudcreate.projections.handler.*;
import dk.cloudcreate.projections.monitor.InMemoryProjectionMonitor;
import dk.cloudcreate.projections.options.*;
import dk.cloudcreate.projections.registry.ProjectionHandlerRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.*;
import reactor.core.publisher.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.*;

class DefaultProjectionEngineTest {
    private ProjectionHandlerRegistry registry;
    private InMemoryEventBus          eventBus;
    private RecordingCheckpointStore  checkpointStore;
    private InMemoryProjectionMonitor monitor;
    private DefaultProjectionEngine   engine;

    @BeforeEach
    void setup() {
        registry = new ProjectionHandlerRegistry();
        eventBus = new InMemoryEventBus("TestBus", Optional.of(1000));
        checkpointStore = new RecordingCheckpointStore();
        monitor = new InMemoryProjectionMonitor();
    }

    @AfterEach
    void cleanup() {
        if (engine != null) {
            engine.stop();
        }
    }

    @Test
    void test_engine_without_handlers_stops_immediately() {
        // Given
        engine = createEngine(eventBus);

        // When
        engine.start();

        // Then
        assertThat(engine.state()).isEqualTo(EngineState.STOPPED);
        assertThat(engine.isStarted()).isFalse();
        assertThat(engine.termination()).isCompleted();
    }

    @Test
    void test_lifecycle_state_transitions() {
        // Given
        registry.registerProjection(UserRegistered.class, new UserCountProjection());
        engine = createEngine(eventBus);
        assertThat(engine.state()).isEqualTo(EngineState.IDLE);

        // When
        engine.start();
        engine.start();

        // Then
        assertThat(engine.state()).isEqualTo(EngineState.RUNNING);
        assertThat(engine.isStarted()).isTrue();

        // When
        engine.stop();

        // Then
        assertThat(engine.state()).isEqualTo(EngineState.STOPPED);
        assertThat(engine.termination()).isCompleted();
        assertThat(engine.termination().isCompletedExceptionally()).isFalse();
    }

    @Test
    void test_non_partitioned_checkpoints_are_batched_and_flushed_on_stop() {
        // Given
        var projection = new UserCountProjection();
        registry.registerProjection(UserRegistered.class, projection, ProjectionOptions.builder()
                                                                                     .projectionName("UserCount")
                                                                                     .checkpointBatchSize(2)
                                                                                     .build());
        engine = createEngine(eventBus);
        engine.start();

        // When
        for (var i = 0; i < 5; i++) {
            eventBus.publish(new UserRegistered("user-" + i, i));
        }

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(projection.projectedEvents).hasSize(5));
        var checkpointKey = CheckpointKey.forProjection("UserCount");
        assertThat(checkpointStore.savedPositions(checkpointKey)).containsExactly(2L, 4L);

        // When
        engine.stop();

        // Then
        assertThat(checkpointStore.savedPositions(checkpointKey)).containsExactly(2L, 4L, 5L);
        assertThat(projection.projectedEvents).extracting(event -> event.sequence).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void test_partitioned_handler_sees_each_partitions_events_in_publish_order() {
        // Given
        var projection = new UserActivityProjection();
        registry.registerPartitionedProjection(UserRegistered.class, projection, ProjectionOptions.builder()
                                                                                                .projectionName("UserActivity")
                                                                                                .maxDegreeOfParallelism(4)
                                                                                                .checkpointBatchSize(100)
                                                                                                .build());
        engine = createEngine(eventBus);
        engine.start();

        // When
        eventBus.publish(new UserRegistered("u1", 1));
        eventBus.publish(new UserRegistered("u2", 1));
        eventBus.publish(new UserRegistered("u1", 2));
        eventBus.publish(new UserRegistered("u2", 2));
        eventBus.publish(new UserRegistered("u1", 3));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(projection.numberOfProjectedEvents()).isEqualTo(5));
        engine.stop();

        // Then
        assertThat(projection.eventsFor("u1")).extracting(event -> event.sequence).containsExactly(1, 2, 3);
        assertThat(projection.eventsFor("u2")).extracting(event -> event.sequence).containsExactly(1, 2);
        assertThat(projection.eventsFor("u1")).allMatch(event -> event.userId.equals("u1"));
        assertThat(checkpointStore.getCheckpoint(CheckpointKey.forPartition("UserActivity", "u1"))).hasValue(3L);
        assertThat(checkpointStore.getCheckpoint(CheckpointKey.forPartition("UserActivity", "u2"))).hasValue(2L);
    }

    @Test
    void test_failed_event_is_skipped_without_advancing_the_checkpoint() {
        // Given
        var attempts = new AtomicInteger();
        registry.registerProjection(UserRegistered.class, UserCountProjection.class, () -> event -> {
            if (attempts.incrementAndGet() == 3) {
                throw new IllegalStateException("Failure projecting the 3rd event");
            }
        }, Optional.of(ProjectionOptions.builder()
                                        .projectionName("UserCount")
                                        .checkpointBatchSize(2)
                                        .errorHandling(ErrorHandlingOptions.skip())
                                        .build()));
        engine = createEngine(eventBus);
        engine.start();

        // When
        for (var i = 0; i < 5; i++) {
            eventBus.publish(new UserRegistered("user-" + i, i));
        }
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(attempts.get()).isEqualTo(5));
        engine.stop();

        // Then
        assertThat(checkpointStore.savedPositions(CheckpointKey.forProjection("UserCount"))).containsExactly(2L, 4L);
        var metrics = monitor.getMetrics("UserCount", "_default").get();
        assertThat(metrics.getEventsProcessed()).isEqualTo(4);
        assertThat(metrics.getEventsFailed()).isEqualTo(1);
    }

    @Test
    void test_replay_deletes_existing_checkpoint_and_starts_from_zero() {
        // Given
        var checkpointKey = CheckpointKey.forProjection("UserCount");
        checkpointStore.saveCheckpoint(checkpointKey, 500);
        var projection = new UserCountProjection();
        registry.registerProjection(UserRegistered.class, projection, ProjectionOptions.builder()
                                                                                     .projectionName("UserCount")
                                                                                     .startupMode(ProjectionStartupMode.REPLAY)
                                                                                     .build());
        engine = createEngine(eventBus);
        engine.start();

        // When
        eventBus.publish(new UserRegistered("user-1", 1));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(projection.projectedEvents).hasSize(1));
        engine.stop();

        // Then
        assertThat(checkpointStore.resets()).containsExactly(checkpointKey);
        assertThat(checkpointStore.getCheckpoint(checkpointKey)).hasValue(1L);
    }

    @Test
    void test_resume_continues_from_existing_checkpoint() {
        // Given
        var checkpointKey = CheckpointKey.forProjection("UserCount");
        checkpointStore.saveCheckpoint(checkpointKey, 500);
        var projection = new UserCountProjection();
        registry.registerProjection(UserRegistered.class, projection, ProjectionOptions.builder()
                                                                                     .projectionName("UserCount")
                                                                                     .startupMode(ProjectionStartupMode.RESUME)
                                                                                     .build());
        engine = createEngine(eventBus);
        engine.start();

        // When
        eventBus.publish(new UserRegistered("user-1", 1));
        eventBus.publish(new UserRegistered("user-2", 2));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(projection.projectedEvents).hasSize(2));
        engine.stop();

        // Then
        assertThat(checkpointStore.resets()).isEmpty();
        assertThat(checkpointStore.getCheckpoint(checkpointKey)).hasValue(502L);
    }

    @Test
    void test_invalid_partition_key_only_affects_that_event_and_handler() {
        // Given
        var partitioned = new UserActivityProjection();
        var sequential  = new UserCountProjection();
        registry.registerPartitionedProjection(UserRegistered.class, partitioned)
                .registerProjection(UserRegistered.class, sequential);
        engine = createEngine(eventBus);
        engine.start();

        // When
        eventBus.publish(new UserRegistered("u1", 1));
        eventBus.publish(new UserRegistered("", 2));
        eventBus.publish(new UserRegistered("u1", 3));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> {
                      assertThat(sequential.projectedEvents).hasSize(3);
                      assertThat(partitioned.numberOfProjectedEvents()).isEqualTo(2);
                  });
        engine.stop();

        // Then
        assertThat(partitioned.eventsFor("u1")).extracting(event -> event.sequence).containsExactly(1, 3);
        assertThat(sequential.projectedEvents).extracting(event -> event.sequence).containsExactly(1, 2, 3);
    }

    @Test
    void test_error_thrown_while_resolving_a_partition_key_only_affects_that_event() {
        // Given
        var partitioned = new UserActivityProjection() {
            @Override
            public String partitionKey(UserRegistered event) {
                if (event.sequence == 2) {
                    throw new AssertionError("Corrupt partition key for event " + event.sequence);
                }
                return super.partitionKey(event);
            }
        };
        registry.registerPartitionedProjection(UserRegistered.class, partitioned, ProjectionOptions.builder()
                                                                                                 .projectionName("UserActivity")
                                                                                                 .build());
        engine = createEngine(eventBus);
        engine.start();

        // When
        eventBus.publish(new UserRegistered("u1", 1));
        eventBus.publish(new UserRegistered("u1", 2));
        eventBus.publish(new UserRegistered("u1", 3));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(partitioned.numberOfProjectedEvents()).isEqualTo(2));

        // Then
        assertThat(engine.state()).isEqualTo(EngineState.RUNNING);
        assertThat(engine.termination()).isNotDone();
        assertThat(partitioned.eventsFor("u1")).extracting(event -> event.sequence).containsExactly(1, 3);
    }

    @Test
    void test_error_thrown_by_a_handler_is_skipped_and_the_engine_keeps_running() {
        // Given
        var projection = new UserCountProjection() {
            @Override
            public void project(UserRegistered event) {
                if (event.sequence == 1) {
                    throw new AssertionError("Broken invariant for event " + event.sequence);
                }
                super.project(event);
            }
        };
        registry.registerProjection(UserRegistered.class, projection, ProjectionOptions.builder()
                                                                                     .projectionName("UserCount")
                                                                                     .checkpointBatchSize(2)
                                                                                     .errorHandling(ErrorHandlingOptions.skip())
                                                                                     .build());
        engine = createEngine(eventBus);
        engine.start();

        // When
        for (var i = 0; i < 5; i++) {
            eventBus.publish(new UserRegistered("user-" + i, i));
        }
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(projection.projectedEvents).hasSize(4));
        assertThat(engine.state()).isEqualTo(EngineState.RUNNING);
        eventBus.publish(new UserRegistered("user-5", 5));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(projection.projectedEvents).hasSize(5));
        engine.stop();

        // Then
        assertThat(projection.projectedEvents).extracting(event -> event.sequence).containsExactly(0, 2, 3, 4, 5);
        assertThat(checkpointStore.getCheckpoint(CheckpointKey.forProjection("UserCount"))).hasValue(5L);
        assertThat(monitor.getMetrics("UserCount", "_default").get().getEventsFailed()).isEqualTo(1);
    }

    @Test
    void test_every_handler_registered_for_an_event_type_receives_the_event() {
        // Given
        var first  = new UserCountProjection();
        var second = new UserActivityProjection();
        registry.registerProjection(UserRegistered.class, first)
                .registerPartitionedProjection(UserRegistered.class, second)
                .registerProjection(UserDeleted.class, UserCountProjection.class, () -> first::projectDeleted, Optional.empty());
        engine = createEngine(eventBus);
        engine.start();

        // When
        eventBus.publish(new UserRegistered("u1", 1));
        eventBus.publish(new UserDeleted("u1"));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> {
                      assertThat(first.deletedUsers).hasSize(1);
                      assertThat(second.numberOfProjectedEvents()).isEqualTo(1);
                  });
        engine.stop();

        // Then
        assertThat(first.projectedEvents).hasSize(1);
        assertThat(first.deletedUsers).containsExactly("u1");
        assertThat(second.eventsFor("u1")).hasSize(1);
    }

    @Test
    void test_parallelism_is_bounded_across_partitions() {
        // Given
        var concurrentInvocations    = new AtomicInteger();
        var maxConcurrentInvocations = new AtomicInteger();
        var projectedEvents          = new AtomicInteger();
        registry.registerPartitionedProjection(UserRegistered.class, UserActivityProjection.class, () -> new PartitionedProjectionHandler<UserRegistered>() {
            @Override
            public String partitionKey(UserRegistered event) {
                return event.userId;
            }

            @Override
            public void project(UserRegistered event) {
                var current = concurrentInvocations.incrementAndGet();
                maxConcurrentInvocations.accumulateAndGet(current, Math::max);
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    concurrentInvocations.decrementAndGet();
                    projectedEvents.incrementAndGet();
                }
            }
        }, Optional.of(ProjectionOptions.builder()
                                        .projectionName("UserActivity")
                                        .maxDegreeOfParallelism(2)
                                        .build()));
        engine = createEngine(eventBus);
        engine.start();

        // When
        for (var i = 0; i < 40; i++) {
            eventBus.publish(new UserRegistered("user-" + (i % 8), i));
        }
        Awaitility.waitAtMost(Duration.ofSeconds(10))
                  .untilAsserted(() -> assertThat(projectedEvents.get()).isEqualTo(40));
        engine.stop();

        // Then
        assertThat(projectedEvents.get()).isEqualTo(40);
        assertThat(maxConcurrentInvocations.get()).isBetween(1, 2);
        assertThat(engine.numberOfPartitionWorkers("UserActivity")).isEqualTo(8);
        assertThat(monitor.getMetrics("UserActivity", "user-0").get().getWorkerCount()).isEqualTo(8);
    }

    @Test
    void test_stop_strategy_halts_only_the_failing_partition() {
        // Given
        var projection = new UserActivityProjection(event -> event.userId.equals("u1") && event.sequence == 2);
        registry.registerPartitionedProjection(UserRegistered.class, projection, ProjectionOptions.builder()
                                                                                                .projectionName("UserActivity")
                                                                                                .errorHandling(ErrorHandlingOptions.stop())
                                                                                                .build());
        engine = createEngine(eventBus);
        engine.start();

        // When
        for (var sequence = 1; sequence <= 3; sequence++) {
            eventBus.publish(new UserRegistered("u1", sequence));
            eventBus.publish(new UserRegistered("u2", sequence));
        }
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> {
                      assertThat(projection.eventsFor("u2")).hasSize(3);
                      assertThat(monitor.getMetrics("UserActivity", "u1").get().getEventsDropped()).isEqualTo(1);
                  });
        engine.stop();

        // Then
        assertThat(projection.eventsFor("u1")).extracting(event -> event.sequence).containsExactly(1);
        assertThat(projection.eventsFor("u2")).extracting(event -> event.sequence).containsExactly(1, 2, 3);
        assertThat(checkpointStore.getCheckpoint(CheckpointKey.forPartition("UserActivity", "u1"))).hasValue(1L);
        assertThat(checkpointStore.getCheckpoint(CheckpointKey.forPartition("UserActivity", "u2"))).hasValue(3L);
        assertThat(monitor.getMetrics("UserActivity", "u1").get().getEventsDropped()).isEqualTo(1);
    }

    @Test
    void test_subscription_failure_drains_workers_and_completes_termination_exceptionally() {
        // Given
        var failingEventBus = new FailingEventBus();
        var projection      = new UserCountProjection();
        registry.registerProjection(UserRegistered.class, projection, ProjectionOptions.builder()
                                                                                     .projectionName("UserCount")
                                                                                     .build());
        engine = createEngine(failingEventBus);
        engine.start();

        // When
        failingEventBus.emit(new UserRegistered("user-1", 1));
        failingEventBus.emit(new UserRegistered("user-2", 2));
        failingEventBus.fail(new IllegalStateException("Connection lost"));

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(engine.state()).isEqualTo(EngineState.STOPPED));
        assertThat(engine.termination()).isCompletedExceptionally();
        assertThatThrownBy(() -> engine.termination().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProjectionEngineException.class)
                .hasRootCauseMessage("Connection lost");
        assertThat(projection.projectedEvents).hasSize(2);
        assertThat(checkpointStore.getCheckpoint(CheckpointKey.forProjection("UserCount"))).hasValue(2L);
    }

    // ------------------------------------------------------------------------------------------------------------------------

    private DefaultProjectionEngine createEngine(EventBus eventBus) {
        return new DefaultProjectionEngine(registry,
                                           eventBus,
                                           checkpointStore,
                                           Optional.of(monitor),
                                           Optional.of(Duration.ofSeconds(10)));
    }

    static final class UserRegistered {
        final String userId;
        final int    sequence;

        UserRegistered(String userId, int sequence) {
            this.userId = userId;
            this.sequence = sequence;
        }
    }

    static final class UserDeleted {
        final String userId;

        UserDeleted(String userId) {
            this.userId = userId;
        }
    }

    static class UserCountProjection implements ProjectionHandler<UserRegistered> {
        final List<UserRegistered> projectedEvents = new CopyOnWriteArrayList<>();
        final List<String>         deletedUsers    = new CopyOnWriteArrayList<>();

        @Override
        public void project(UserRegistered event) {
            projectedEvents.add(event);
        }

        void projectDeleted(UserDeleted event) {
            deletedUsers.add(event.userId);
        }
    }

    static class UserActivityProjection implements PartitionedProjectionHandler<UserRegistered> {
        private final ConcurrentMap<String, List<UserRegistered>> eventsPerUser = new ConcurrentHashMap<>();
        private final Predicate<UserRegistered> failWhen;

        UserActivityProjection() {
            this(event -> false);
        }

        UserActivityProjection(Predicate<UserRegistered> failWhen) {
            this.failWhen = failWhen;
        }

        @Override
        public String partitionKey(UserRegistered event) {
            return event.userId;
        }

        @Override
        public void project(UserRegistered event) {
            if (failWhen.test(event)) {
                throw new IllegalStateException("Simulated failure for " + event.userId + " #" + event.sequence);
            }
            eventsPerUser.computeIfAbsent(event.userId, userId -> new CopyOnWriteArrayList<>()).add(event);
        }

        List<UserRegistered> eventsFor(String userId) {
            return eventsPerUser.getOrDefault(userId, List.of());
        }

        int numberOfProjectedEvents() {
            return eventsPerUser.values().stream().mapToInt(List::size).sum();
        }
    }

    /**
     * {@link EventBus} whose subscriptions can be failed by the test
     */
    static class FailingEventBus implements EventBus {
        private final Sinks.Many<Object> sink = Sinks.many().multicast().onBackpressureBuffer();

        void emit(Object event) {
            sink.emitNext(event, Sinks.EmitFailureHandler.FAIL_FAST);
        }

        void fail(Throwable error) {
            sink.emitError(error, Sinks.EmitFailureHandler.FAIL_FAST);
        }

        @Override
        public <E> void publish(E event) {
            emit(event);
        }

        @Override
        public <E> Flux<E> subscribe(Class<E> eventType) {
            return sink.asFlux().ofType(eventType);
        }

        @Override
        public <E> EventBus addSyncHandler(Class<E> eventType, EventHandler<E> handler) {
            throw new UnsupportedOperationException();
        }

        @Override
        public <E> EventBus removeSyncHandler(Class<E> eventType, EventHandler<E> handler) {
            throw new UnsupportedOperationException();
        }
    }
}
