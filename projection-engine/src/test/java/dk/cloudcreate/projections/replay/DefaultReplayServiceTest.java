package dk.cloudcreate.projections.replay;

import dk.cloudcreate.projections.checkpoint.RecordingCheckpointStore;
import dk.cloudcreate.projections.common.types.CheckpointKey;
import dk.cloudcreate.projections.eventstore.InMemoryEventStore;
import dk.cloudcreate.projections.handler.*;
import dk.cloudcreate.projections.monitor.InMemoryProjectionMonitor;
import dk.cloudcreate.projections.registry.ProjectionHandlerRegistry;
import org.junit.jupiter.api.*;

import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

class DefaultReplayServiceTest {
    private static final String        ORDER_SUMMARY     = "OrderSummary";
    private static final String        CUSTOMER_ORDERS   = "CustomerOrders";
    private static final CheckpointKey SUMMARY_CHECKPOINT = CheckpointKey.forProjection(ORDER_SUMMARY);

    private ProjectionHandlerRegistry registry;
    private RecordingCheckpointStore  checkpointStore;
    private InMemoryEventStore        eventStore;
    private InMemoryProjectionMonitor monitor;
    private OrderSummaryProjection    orderSummary;
    private CustomerOrdersProjection  customerOrders;
    private DefaultReplayService      replayService;

    @BeforeEach
    void setup() {
        registry = new ProjectionHandlerRegistry();
        checkpointStore = new RecordingCheckpointStore();
        eventStore = new InMemoryEventStore();
        monitor = new InMemoryProjectionMonitor();
        orderSummary = new OrderSummaryProjection();
        customerOrders = new CustomerOrdersProjection();

        ProjectionHandler<OrderShipped> shippedHandler = orderSummary::shipped;
        registry.registerProjection(OrderPlaced.class, OrderSummaryProjection.class, () -> orderSummary, Optional.empty())
                .registerProjection(OrderShipped.class, OrderSummaryProjection.class, () -> shippedHandler, Optional.empty())
                .registerPartitionedProjection(OrderPlaced.class, customerOrders);
        replayService = new DefaultReplayService(registry, checkpointStore, Optional.of(eventStore), Optional.of(monitor));
    }

    @AfterEach
    void cleanup() {
        Thread.interrupted();
    }

    @Test
    void test_events_are_replayed_in_stream_order_with_batched_checkpoints() {
        // Given
        var placed1  = new OrderPlaced("o-1", "c-1");
        var shipped1 = new OrderShipped("o-1");
        var placed2  = new OrderPlaced("o-2", "c-1");
        var shipped2 = new OrderShipped("o-2");
        eventStore.append(ORDER_SUMMARY, placed1);
        eventStore.append(ORDER_SUMMARY, shipped1);
        eventStore.append(ORDER_SUMMARY, "An event no handler of the projection is registered for");
        eventStore.append(ORDER_SUMMARY, placed2);
        eventStore.append(ORDER_SUMMARY, shipped2);

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.defaults());

        // Then
        assertThat(orderSummary.projectedEvents).containsExactly(placed1, shipped1, placed2, shipped2);
        assertThat(checkpointStore.resets()).containsExactly(SUMMARY_CHECKPOINT);
        assertThat(checkpointStore.savedPositions(SUMMARY_CHECKPOINT)).containsExactly(2L, 5L);
        assertThat(result).isEqualTo(new ReplayResult(4, 0, Optional.of(4L), Optional.of(5L), true));
        assertThat(customerOrders.projectedEvents).isEmpty();
    }

    @Test
    void test_partial_batch_is_checkpointed_when_the_replay_ends() {
        // Given
        appendOrders(ORDER_SUMMARY, 4);

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().batchSize(3).build());

        // Then
        assertThat(checkpointStore.savedPositions(SUMMARY_CHECKPOINT)).containsExactly(3L, 4L);
        assertThat(result.checkpoint).hasValue(4L);
    }

    @Test
    void test_replay_resumes_from_the_saved_checkpoint() {
        // Given
        appendOrders(ORDER_SUMMARY, 5);
        checkpointStore.saveCheckpoint(SUMMARY_CHECKPOINT, 3);

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().fromCheckpoint(true).build());

        // Then
        assertThat(orderSummary.projectedOrderIds()).containsExactly("o-3", "o-4");
        assertThat(checkpointStore.resets()).isEmpty();
        assertThat(checkpointStore.savedPositions(SUMMARY_CHECKPOINT)).containsExactly(3L, 5L);
        assertThat(result.eventsProcessed).isEqualTo(2);
    }

    @Test
    void test_from_position_takes_precedence_and_to_position_is_inclusive() {
        // Given
        appendOrders(ORDER_SUMMARY, 6);
        checkpointStore.saveCheckpoint(SUMMARY_CHECKPOINT, 5);

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.builder()
                                                                      .fromCheckpoint(true)
                                                                      .fromPosition(1)
                                                                      .toPosition(3)
                                                                      .batchSize(10)
                                                                      .build());

        // Then
        assertThat(orderSummary.projectedOrderIds()).containsExactly("o-1", "o-2", "o-3");
        assertThat(result.lastPosition).hasValue(3L);
        assertThat(checkpointStore.getCheckpoint(SUMMARY_CHECKPOINT)).hasValue(4L);
    }

    @Test
    void test_dry_run_invokes_the_handlers_without_touching_the_checkpoint() {
        // Given
        appendOrders(ORDER_SUMMARY, 3);
        checkpointStore.saveCheckpoint(SUMMARY_CHECKPOINT, 10);

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().dryRun(true).build());

        // Then
        assertThat(orderSummary.projectedOrderIds()).containsExactly("o-0", "o-1", "o-2");
        assertThat(checkpointStore.resets()).isEmpty();
        assertThat(checkpointStore.savedPositions(SUMMARY_CHECKPOINT)).containsExactly(10L);
        assertThat(result.checkpoint).isEmpty();
        assertThat(result.completed).isTrue();
    }

    @Test
    void test_final_only_writes_a_single_checkpoint() {
        // Given
        appendOrders(ORDER_SUMMARY, 5);

        // When
        replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().checkpointMode(ReplayCheckpointMode.FINAL_ONLY).build());

        // Then
        assertThat(checkpointStore.resets()).containsExactly(SUMMARY_CHECKPOINT);
        assertThat(checkpointStore.savedPositions(SUMMARY_CHECKPOINT)).containsExactly(5L);
    }

    @Test
    void test_checkpoint_mode_none_leaves_the_existing_checkpoint_alone() {
        // Given
        appendOrders(ORDER_SUMMARY, 5);
        checkpointStore.saveCheckpoint(SUMMARY_CHECKPOINT, 10);

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().checkpointMode(ReplayCheckpointMode.NONE).build());

        // Then
        assertThat(orderSummary.projectedEvents).hasSize(5);
        assertThat(checkpointStore.resets()).isEmpty();
        assertThat(checkpointStore.getCheckpoint(SUMMARY_CHECKPOINT)).hasValue(10L);
        assertThat(result.checkpoint).isEmpty();
    }

    @Test
    void test_partition_replay_only_dispatches_the_events_of_that_partition() {
        // Given
        eventStore.append(CUSTOMER_ORDERS, new OrderPlaced("o-0", "c-1"));
        eventStore.append(CUSTOMER_ORDERS, new OrderPlaced("o-1", "c-2"));
        eventStore.append(CUSTOMER_ORDERS, new OrderPlaced("o-2", "c-1"));
        eventStore.append(CUSTOMER_ORDERS, new OrderPlaced("o-3", "c-2"));
        eventStore.append(CUSTOMER_ORDERS, new OrderPlaced("o-4", "c-1"));
        var partitionCheckpoint = CheckpointKey.forPartition(CUSTOMER_ORDERS, "c-1");

        // When
        var result = replayService.replay(CUSTOMER_ORDERS, ReplayOptions.builder().partition("c-1").batchSize(10).build());

        // Then
        assertThat(customerOrders.projectedEvents).extracting(event -> event.orderId).containsExactly("o-0", "o-2", "o-4");
        assertThat(checkpointStore.resets()).containsExactly(partitionCheckpoint);
        assertThat(checkpointStore.savedPositions(partitionCheckpoint)).containsExactly(5L);
        assertThat(checkpointStore.getCheckpoint(CheckpointKey.forProjection(CUSTOMER_ORDERS))).isEmpty();
        assertThat(result.eventsProcessed).isEqualTo(3);
        assertThat(orderSummary.projectedEvents).isEmpty();
    }

    @Test
    void test_failing_handler_is_logged_and_the_replay_continues() {
        // Given
        appendOrders(ORDER_SUMMARY, 3);
        orderSummary.failOn("o-1");

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().batchSize(10).build());

        // Then
        assertThat(orderSummary.projectedOrderIds()).containsExactly("o-0", "o-2");
        assertThat(result.eventsProcessed).isEqualTo(3);
        assertThat(result.eventsFailed).isEqualTo(1);
        assertThat(result.checkpoint).hasValue(3L);
        assertThat(monitor.getMetrics(ORDER_SUMMARY, "_default").get().getEventsFailed()).isEqualTo(1);
    }

    @Test
    void test_lag_is_measured_against_the_head_of_the_stream() {
        // Given
        appendOrders(ORDER_SUMMARY, 5);

        // When
        replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().toPosition(2).build());

        // Then
        var metrics = monitor.getMetrics(ORDER_SUMMARY, "_default").get();
        assertThat(metrics.getLatestEventPosition()).contains(4L);
        assertThat(metrics.getLag()).isEqualTo(2);
    }

    @Test
    void test_interrupted_replay_stops_and_checkpoints_the_events_already_replayed() {
        // Given
        appendOrders(ORDER_SUMMARY, 5);
        orderSummary.interruptOn("o-1");

        // When
        var result = replayService.replay(ORDER_SUMMARY, ReplayOptions.builder().batchSize(10).build());

        // Then
        assertThat(Thread.interrupted()).isTrue();
        assertThat(result.completed).isFalse();
        assertThat(orderSummary.projectedOrderIds()).containsExactly("o-0", "o-1");
        assertThat(checkpointStore.savedPositions(SUMMARY_CHECKPOINT)).containsExactly(2L);
    }

    @Test
    void test_without_an_event_store_the_checkpoint_is_prepared_but_nothing_is_replayed() {
        // Given
        checkpointStore.saveCheckpoint(SUMMARY_CHECKPOINT, 10);
        var replayServiceWithoutEventStore = new DefaultReplayService(registry, checkpointStore, Optional.empty(), Optional.empty());

        // When
        var result = replayServiceWithoutEventStore.replay(ORDER_SUMMARY, ReplayOptions.defaults());

        // Then
        assertThat(result.completed).isFalse();
        assertThat(result.eventsProcessed).isZero();
        assertThat(checkpointStore.resets()).containsExactly(SUMMARY_CHECKPOINT);
        assertThat(checkpointStore.getCheckpoint(SUMMARY_CHECKPOINT)).isEmpty();
    }

    @Test
    void verify_unregistered_projection_is_rejected() {
        assertThatThrownBy(() -> replayService.replay("Unknown", ReplayOptions.defaults()))
                .isInstanceOfSatisfying(ProjectionReplayException.class, e -> {
                    assertThat(e.projectionName).isEqualTo("Unknown");
                    assertThat(e.registeredProjections).containsExactly(CUSTOMER_ORDERS, ORDER_SUMMARY);
                })
                .hasMessageContaining("CustomerOrders, OrderSummary");
        assertThatThrownBy(() -> replayService.replay(" ", ReplayOptions.defaults())).isInstanceOf(IllegalArgumentException.class);
        assertThat(checkpointStore.resets()).isEmpty();
    }

    // ------------------------------------------------------------------------------------------------------------------------

    private void appendOrders(String streamName, int numberOfOrders) {
        for (var i = 0; i < numberOfOrders; i++) {
            eventStore.append(streamName, new OrderPlaced("o-" + i, "c-1"));
        }
    }

    static final class OrderPlaced {
        final String orderId;
        final String customerId;

        OrderPlaced(String orderId, String customerId) {
            this.orderId = orderId;
            this.customerId = customerId;
        }
    }

    static final class OrderShipped {
        final String orderId;

        OrderShipped(String orderId) {
            this.orderId = orderId;
        }
    }

    @Projection(projectionName = ORDER_SUMMARY, checkpointBatchSize = 2)
    static class OrderSummaryProjection implements ProjectionHandler<OrderPlaced> {
        final List<Object>  projectedEvents = new CopyOnWriteArrayList<>();
        private final Set<String> failingOrders     = ConcurrentHashMap.newKeySet();
        private final Set<String> interruptingOrders = ConcurrentHashMap.newKeySet();

        @Override
        public void project(OrderPlaced event) {
            if (failingOrders.contains(event.orderId)) {
                throw new IllegalStateException("Simulated failure for " + event.orderId);
            }
            projectedEvents.add(event);
            if (interruptingOrders.contains(event.orderId)) {
                Thread.currentThread().interrupt();
            }
        }

        void shipped(OrderShipped event) {
            projectedEvents.add(event);
        }

        void failOn(String orderId) {
            failingOrders.add(orderId);
        }

        void interruptOn(String orderId) {
            interruptingOrders.add(orderId);
        }

        List<String> projectedOrderIds() {
            var orderIds = new ArrayList<String>();
            for (var event : projectedEvents) {
                if (event instanceof OrderPlaced) {
                    orderIds.add(((OrderPlaced) event).orderId);
                }
            }
            return orderIds;
        }
    }

    @Projection(projectionName = CUSTOMER_ORDERS)
    static class CustomerOrdersProjection implements PartitionedProjectionHandler<OrderPlaced> {
        final List<OrderPlaced> projectedEvents = new CopyOnWriteArrayList<>();

        @Override
        public String partitionKey(OrderPlaced event) {
            return event.customerId;
        }

        @Override
        public void project(OrderPlaced event) {
            projectedEvents.add(event);
        }
    }
}
