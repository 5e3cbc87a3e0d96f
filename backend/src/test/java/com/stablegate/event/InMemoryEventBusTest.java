package com.stablegate.event;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventBusTest {

    private ExecutorService executor;
    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        bus = new InMemoryEventBus(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void publish_deliversExactFieldsToEverySubscriber() throws Exception {
        List<PaymentConfirmedEvent> first = new CopyOnWriteArrayList<>();
        List<PaymentConfirmedEvent> second = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(2);
        bus.subscribe(PaymentConfirmedEvent.NAME, e -> {
            first.add((PaymentConfirmedEvent) e);
            delivered.countDown();
        });
        bus.subscribe(PaymentConfirmedEvent.NAME, e -> {
            second.add((PaymentConfirmedEvent) e);
            delivered.countDown();
        });

        bus.publish(PaymentConfirmedEvent.of("pay-1", "0xabc", new BigDecimal("1.00"), "USDT",
                BlockchainType.BSC, "0xfrom", "0xto", 42L, 1_700_000_000L));

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        for (List<PaymentConfirmedEvent> received : List.of(first, second)) {
            assertThat(received).hasSize(1);
            PaymentConfirmedEvent event = received.get(0);
            assertThat(event.paymentId()).isEqualTo("pay-1");
            assertThat(event.txHash()).isEqualTo("0xabc");
            assertThat(event.amount()).isEqualTo(new BigDecimal("1.00"));
            assertThat(event.tokenSymbol()).isEqualTo("USDT");
            assertThat(event.blockchain()).isEqualTo(BlockchainType.BSC);
        }
    }

    @Test
    void publish_onlyReachesHandlersOfThatEventName() throws Exception {
        CountDownLatch health = new CountDownLatch(1);
        List<Event> payments = new CopyOnWriteArrayList<>();
        bus.subscribe(PaymentConfirmedEvent.NAME, payments::add);
        bus.subscribe(BlockchainHealthEvent.NAME, e -> health.countDown());

        bus.publish(BlockchainHealthEvent.of(BlockchainType.TRON, false, 10L, "timeout", "rpc_error"));

        assertThat(health.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(bus.shutdown(Duration.ofSeconds(5))).isTrue();
        assertThat(payments).isEmpty();
    }

    @Test
    void publish_withoutSubscribers_isNoOp() {
        bus.publish(TransactionDetectedEvent.of("0xabc", BlockchainType.BSC, 3, 15));

        assertThat(bus.inFlightCount()).isZero();
    }

    @Test
    void failingHandler_doesNotAffectPublisherOrOtherHandlers() throws Exception {
        CountDownLatch healthyHandler = new CountDownLatch(1);
        bus.subscribe(PaymentConfirmedEvent.NAME, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(PaymentConfirmedEvent.NAME, e -> healthyHandler.countDown());

        bus.publish(samplePayment());

        assertThat(healthyHandler.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(bus.shutdown(Duration.ofSeconds(5))).isTrue();
        assertThat(bus.inFlightCount()).isZero();
    }

    @Test
    void publish_doesNotWaitForHandlers() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        bus.subscribe(PaymentConfirmedEvent.NAME, e -> {
            started.countDown();
            release.await();
        });

        bus.publish(samplePayment());

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(bus.inFlightCount()).isEqualTo(1);
        release.countDown();
        assertThat(bus.shutdown(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void shutdown_timesOutWhileHandlerStillRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        bus.subscribe(PaymentConfirmedEvent.NAME, e -> {
            started.countDown();
            release.await();
        });
        bus.publish(samplePayment());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        boolean drained = bus.shutdown(Duration.ofMillis(100));

        assertThat(drained).isFalse();
        assertThat(bus.isStopped()).isTrue();
        release.countDown();
    }

    @Test
    void publish_afterShutdown_throwsClosed() {
        assertThat(bus.shutdown(Duration.ofSeconds(1))).isTrue();

        assertThatThrownBy(() -> bus.publish(samplePayment()))
                .isInstanceOf(EventBusClosedException.class)
                .hasMessageContaining(PaymentConfirmedEvent.NAME);
    }

    @Test
    void subscribe_afterShutdown_isIgnored() {
        bus.shutdown(Duration.ofSeconds(1));

        bus.subscribe(PaymentConfirmedEvent.NAME, e -> { });

        assertThat(bus.handlerCount(PaymentConfirmedEvent.NAME)).isZero();
    }

    @Test
    void publish_rejectedByExecutor_surfacesAsEventBusException() {
        InMemoryEventBus rejecting = new InMemoryEventBus(task -> {
            throw new RejectedExecutionException("full");
        });
        rejecting.subscribe(PaymentConfirmedEvent.NAME, e -> { });

        assertThatThrownBy(() -> rejecting.publish(samplePayment()))
                .isInstanceOf(EventBusException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(rejecting.inFlightCount()).isZero();
    }

    private static PaymentConfirmedEvent samplePayment() {
        return PaymentConfirmedEvent.of("pay-2", "0xdef", BigDecimal.TEN, "USDC", BlockchainType.ETHEREUM,
                "0xfrom", "0xto", 1L, 1L);
    }
}
