package com.imperium.auditrag.store;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.SettableFuture;
import com.imperium.auditrag.exception.StoreUnavailableException;
import io.grpc.Status;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchPoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QdrantVectorStoreGatewayTest {

    private final Deque<QdrantClient> clients = new ArrayDeque<>();
    private QdrantVectorStoreGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new QdrantVectorStoreGateway(clients::poll, "audit_documents", Duration.ofSeconds(1));
    }

    private static QdrantClient reachableClient() {
        QdrantClient client = mock(QdrantClient.class);
        when(client.listCollectionsAsync(any(Duration.class)))
                .thenReturn(Futures.immediateFuture(List.of("audit_documents")));
        return client;
    }

    @Test
    void notConnectedBeforeFirstReconnect() {
        assertThat(gateway.isConnected()).isFalse();
        assertThatThrownBy(() -> gateway.search(List.of(1f), 5, null))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void reconnectWhileConnectedKeepsCurrentClient() {
        QdrantClient first = reachableClient();
        QdrantClient spare = reachableClient();
        clients.add(first);
        clients.add(spare);

        assertThat(gateway.reconnect()).isTrue();
        assertThat(gateway.reconnect()).isTrue();

        assertThat(gateway.isConnected()).isTrue();
        assertThat(clients).containsExactly(spare);
        verify(first, never()).close();
    }

    @Test
    void reconnectAfterFailureReplacesAndClosesIdleClient() throws Exception {
        QdrantClient first = reachableClient();
        when(first.searchAsync(any(SearchPoints.class), any(Duration.class)))
                .thenReturn(Futures.immediateFailedFuture(Status.UNAVAILABLE.asRuntimeException()));
        QdrantClient second = reachableClient();
        clients.add(first);
        clients.add(second);
        gateway.reconnect();

        assertThatThrownBy(() -> gateway.search(List.of(1f), 5, null))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(gateway.reconnect()).isTrue();

        verify(first).close();
        verify(second, never()).close();
    }

    @Test
    void concurrentFirstUseBuildsOneClientAndEverySearchSucceeds() throws Exception {
        ScoredPoint point = ScoredPoint.newBuilder().setScore(0.9f).build();
        AtomicInteger created = new AtomicInteger();
        Supplier<QdrantClient> factory = () -> {
            created.incrementAndGet();
            QdrantClient client = mock(QdrantClient.class);
            when(client.listCollectionsAsync(any(Duration.class))).thenAnswer(invocation -> {
                Thread.sleep(100);
                return Futures.immediateFuture(List.of("audit_documents"));
            });
            when(client.searchAsync(any(SearchPoints.class), any(Duration.class)))
                    .thenReturn(Futures.immediateFuture(List.of(point)));
            return client;
        };
        QdrantVectorStoreGateway shared = new QdrantVectorStoreGateway(factory, "audit_documents", Duration.ofSeconds(1));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<ScoredPoint>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    if (!shared.isConnected() && !shared.reconnect()) {
                        throw new IllegalStateException("reconnect failed");
                    }
                    return shared.search(List.of(0.1f), 3, null);
                }));
            }
            start.countDown();
            for (Future<List<ScoredPoint>> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).containsExactly(point);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(created).hasValue(1);
    }

    @Test
    void replacedClientIsClosedOnlyAfterItsInFlightSearchFinishes() throws Exception {
        ScoredPoint point = ScoredPoint.newBuilder().setScore(0.7f).build();
        SettableFuture<List<ScoredPoint>> pending = SettableFuture.create();
        QdrantClient first = reachableClient();
        when(first.searchAsync(any(SearchPoints.class), any(Duration.class)))
                .thenReturn(pending)
                .thenReturn(Futures.immediateFailedFuture(Status.UNAVAILABLE.asRuntimeException()));
        QdrantClient second = reachableClient();
        clients.add(first);
        clients.add(second);
        gateway.reconnect();

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<List<ScoredPoint>> slowSearch = pool.submit(() -> gateway.search(List.of(0.1f), 3, null));
            verify(first, timeout(2_000)).searchAsync(any(SearchPoints.class), any(Duration.class));

            assertThatThrownBy(() -> gateway.search(List.of(0.1f), 3, null))
                    .isInstanceOf(StoreUnavailableException.class);
            assertThat(gateway.reconnect()).isTrue();
            verify(first, never()).close();

            pending.set(List.of(point));
            assertThat(slowSearch.get(2, TimeUnit.SECONDS)).containsExactly(point);
            verify(first, timeout(2_000)).close();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shutdownClosesCurrentClient() {
        QdrantClient client = reachableClient();
        clients.add(client);
        gateway.reconnect();

        gateway.shutdown();

        assertThat(gateway.isConnected()).isFalse();
        verify(client).close();
    }

    @Test
    void failedConnectivityCheckKeepsGatewayDisconnected() {
        QdrantClient broken = mock(QdrantClient.class);
        when(broken.listCollectionsAsync(any(Duration.class)))
                .thenReturn(Futures.immediateFailedFuture(Status.UNAVAILABLE.asRuntimeException()));
        clients.add(broken);

        assertThat(gateway.reconnect()).isFalse();
        assertThat(gateway.isConnected()).isFalse();
        verify(broken).close();
    }

    @Test
    void searchReturnsPointsAndUnavailableStatusMarksDisconnected() throws Exception {
        QdrantClient client = reachableClient();
        ScoredPoint point = ScoredPoint.newBuilder().setScore(0.5f).build();
        when(client.searchAsync(any(SearchPoints.class), any(Duration.class)))
                .thenReturn(Futures.immediateFuture(List.of(point)))
                .thenReturn(Futures.immediateFailedFuture(Status.UNAVAILABLE.asRuntimeException()));
        clients.add(client);
        gateway.reconnect();

        assertThat(gateway.search(List.of(0.1f, 0.2f), 5, null)).containsExactly(point);
        assertThatThrownBy(() -> gateway.search(List.of(0.1f, 0.2f), 5, null))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(gateway.isConnected()).isFalse();
    }
}
