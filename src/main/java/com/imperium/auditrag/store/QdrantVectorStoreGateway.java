package com.imperium.auditrag.store;

import com.imperium.auditrag.exception.StoreUnavailableException;
import com.imperium.auditrag.support.TimedCall;
import io.grpc.Status;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchPoints;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static io.qdrant.client.WithPayloadSelectorFactory.enable;

/**
 * Qdrant 检索网关。
 * <p>
 * 启动时不建连，首次检索前由调用方触发 {@link #reconnect()}。重连在锁内进行并重新检查连接状态，
 * 多个请求同时发现未连接时只会构建一个 client。新 client 探测通过后才原子替换进句柄，
 * 读者永远拿不到半初始化的 client。
 * <p>
 * 被替换下来的 client 先标记为退役，等仍在其上执行的检索全部结束后才关闭。
 */
@Component
public class QdrantVectorStoreGateway implements VectorStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreGateway.class);

    private final Supplier<QdrantClient> clientFactory;
    private final String collectionName;
    private final Duration timeout;

    private final AtomicReference<ClientSlot> handle = new AtomicReference<>();
    private final Object reconnectLock = new Object();
    private volatile boolean connected;

    public QdrantVectorStoreGateway(Supplier<QdrantClient> qdrantClientFactory,
            @Value("${app.qdrant.collection:audit_documents}") String collectionName,
            @Value("${app.qdrant.timeout:10s}") Duration timeout) {
        this.clientFactory = qdrantClientFactory;
        this.collectionName = collectionName;
        this.timeout = timeout;
    }

    @Override
    public List<ScoredPoint> search(List<Float> vector, int limit, @Nullable Filter filter)
            throws StoreUnavailableException {
        ClientSlot slot = acquire();
        if (slot == null) {
            throw new StoreUnavailableException("Qdrant client is not connected");
        }

        SearchPoints.Builder request = SearchPoints.newBuilder()
                .setCollectionName(collectionName)
                .addAllVector(vector)
                .setLimit(limit)
                .setWithPayload(enable(true));
        if (filter != null) {
            request.setFilter(filter);
        }

        try {
            return slot.client.searchAsync(request.build(), timeout)
                    .get(timeout.toMillis() + 1_000, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (isConnectionFailure(cause)) {
                markDisconnected(slot);
            }
            throw new StoreUnavailableException("Qdrant search failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new StoreUnavailableException(
                    "Qdrant search timed out after " + TimedCall.describe(timeout), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Qdrant search interrupted", e);
        } finally {
            slot.release();
        }
    }

    @Override
    public boolean isConnected() {
        return connected && handle.get() != null;
    }

    /**
     * 已连接时直接返回 true；否则在锁内构建并探测新 client。
     */
    @Override
    public boolean reconnect() {
        synchronized (reconnectLock) {
            if (isConnected()) {
                return true;
            }
            QdrantClient fresh = null;
            try {
                fresh = clientFactory.get();
                List<String> collections = fresh.listCollectionsAsync(timeout)
                        .get(timeout.toMillis() + 1_000, TimeUnit.MILLISECONDS);
                ClientSlot previous = handle.getAndSet(new ClientSlot(fresh));
                connected = true;
                if (previous != null) {
                    previous.retire();
                }
                log.info("Connected to Qdrant. Collections: {}", collections.size());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                closeQuietly(fresh);
                return false;
            } catch (Exception e) {
                log.error("Failed to reconnect to Qdrant: {}", e.getMessage());
                closeQuietly(fresh);
                return false;
            }
        }
    }

    @Override
    public boolean isReachable() {
        ClientSlot slot = acquire();
        if (slot == null) {
            return reconnect();
        }
        try {
            slot.client.listCollectionsAsync(timeout).get(timeout.toMillis() + 1_000, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("Qdrant not reachable: {}", e.getMessage());
            markDisconnected(slot);
            return false;
        } finally {
            slot.release();
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (reconnectLock) {
            connected = false;
            ClientSlot current = handle.getAndSet(null);
            if (current != null) {
                current.retire();
            }
        }
    }

    /**
     * 取得当前 client 并登记一次使用；未连接时返回 null。用完必须调用 {@link ClientSlot#release()}。
     */
    @Nullable
    private ClientSlot acquire() {
        while (true) {
            ClientSlot slot = handle.get();
            if (slot == null || !connected) {
                return null;
            }
            slot.inFlight.incrementAndGet();
            if (!slot.retired) {
                return slot;
            }
            // 登记前刚被替换，换成新句柄再试
            slot.release();
        }
    }

    /** 只有当前句柄仍是出错的那个 client 时才标记断开，避免覆盖其他线程刚完成的重连 */
    private void markDisconnected(ClientSlot failed) {
        if (handle.get() == failed) {
            connected = false;
            log.warn("Qdrant connection marked as disconnected; next request will reconnect");
        }
    }

    private static boolean isConnectionFailure(Throwable t) {
        Status.Code code = Status.fromThrowable(t).getCode();
        return code == Status.Code.UNAVAILABLE || code == Status.Code.DEADLINE_EXCEEDED;
    }

    private static void closeQuietly(@Nullable QdrantClient client) {
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (Exception e) {
            log.debug("Ignoring error while closing Qdrant client: {}", e.getMessage());
        }
    }

    /**
     * 一个 client 及其在途调用计数。退役且计数归零时关闭，且只关闭一次。
     */
    private static final class ClientSlot {

        private final QdrantClient client;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile boolean retired;

        private ClientSlot(QdrantClient client) {
            this.client = client;
        }

        void release() {
            inFlight.decrementAndGet();
            closeIfDrained();
        }

        void retire() {
            retired = true;
            closeIfDrained();
        }

        private void closeIfDrained() {
            if (retired && inFlight.get() == 0 && closed.compareAndSet(false, true)) {
                closeQuietly(client);
            }
        }
    }
}
