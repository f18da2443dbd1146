package com.imperium.auditrag.store;

import com.imperium.auditrag.exception.StoreUnavailableException;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.ScoredPoint;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * 向量库访问能力（Qdrant）。
 * <p>
 * 连接可能瞬断：实现需支持「已断开」状态的观测与重连，重连与检索可并发发生，
 * 读者只能看到完整构建好的连接句柄。
 */
public interface VectorStoreGateway {

    /**
     * 最近邻检索。
     *
     * @param vector 查询向量
     * @param limit  返回条数上限
     * @param filter 原生过滤条件，null 表示不限制
     * @return 按相似度降序排列的命中
     * @throws StoreUnavailableException 未连接、连接失败或查询出错
     */
    List<ScoredPoint> search(List<Float> vector, int limit, @Nullable Filter filter) throws StoreUnavailableException;

    /** 当前是否持有可用连接（首次使用前为 false） */
    boolean isConnected();

    /**
     * 新建连接并探测，成功后原子替换旧连接。
     *
     * @return 是否重连成功
     */
    boolean reconnect();

    /** 实际探测一次向量库是否可达（健康检查用） */
    boolean isReachable();
}
