package com.lhcz.pgcdc.wal;

import com.lhcz.pgcdc.error.UnknownRelationException;
import com.lhcz.pgcdc.model.RelationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 表结构缓存 (relation OID -> 当前结构)
 * <p>
 * 行镜像按位置编码，解码前必须先查此缓存。只有解码线程在收到 Relation 消息时写入，其他线程只读。
 */
public class RelationCache {
    private static final Logger log = LoggerFactory.getLogger(RelationCache.class);

    private final Map<Integer, RelationDescriptor> relations = new ConcurrentHashMap<>();

    public RelationDescriptor resolve(int relationId) {
        RelationDescriptor relation = relations.get(relationId);
        if (relation == null) {
            throw new UnknownRelationException(relationId);
        }
        return relation;
    }

    public void update(RelationDescriptor relation) {
        RelationDescriptor previous = relations.put(relation.relationId(), relation);
        if (previous == null) {
            log.debug("注册表结构: {} (oid={}, {} 列)", relation.table(), relation.relationId(), relation.columns().size());
        } else if (!previous.equals(relation)) {
            log.info("表结构变更: {} 列数 {} -> {}", relation.table(), previous.columns().size(), relation.columns().size());
        }
    }

    /**
     * 重连后源端会重新发送 Relation 消息，旧缓存作废
     */
    public void clear() {
        relations.clear();
    }

    public int size() {
        return relations.size();
    }
}
