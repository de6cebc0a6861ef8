package com.lhcz.pgcdc.error;

/**
 * 行事件引用了本次会话中从未声明过的关系 (Relation 消息)。
 * 通常说明复制起点不够靠前或 publication 配置有误。
 */
public class UnknownRelationException extends ReplicationException {

    private final int relationId;

    public UnknownRelationException(int relationId) {
        super("未知的关系 OID: " + relationId + " (本会话尚未收到对应的 Relation 消息)", false);
        this.relationId = relationId;
    }

    public int getRelationId() {
        return relationId;
    }
}
