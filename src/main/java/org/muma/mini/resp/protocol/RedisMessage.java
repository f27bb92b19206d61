package org.muma.mini.resp.protocol;

// 密封接口，限制实现类：一条 RESP 回复只能是以下五种之一
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {

    /**
     * 服务端返回的 "-" 错误回复。
     * 这是一个正常的值，连接仍然可用。
     */
    default boolean isError() {
        return this instanceof ErrorMessage;
    }
}
