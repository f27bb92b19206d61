package org.muma.mini.resp.exception;

/**
 * 线路上的数据不符合 RESP 语法 (未知类型字节、非法数字、缺少 CRLF ...)。
 * 出现后流的位置已不可信，连接会被关闭。
 */
public class RespProtocolException extends RespException {

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
