package org.muma.mini.resp.exception;

// 命令在超时时间内没有收到回复，连接已被关闭
public class RespTimeoutException extends RespTransportException {

    public RespTimeoutException(String message) {
        super(message);
    }
}
