package org.muma.mini.resp.exception;

/**
 * 传输层失败：连接被拒绝、被重置、已关闭或写入失败。连接不可再用。
 */
public class RespTransportException extends RespException {

    public RespTransportException(String message) {
        super(message);
    }

    public RespTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
