package org.muma.mini.resp.exception;

/**
 * 客户端异常基类。
 * 注意：服务端的 "-ERR ..." 回复不是异常，而是 {@link org.muma.mini.resp.protocol.ErrorMessage}。
 */
public class RespException extends RuntimeException {

    public RespException(String message) {
        super(message);
    }

    public RespException(String message, Throwable cause) {
        super(message, cause);
    }
}
