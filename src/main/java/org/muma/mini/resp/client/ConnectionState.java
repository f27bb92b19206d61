package org.muma.mini.resp.client;

/**
 * 连接生命周期：UNCONNECTED -> CONNECTED -> CLOSED，不会回退，也不会自动重连。
 */
public enum ConnectionState {
    UNCONNECTED,
    CONNECTED,
    CLOSED
}
