package org.muma.mini.resp.client;

import org.muma.mini.resp.protocol.Command;
import org.muma.mini.resp.protocol.RedisMessage;

import java.util.concurrent.CompletableFuture;

// 写入 pipeline 的出站消息：命令本身 + 等待它回复的 future
record PendingCommand(Command command, CompletableFuture<RedisMessage> reply) {
}
