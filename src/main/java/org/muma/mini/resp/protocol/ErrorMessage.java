package org.muma.mini.resp.protocol;

// 2. 错误 (-)，例如 "ERR unknown command" / "WRONGTYPE ..."
public record ErrorMessage(String content) implements RedisMessage {

    /**
     * 错误前缀，即第一个空格之前的部分 (ERR, WRONGTYPE, MOVED ...)
     */
    public String prefix() {
        int space = content.indexOf(' ');
        return space < 0 ? content : content.substring(0, space);
    }
}
