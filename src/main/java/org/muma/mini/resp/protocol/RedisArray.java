package org.muma.mini.resp.protocol;

import java.util.Arrays;

// 5. 数组 (*) - elements 为 null 表示 Null Array (*-1)
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    public RedisMessage get(int index) {
        return elements[index];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RedisArray other && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "RedisArray[null]" : "RedisArray" + Arrays.toString(elements);
    }
}
