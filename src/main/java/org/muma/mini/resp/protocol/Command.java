package org.muma.mini.resp.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 一条待发送的命令：有序的参数列表，第一个参数是命令名。
 * 参数是原始字节，不要求是合法文本 (二进制安全)。
 */
public record Command(List<byte[]> args) {

    public Command {
        if (args == null || args.isEmpty()) {
            throw new IllegalArgumentException("Command requires at least one argument (the command name)");
        }
        List<byte[]> copy = new ArrayList<>(args.size());
        for (byte[] arg : args) {
            if (arg == null) {
                throw new IllegalArgumentException("Command arguments must not be null");
            }
            copy.add(arg);
        }
        args = Collections.unmodifiableList(copy);
    }

    public static Command of(String... args) {
        List<byte[]> list = new ArrayList<>(args.length);
        for (String arg : args) {
            if (arg == null) {
                throw new IllegalArgumentException("Command arguments must not be null");
            }
            list.add(arg.getBytes(StandardCharsets.UTF_8));
        }
        return new Command(list);
    }

    public static Command of(byte[]... args) {
        return new Command(Arrays.asList(args));
    }

    public int size() {
        return args.size();
    }

    // 命令名，统一大写，仅用于日志
    public String name() {
        return new String(args.get(0), StandardCharsets.UTF_8).toUpperCase(Locale.ROOT);
    }

    public String argAsString(int index) {
        return new String(args.get(index), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Command{" + name() + ", argc=" + args.size() + "}";
    }
}
