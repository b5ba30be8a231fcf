package com.quadscan.agent;

import java.nio.file.Path;

import lombok.Data;
import lombok.experimental.Accessors;

/**
 * 命令行参数：
 * --config &lt;file&gt; --frames &lt;n&gt; --width &lt;w&gt; --height &lt;h&gt; --channels &lt;c&gt;
 * 未给出 --config 时从 classpath 加载 quadscan.json。
 */
@Data
@Accessors(chain = true)
public class AgentOptions {

    private Path configPath;
    private long frames = 300;
    private int width = 64;
    private int height = 48;
    private int channels = 3;

    public static AgentOptions parse(String[] args) {
        AgentOptions options = new AgentOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> options.setConfigPath(Path.of(value(args, ++i, arg)));
                case "--frames" -> options.setFrames(Long.parseLong(value(args, ++i, arg)));
                case "--width" -> options.setWidth(Integer.parseInt(value(args, ++i, arg)));
                case "--height" -> options.setHeight(Integer.parseInt(value(args, ++i, arg)));
                case "--channels" -> options.setChannels(Integer.parseInt(value(args, ++i, arg)));
                default -> throw new IllegalArgumentException("unknown option: " + arg);
            }
        }
        return options;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("missing value for " + option);
        }
        return args[index];
    }
}
