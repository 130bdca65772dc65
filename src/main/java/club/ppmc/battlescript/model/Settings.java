/**
 * Settings.java
 *
 * 该文件定义了一个POJO，用于表示和持久化后端的各项配置。
 * 由 SettingsService 负责加载和保存到 settings.json 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.battlescript.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class Settings {

    // --- 运行环境 ---
    /**
     * 临时源文件和编译产物的存放目录。
     * 默认值为系统临时目录。
     */
    private String scratchDirectory = System.getProperty("java.io.tmpdir");

    /**
     * 额外的工具链目录，运行子进程时会被加到 PATH 的最前面。
     * 例如 "/opt/homebrew/bin"。
     */
    private List<String> toolchainSearchPaths = new ArrayList<>();

    /**
     * 各目标语言的工具链命令。
     * Key: 目标语言标识，如 "c"、"go"。
     */
    private Map<String, ToolchainCommand> toolchains = new LinkedHashMap<>();

    // --- 交互运行 ---
    /** 交互模式下判断程序在等待输入的静默时长 (毫秒)。 */
    private long inputPollMillis = 300;

    /** 停止进程时，发送 SIGTERM 后等待多久再强制结束 (毫秒)。 */
    private long cancelGraceMillis = 2000;
}
