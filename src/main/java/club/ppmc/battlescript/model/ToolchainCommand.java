/**
 * ToolchainCommand.java
 *
 * 单个目标语言的工具链命令模板。所有字段都是参数列表，可包含占位符：
 * {src} 源文件、{out} 输出的可执行文件、{obj} 汇编产生的目标文件、{sdk} SDK 探测得到的路径。
 * 由 SettingsService 从 toolchains.json 合并进持久化的设置中，并由 ToolchainRunnerService 使用。
 */
package club.ppmc.battlescript.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;

/**
 * @param compile 编译 (或汇编) 命令，解释型语言为空。
 * @param link 链接命令，只有汇编目标需要。
 * @param sdkProbe SDK 路径探测命令，其标准输出 (去除空白) 即为 {sdk}。
 * @param run 运行命令。为空时直接执行 {out}。
 */
public record ToolchainCommand(
        List<String> compile, List<String> link, List<String> sdkProbe, List<String> run) {

    public ToolchainCommand {
        compile = compile == null ? List.of() : List.copyOf(compile);
        link = link == null ? List.of() : List.copyOf(link);
        sdkProbe = sdkProbe == null ? List.of() : List.copyOf(sdkProbe);
        run = run == null ? List.of() : List.copyOf(run);
    }

    @JsonIgnore
    public boolean isCompiled() {
        return !compile.isEmpty();
    }

    @JsonIgnore
    public boolean needsLink() {
        return !link.isEmpty();
    }
}
