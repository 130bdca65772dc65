/**
 * CommandResult.java
 *
 * 一条外部命令执行完毕后的结果。
 */
package club.ppmc.battlescript.model;

/**
 * @param exitCode 退出码，无法启动时为 -1。
 * @param stdout 标准输出全文。
 * @param stderr 标准错误全文。
 * @param signaled 进程是否被信号结束 (包括被主动停止)。
 * @param launchError 启动失败的原因，正常启动时为 null。
 */
public record CommandResult(
        int exitCode, String stdout, String stderr, boolean signaled, String launchError) {

    public static CommandResult launchFailed(String reason) {
        return new CommandResult(-1, "", "", false, reason);
    }

    public boolean launched() {
        return launchError == null;
    }

    public boolean succeeded() {
        return launched() && !signaled && exitCode == 0;
    }

    /** 标准输出与标准错误合并后去除首尾空白。 */
    public String mergedOutput() {
        return (stdout + "\n" + stderr).trim();
    }

    /** 编译失败时的诊断文本：标准错误在前。 */
    public String diagnostics() {
        return (stderr + "\n" + stdout).trim();
    }
}
