/**
 * RunOutcome.java
 *
 * 一次运行的最终结果。运行期间的失败都以该值返回，而不是抛出异常。
 */
package club.ppmc.battlescript.model;

/**
 * @param kind 结果类别。
 * @param text 展示给用户的文本 (合并后的输出或错误信息)。
 * @param exitCode 进程退出码，没有进程退出时为 -1。
 * @param failedStep 失败的步骤名 ("write"、"compile"、"assemble"、"sdk"、"link"、"run")，成功时为 null。
 */
public record RunOutcome(Kind kind, String text, int exitCode, String failedStep) {

    public static final String STOPPED_TEXT = "Stopped";

    public enum Kind {
        OK,
        WRITE_ERROR,
        COMPILE_ERROR,
        RUN_ERROR,
        STOPPED
    }

    public static RunOutcome ok(String output, int exitCode) {
        return new RunOutcome(Kind.OK, output, exitCode, null);
    }

    public static RunOutcome writeError(String message) {
        return new RunOutcome(Kind.WRITE_ERROR, "Error writing source: " + message, -1, "write");
    }

    /**
     * @param heading 错误标题，例如 "Compile error" 或 "Link error"。
     */
    public static RunOutcome compileError(String heading, String step, String detail) {
        return new RunOutcome(Kind.COMPILE_ERROR, heading + ":\n" + detail, -1, step);
    }

    public static RunOutcome runError(String message) {
        return new RunOutcome(Kind.RUN_ERROR, "Run error: " + message, -1, "run");
    }

    public static RunOutcome stopped() {
        return new RunOutcome(Kind.STOPPED, STOPPED_TEXT, -1, null);
    }

    /**
     * 把最后一步 (执行程序) 的命令结果转换为运行结果。
     * 非 0 的正常退出仍然是 OK，退出码会被记录下来。
     */
    public static RunOutcome fromExecution(CommandResult result) {
        if (!result.launched()) {
            return runError(result.launchError());
        }
        if (result.signaled()) {
            return stopped();
        }
        return ok(result.mergedOutput(), result.exitCode());
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }
}
