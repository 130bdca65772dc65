/**
 * RunResponse.java
 *
 * 运行接口的响应体。
 */
package club.ppmc.battlescript.model;

/**
 * @param kind 结果类别。
 * @param output 输出或错误信息。
 * @param exitCode 进程退出码。
 * @param canonical 反向转译得到的 JibJab 源码 (没有时为 null)。
 */
public record RunResponse(String kind, String output, int exitCode, String canonical) {

    public static RunResponse of(RunOutcome outcome, String canonical) {
        return new RunResponse(outcome.kind().name(), outcome.text(), outcome.exitCode(), canonical);
    }
}
