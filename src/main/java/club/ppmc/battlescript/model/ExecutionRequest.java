/**
 * ExecutionRequest.java
 *
 * 一次运行请求。创建后不可变。
 */
package club.ppmc.battlescript.model;

import java.util.Objects;

/**
 * @param target 目标语言。
 * @param source 目标语言源码。
 * @param mode 运行模式。
 * @param inputProvider 交互模式的输入来源 (批处理模式为 null)。
 * @param outputListener 交互模式的输出回调 (批处理模式为 null)。
 */
public record ExecutionRequest(
        TargetId target,
        String source,
        ExecutionMode mode,
        InputProvider inputProvider,
        OutputListener outputListener) {

    public ExecutionRequest {
        Objects.requireNonNull(target, "target");
        source = source == null ? "" : source;
        mode = mode == null ? ExecutionMode.BATCH : mode;
        if (mode == ExecutionMode.INTERACTIVE) {
            Objects.requireNonNull(inputProvider, "交互模式需要 InputProvider");
            outputListener = outputListener == null ? chunk -> {} : outputListener;
        }
    }

    public static ExecutionRequest batch(TargetId target, String source) {
        return new ExecutionRequest(target, source, ExecutionMode.BATCH, null, null);
    }

    public static ExecutionRequest interactive(
            TargetId target, String source, InputProvider inputProvider, OutputListener outputListener) {
        return new ExecutionRequest(target, source, ExecutionMode.INTERACTIVE, inputProvider, outputListener);
    }

    public boolean isInteractive() {
        return mode == ExecutionMode.INTERACTIVE;
    }
}
