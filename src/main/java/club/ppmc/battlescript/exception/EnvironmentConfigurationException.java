/**
 * EnvironmentConfigurationException.java
 *
 * 一个自定义的运行时异常，表示后端的运行环境或配置有误，例如某个目标语言缺少配置、
 * toolchains.json 中出现了未知的目标语言标识，或者工具链命令模板不完整。
 * 这类错误在启动时暴露，而不是在运行某个程序时才出现。
 * 它携带了结构化的错误信息，以便 Controller 层可以将其转换为对前端友好的响应。
 */
package club.ppmc.battlescript.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class EnvironmentConfigurationException extends RuntimeException {

    /** 出问题的配置项 ("profile"、"toolchain"、"settings")。 */
    private final String component;

    /** (可选) 相关的目标语言标识。 */
    private final String target;

    /**
     * 构造函数。
     * @param message 详细的错误信息。
     * @param component 问题配置项的标识符。
     * @param target (可选) 相关的目标语言。
     */
    public EnvironmentConfigurationException(String message, String component, String target) {
        super(message);
        this.component = component;
        this.target = target;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "ENVIRONMENT_ERROR",
                "message", getMessage(),
                "component", getComponent(),
                "target", getTarget() != null ? getTarget() : "");
    }
}
