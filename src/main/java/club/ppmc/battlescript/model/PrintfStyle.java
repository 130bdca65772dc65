/**
 * PrintfStyle.java
 *
 * 目标语言格式化输出语句的风格。预处理阶段会把多占位符的格式化输出改写为单个插值字符串输出。
 */
package club.ppmc.battlescript.model;

public enum PrintfStyle {
    NONE,
    /** printf("fmt\n", args...); */
    C_PRINTF,
    /** fmt.Printf("fmt\n", args...) */
    GO_PRINTF
}
