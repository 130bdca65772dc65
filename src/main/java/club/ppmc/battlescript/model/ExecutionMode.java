/**
 * ExecutionMode.java
 *
 * 程序的运行模式。
 */
package club.ppmc.battlescript.model;

public enum ExecutionMode {
    /** 标准输入立即关闭，输出在结束后一次性返回。 */
    BATCH,
    /** 输出实时转发，并在程序等待输入时向调用方请求一行输入。 */
    INTERACTIVE
}
