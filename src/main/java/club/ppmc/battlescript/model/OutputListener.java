/**
 * OutputListener.java
 *
 * 交互运行时接收程序输出片段的回调。
 */
package club.ppmc.battlescript.model;

@FunctionalInterface
public interface OutputListener {

    void onOutput(String chunk);
}
