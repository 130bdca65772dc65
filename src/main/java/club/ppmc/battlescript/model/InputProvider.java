/**
 * InputProvider.java
 *
 * 交互运行时由调用方提供的输入来源。
 */
package club.ppmc.battlescript.model;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface InputProvider {

    /**
     * 请求一行输入。
     *
     * @param prompt 程序最后输出的未换行文本，通常是提示语，可能为空字符串。
     * @return 完成时给出输入内容 (不含换行)；以 null 完成表示调用方放弃输入。
     */
    CompletableFuture<String> requestInput(String prompt);
}
