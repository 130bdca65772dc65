/**
 * InputWaitToken.java
 *
 * 单次使用的输入等待令牌。交互桥在向调用方请求输入时创建一个令牌并阻塞等待，
 * 调用方提交输入、运行被取消或子进程退出时恢复它。令牌只会被恢复一次，之后的恢复请求被忽略。
 */
package club.ppmc.battlescript.model;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class InputWaitToken {

    private final AtomicBoolean resumed = new AtomicBoolean(false);
    private final CompletableFuture<String> answer = new CompletableFuture<>();

    /**
     * 用一行输入恢复等待。
     *
     * @param line 输入内容，null 表示没有输入。
     * @return 如果本次调用真正恢复了令牌。
     */
    public boolean resume(String line) {
        if (!resumed.compareAndSet(false, true)) {
            log.warn("输入等待令牌已被恢复过，忽略重复的恢复请求。");
            return false;
        }
        answer.complete(line);
        return true;
    }

    /** 以 null 恢复，用于取消或子进程退出。 */
    public boolean release() {
        return resume(null);
    }

    public boolean isResumed() {
        return resumed.get();
    }

    /**
     * 阻塞直到令牌被恢复。
     *
     * @return 输入内容，可能为 null。
     */
    public String await() throws InterruptedException {
        try {
            return answer.get();
        } catch (ExecutionException e) {
            // answer 只会被正常完成
            throw new IllegalStateException(e.getCause());
        }
    }
}
