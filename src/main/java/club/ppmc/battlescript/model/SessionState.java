/**
 * SessionState.java
 *
 * 子进程会话的生命周期状态。
 * IDLE -> STARTING -> RUNNING -> {COMPLETED, TERMINATED, FAILED}，之后槽位回到 IDLE。
 */
package club.ppmc.battlescript.model;

public enum SessionState {
    IDLE,
    STARTING,
    RUNNING,
    COMPLETED,
    TERMINATED,
    FAILED;

    public boolean isFinal() {
        return this == COMPLETED || this == TERMINATED || this == FAILED;
    }
}
