/**
 * ReconciledRun.java
 *
 * 运行并同步的结果：运行结果，以及 (源码被修改且运行成功时) 反向转译得到的 JibJab 源码。
 */
package club.ppmc.battlescript.model;

/**
 * @param outcome 运行结果。
 * @param canonical 反向转译结果，没有时为 null。
 */
public record ReconciledRun(RunOutcome outcome, String canonical) {

    public boolean reconciled() {
        return canonical != null;
    }
}
