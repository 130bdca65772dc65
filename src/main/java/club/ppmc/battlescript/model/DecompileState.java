/**
 * DecompileState.java
 *
 * 单次反向转译调用的可变状态，仅在一次 decompile 调用内部使用，不会在请求之间共享。
 * 它记录当前打开的代码块、累积的输出行、是否处于被剥离的主函数包装内，以及是否有一条待定的
 * 合成成功返回语句 (例如 C 的 "return 0;") 等待判断是否应被丢弃。
 *
 * <p>JibJab 没有 else-if，目标语言中的 else-if 分支被还原为嵌套在 else 中的 when 块。
 * 这类块被标记为“串联”的：它们和外层的 else 对应源码中的同一个块，
 * 源码中的块结束时要连同外层一起关闭。
 */
package club.ppmc.battlescript.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class DecompileState {

    private static final String INDENT_UNIT = "  ";

    /** 打开的代码块，栈顶为最内层；值表示该块是否与外层块串联。 */
    private final Deque<Boolean> blocks = new ArrayDeque<>();
    private final List<String> lines = new ArrayList<>();

    /** 主函数包装层数 (main 本身为 1，@autoreleasepool 再加 1)。 */
    private int wrapperLayers;
    /** 进入主函数包装时的深度，只有回到该深度的块结束行才属于包装本身。 */
    private int wrapperDepth;

    private boolean pendingSuccessReturn;
    private String pendingReturnValue;
    private int pendingBlankLines;

    public int depth() {
        return blocks.size();
    }

    /** @return 与源码中的块一一对应的深度 (不计串联块)。 */
    public int sourceDepth() {
        int count = 0;
        for (boolean chained : blocks) {
            if (!chained) {
                count++;
            }
        }
        return count;
    }

    public List<String> lines() {
        return lines;
    }

    /** 在当前深度输出一行。 */
    public void emit(String text) {
        lines.add(INDENT_UNIT.repeat(depth()) + text);
    }

    public void emitBlank() {
        lines.add("");
    }

    /** 输出一个块起始标记并进入下一层。 */
    public void open(String marker) {
        open(marker, false);
    }

    /**
     * @param chained 为 true 时，该块关闭时会连同外层块一起关闭。
     */
    public void open(String marker, boolean chained) {
        emit(marker);
        blocks.push(chained);
    }

    /**
     * 关闭源码中的一个块：退出一层 (深度最低为 0) 并在新深度输出块结束标记，
     * 如果退出的是串联块，继续关闭外层块。
     */
    public void close(String marker) {
        boolean chained;
        do {
            chained = closeBranch(marker);
        } while (chained && !blocks.isEmpty());
    }

    /**
     * 只退出最内层的一个块，用于 else 与 else-if 分支前关闭上一个分支。
     *
     * @return 退出的块是否为串联块，接下来打开的分支应继承这一标记。
     */
    public boolean closeBranch(String marker) {
        boolean chained = !blocks.isEmpty() && blocks.pop();
        emit(marker);
        return chained;
    }

    /** 强制关闭所有残留的代码块，保证结束时深度为 0。 */
    public void closeAll(String marker) {
        while (!blocks.isEmpty()) {
            close(marker);
        }
    }

    public boolean inMainWrapper() {
        return wrapperLayers > 0;
    }

    public void enterMainWrapper() {
        if (wrapperLayers == 0) {
            wrapperDepth = depth();
        }
        wrapperLayers++;
    }

    /** @return 当前是否正处于主函数包装的那一层 (而不是包装内部的嵌套块中)。 */
    public boolean atMainWrapperLevel() {
        return wrapperLayers > 0 && depth() == wrapperDepth;
    }

    public void leaveMainWrapper() {
        if (wrapperLayers > 0) {
            wrapperLayers--;
        }
    }

    public boolean hasPendingSuccessReturn() {
        return pendingSuccessReturn;
    }

    public void deferSuccessReturn(String value) {
        this.pendingSuccessReturn = true;
        this.pendingReturnValue = value;
        this.pendingBlankLines = 0;
    }

    public void holdBlankLine() {
        pendingBlankLines++;
    }

    public String pendingReturnValue() {
        return pendingReturnValue;
    }

    /** 丢弃待定的成功返回语句，但保留其后的空行。 */
    public void dropPendingReturn() {
        int blanks = pendingBlankLines;
        clearPending();
        for (int i = 0; i < blanks; i++) {
            emitBlank();
        }
    }

    /** 待定的返回语句不在包装结束前，因此按普通返回语句输出。 */
    public void flushPendingReturn(String returnMarker) {
        int blanks = pendingBlankLines;
        clearPending();
        emit(returnMarker);
        for (int i = 0; i < blanks; i++) {
            emitBlank();
        }
    }

    private void clearPending() {
        pendingSuccessReturn = false;
        pendingReturnValue = null;
        pendingBlankLines = 0;
    }
}
