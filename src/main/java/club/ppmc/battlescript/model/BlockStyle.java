/**
 * BlockStyle.java
 *
 * 描述目标语言如何界定代码块。反向转译器据此决定如何识别块的结束。
 */
package club.ppmc.battlescript.model;

public enum BlockStyle {
    /** 花括号语言 (C, Go, Swift, JS ...)，块以单独的 "}" 结束。 */
    BRACE,
    /** 缩进语言 (Python)，缩进减少即块结束。 */
    INDENT,
    /** 包裹关键字语言 (AppleScript)，块以 "end ..." 结束。 */
    KEYWORD
}
