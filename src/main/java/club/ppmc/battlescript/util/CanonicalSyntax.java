/**
 * CanonicalSyntax.java
 *
 * JibJab 标准语法的拼写常量与拼装方法。
 * 反向转译器和表达式改写器只通过这里生成标准文本，保证两者使用同一套记号。
 */
package club.ppmc.battlescript.util;

import java.util.List;
import java.util.Set;

public final class CanonicalSyntax {

    public static final String BLOCK_END = "<~>>";
    public static final String ELSE = "<~else>>";
    public static final String COMMENT = "@@";
    public static final String NUMBER_PREFIX = "#";
    public static final String TRUE = "~yep";
    public static final String FALSE = "~nope";
    public static final String NIL = "~nil";

    /** 标准运算符记号，按长度降序排列以便最长匹配。 */
    public static final List<String> OPERATOR_TOKENS =
            List.of("<!=>", "<lte>", "<gte>", "<&&>", "<||>", "<lt>", "<gt>",
                    "<+>", "<->", "<*>", "</>", "<%>", "<=>", "<!>");

    /** 出现在 "名称(" 形式中、但属于标准语法本身而非用户函数的关键字。 */
    public static final Set<String> KEYWORDS = Set.of("emit", "val", "with", "grab");

    private CanonicalSyntax() {}

    public static String emit(String expr) {
        return "~>frob{7a3}::emit(" + expr + ")";
    }

    public static String bind(String name, String value) {
        return "~>snag{" + name + "}::val(" + value + ")";
    }

    public static String yeet(String value) {
        return "~>yeet{" + value + "}";
    }

    public static String invoke(String name, String args) {
        return "~>invoke{" + name + "}::with(" + args + ")";
    }

    public static String morph(String name, String params) {
        return "<~morph{" + name + "(" + params + ")}>>";
    }

    public static String loop(String variable, String start, String end) {
        return "<~loop{" + variable + ":" + start + ".." + end + "}>>";
    }

    public static String when(String condition) {
        return "<~when{" + condition + "}>>";
    }

    public static String comment(String text) {
        return text.isEmpty() ? COMMENT : COMMENT + " " + text;
    }
}
