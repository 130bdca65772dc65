/**
 * LanguageProfile.java
 *
 * 该文件定义了单个目标语言的不可变配置 (记录类型)。
 * 它同时驱动反向转译器的行识别器与表达式改写器：注释前缀、代码块风格、布尔/空值字面量、
 * 各类语句的识别正则、内置标识符集合、主函数包装的剥离标记等。
 * 每个目标语言在启动时由 LanguageProfiles 构建一次，之后不会被修改。
 */
package club.ppmc.battlescript.model;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Builder;

/**
 * 目标语言配置。
 *
 * <p>所有识别正则都针对<b>已去除首尾空白</b>的单行文本进行锚定匹配，
 * 只捕获条件、参数等子串，交由 ExpressionRewriter 继续处理。这是表层模式匹配，而非语法分析。
 *
 * @param target 目标语言。
 * @param reversible 是否支持反向转译 (汇编为 false)。
 * @param blockStyle 代码块界定风格。
 * @param indentWidth 缩进风格语言中每一级缩进的空格数。
 * @param commentPrefix 单行注释前缀。
 * @param trueLiteral 布尔真字面量的拼写。
 * @param falseLiteral 布尔假字面量的拼写。
 * @param nullLiteral 空值字面量的拼写 (可为 null，表示不做替换)。
 * @param operatorSpellings 目标语言特有的运算符拼写到标准符号拼写的映射，如 "and" -> "&&"、"===" -> "=="。
 * @param headerPrefixes 生成代码头部需要剥离的行前缀。
 * @param blockClose 块结束行的识别正则 (缩进风格语言为 null)。
 * @param functionDef 函数定义，分组 1 = 函数名，分组 2 = 形参列表。
 * @param forLoop 有界数值循环，分组 1 = 变量，分组 2 = 起点，分组 3 = 终点 (不含)。
 * @param ifOpen 条件语句，分组 1 = 条件。
 * @param elseOpen else 分支。
 * @param elseIfOpen else-if 分支，分组 1 = 条件。
 * @param returnStmt 返回语句，分组 1 = 返回值。
 * @param emitStatements 输出语句，第一个非空分组为输出表达式。
 * @param bindStatements 变量绑定，按顺序成对的 (名称, 值) 分组，取第一对非空分组。
 * @param builtins 内置标识符，这些名称的调用不会被改写为用户函数调用。
 * @param reservedWords 保留字，绑定语句捕获到这些名称时视为误匹配。
 * @param paramStyle 形参类型标注风格。
 * @param mainWrapper 主函数包装 (没有包装的语言为 null)。
 * @param forwardDeclaration 函数前置声明 (没有的语言为 null)。
 * @param printfStyle 格式化输出风格。
 * @param printStringTemplate 单个字符串输出语句的模板，包含 {expr} 占位符。
 * @param boolPrintRules 布尔输出辅助写法的化简规则。
 * @param splitStatements 是否把一行中的多条语句拆分为多行 (分号结尾的花括号语言)。
 */
@Builder
public record LanguageProfile(
        TargetId target,
        boolean reversible,
        BlockStyle blockStyle,
        int indentWidth,
        String commentPrefix,
        String trueLiteral,
        String falseLiteral,
        String nullLiteral,
        Map<String, String> operatorSpellings,
        List<String> headerPrefixes,
        Pattern blockClose,
        Pattern functionDef,
        Pattern forLoop,
        Pattern ifOpen,
        Pattern elseOpen,
        Pattern elseIfOpen,
        Pattern returnStmt,
        List<Pattern> emitStatements,
        List<Pattern> bindStatements,
        Set<String> builtins,
        Set<String> reservedWords,
        ParamStyle paramStyle,
        MainWrapper mainWrapper,
        Pattern forwardDeclaration,
        PrintfStyle printfStyle,
        String printStringTemplate,
        List<BoolPrintRule> boolPrintRules,
        boolean splitStatements) {

    public LanguageProfile {
        blockStyle = blockStyle == null ? BlockStyle.BRACE : blockStyle;
        indentWidth = indentWidth <= 0 ? 4 : indentWidth;
        commentPrefix = commentPrefix == null ? "//" : commentPrefix;
        trueLiteral = trueLiteral == null ? "true" : trueLiteral;
        falseLiteral = falseLiteral == null ? "false" : falseLiteral;
        operatorSpellings = operatorSpellings == null ? Map.of() : Map.copyOf(operatorSpellings);
        headerPrefixes = headerPrefixes == null ? List.of() : List.copyOf(headerPrefixes);
        emitStatements = emitStatements == null ? List.of() : List.copyOf(emitStatements);
        bindStatements = bindStatements == null ? List.of() : List.copyOf(bindStatements);
        builtins = builtins == null ? Set.of() : Set.copyOf(builtins);
        reservedWords = reservedWords == null ? Set.of() : Set.copyOf(reservedWords);
        paramStyle = paramStyle == null ? ParamStyle.UNTYPED : paramStyle;
        printfStyle = printfStyle == null ? PrintfStyle.NONE : printfStyle;
        boolPrintRules = boolPrintRules == null ? List.of() : List.copyOf(boolPrintRules);
    }

    public boolean hasMainWrapper() {
        return mainWrapper != null;
    }

    /**
     * 主函数包装的剥离标记。
     *
     * @param open 主函数入口行，例如 "int main() {"。
     * @param innerOpen 主函数内部的附加包装，例如 "@autoreleasepool {" (可为 null)。
     * @param successReturn 包装结束前由生成器追加的成功返回语句，例如 "return 0;" (可为 null)。
     */
    public record MainWrapper(Pattern open, Pattern innerOpen, String successReturn) {}

    /**
     * 布尔输出化简规则：把匹配到的写法替换为普通的输出写法。
     *
     * @param pattern 匹配正则。
     * @param replacement 替换模板，可引用分组 ($1)。
     */
    public record BoolPrintRule(Pattern pattern, String replacement) {}
}
