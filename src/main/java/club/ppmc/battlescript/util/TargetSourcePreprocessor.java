/**
 * TargetSourcePreprocessor.java
 *
 * 反向转译前的源码预处理。它把生成代码中与 JibJab 程序无关、或一行无法被行识别器处理的写法
 * 规整为逐行可识别的形式：剥离文件头与 import 块、删除函数前置声明、化简布尔输出辅助写法、
 * 把多参数的 printf / fmt.Printf 合并为一条插值字符串输出、把一行中的多条语句拆成多行。
 */
package club.ppmc.battlescript.util;

import club.ppmc.battlescript.model.LanguageProfile;
import club.ppmc.battlescript.model.LanguageProfile.BoolPrintRule;
import club.ppmc.battlescript.model.PrintfStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class TargetSourcePreprocessor {

    private static final Pattern C_PRINTF = Pattern.compile("^printf\\(\"(.*)\\\\n\"(?:,\\s*(.+))?\\);$");
    private static final Pattern GO_PRINTF = Pattern.compile("^fmt\\.Printf\\(\"(.*)\\\\n\"(?:,\\s*(.+))?\\)$");
    private static final Pattern FORMAT_VERB = Pattern.compile("%%|%[-+ 0#]*\\d*(?:\\.\\d+)?(?:ll|l|h|z)?[a-zA-Z@]");
    private static final Pattern SINGLE_VERB = Pattern.compile("^%(?:l|ll)?[dsfgiuv@t]$");
    private static final Pattern TERNARY_ARG = Pattern.compile("^\\(?(\\w+)\\s*\\?\\s*\"[^\"]*\"\\s*:\\s*\"[^\"]*\"\\)?$");
    private static final Pattern CAST_PREFIX = Pattern.compile("^\\((?:long|int|double|float|char\\s*\\*)\\)\\s*");

    /**
     * 预处理源码。
     *
     * @param code 目标语言源码。
     * @param profile 目标语言配置。
     * @return 规整后的行列表，保留每行原有的缩进。
     */
    public List<String> preprocess(String code, LanguageProfile profile) {
        var result = new ArrayList<String>();
        boolean inImportBlock = false;
        for (String raw : code.replace("\r\n", "\n").split("\n", -1)) {
            String trimmed = raw.trim();
            if (inImportBlock) {
                if (trimmed.startsWith(")")) {
                    inImportBlock = false;
                }
                continue;
            }
            if (trimmed.startsWith("import (")) {
                inImportBlock = !trimmed.endsWith(")");
                continue;
            }
            if (isHeader(trimmed, profile)) {
                continue;
            }
            if (profile.forwardDeclaration() != null && profile.forwardDeclaration().matcher(trimmed).matches()) {
                continue;
            }
            String indent = raw.substring(0, raw.length() - raw.stripLeading().length());
            List<String> parts = profile.splitStatements() && !isComment(trimmed, profile)
                    ? splitStatements(trimmed)
                    : List.of(trimmed);
            for (String part : parts) {
                String line = simplifyBoolPrint(part, profile);
                line = normalizePrintf(line, profile);
                result.add(line.isEmpty() ? "" : indent + line);
            }
        }
        return result;
    }

    private boolean isHeader(String trimmed, LanguageProfile profile) {
        if (trimmed.isEmpty()) {
            return false;
        }
        for (String prefix : profile.headerPrefixes()) {
            if (trimmed.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isComment(String trimmed, LanguageProfile profile) {
        return trimmed.startsWith(profile.commentPrefix());
    }

    // --- 布尔输出 ---

    String simplifyBoolPrint(String line, LanguageProfile profile) {
        String current = line;
        for (BoolPrintRule rule : profile.boolPrintRules()) {
            Matcher m = rule.pattern().matcher(current);
            current = m.replaceAll(mr -> Matcher.quoteReplacement(rule.replacement().replace("$1", mr.group(1))));
        }
        return current;
    }

    // --- printf ---

    /**
     * 把带多个格式说明符 (或不带说明符) 的格式化输出改写为单个插值字符串的输出语句，
     * 例如 printf("x = %d, y = %d\n", x, y) 变为 printf("%s\n", "x = {x}, y = {y}")。
     * 只有一个说明符且格式串中没有其他文本的写法保持不变，交给输出识别器处理。
     */
    String normalizePrintf(String line, LanguageProfile profile) {
        Pattern pattern = switch (profile.printfStyle()) {
            case C_PRINTF -> C_PRINTF;
            case GO_PRINTF -> GO_PRINTF;
            case NONE -> null;
        };
        if (pattern == null || profile.printStringTemplate() == null) {
            return line;
        }
        Matcher m = pattern.matcher(line);
        if (!m.matches()) {
            return line;
        }
        String format = m.group(1);
        List<String> args = m.group(2) == null ? List.of() : splitTopLevel(m.group(2), ',');
        if (args.size() == 1 && SINGLE_VERB.matcher(format).matches()) {
            if (profile.printfStyle() == PrintfStyle.GO_PRINTF) {
                return profile.printStringTemplate().replace("{expr}", cleanArg(args.get(0)));
            }
            return line;
        }
        var text = new StringBuilder();
        Matcher verb = FORMAT_VERB.matcher(format);
        int last = 0;
        int argIndex = 0;
        while (verb.find()) {
            text.append(format, last, verb.start());
            if ("%%".equals(verb.group())) {
                text.append('%');
            } else if (argIndex < args.size()) {
                text.append('{').append(cleanArg(args.get(argIndex++))).append('}');
            } else {
                text.append(verb.group());
            }
            last = verb.end();
        }
        text.append(format.substring(last));
        return profile.printStringTemplate().replace("{expr}", "\"" + text + "\"");
    }

    private static String cleanArg(String arg) {
        String cleaned = CAST_PREFIX.matcher(arg.trim()).replaceFirst("");
        Matcher ternary = TERNARY_ARG.matcher(cleaned);
        return ternary.matches() ? ternary.group(1) : cleaned;
    }

    // --- 语句拆分 ---

    /**
     * 把一行中的多条语句拆为多行，例如 "int main(){ int x = 1; return 0; }"。
     * 只在块头 (以 ")"、"else" 或 "@autoreleasepool" 结尾) 之后的 "{" 处拆分，
     * 数组初始化等花括号保持在同一行；括号内的分号 (for 循环头) 不拆分。
     */
    List<String> splitStatements(String line) {
        var parts = new ArrayList<String>();
        var current = new StringBuilder();
        int parenDepth = 0;
        int initializerDepth = 0;
        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                current.append(c);
                if (c == '\\' && i + 1 < line.length()) {
                    current.append(line.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                // 行尾注释单独成行
                flush(parts, current);
                parts.add(line.substring(i).trim());
                return parts;
            }
            switch (c) {
                case '"' -> {
                    inString = true;
                    current.append(c);
                }
                case '(' -> {
                    parenDepth++;
                    current.append(c);
                }
                case ')' -> {
                    parenDepth--;
                    current.append(c);
                }
                case '{' -> {
                    if (parenDepth == 0 && isBlockHeader(current)) {
                        current.append(c);
                        flush(parts, current);
                    } else {
                        initializerDepth++;
                        current.append(c);
                    }
                }
                case '}' -> {
                    if (initializerDepth > 0) {
                        initializerDepth--;
                        current.append(c);
                    } else {
                        flush(parts, current);
                        parts.add("}");
                    }
                }
                case ';' -> {
                    current.append(c);
                    if (parenDepth == 0 && initializerDepth == 0) {
                        flush(parts, current);
                    }
                }
                default -> current.append(c);
            }
        }
        flush(parts, current);
        if (parts.isEmpty()) {
            parts.add("");
        }
        return mergeElse(parts);
    }

    /** "}" 与紧随其后的 "else {" 合并回一行，由反向转译器统一处理。 */
    private static List<String> mergeElse(List<String> parts) {
        var merged = new ArrayList<String>(parts.size());
        for (String part : parts) {
            int last = merged.size() - 1;
            if (last >= 0 && "}".equals(merged.get(last)) && part.startsWith("else")) {
                merged.set(last, "} " + part);
            } else {
                merged.add(part);
            }
        }
        return merged;
    }

    private static boolean isBlockHeader(StringBuilder current) {
        String text = current.toString().trim();
        return text.endsWith(")") || text.endsWith("else") || text.endsWith("@autoreleasepool");
    }

    private static void flush(List<String> parts, StringBuilder current) {
        String text = current.toString().trim();
        if (!text.isEmpty()) {
            parts.add(text);
        }
        current.setLength(0);
    }

    /** 按顶层分隔符拆分参数列表，忽略括号与字符串内部的分隔符。 */
    static List<String> splitTopLevel(String text, char separator) {
        var parts = new ArrayList<String>();
        var current = new StringBuilder();
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                current.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (current.length() > 0) {
            parts.add(current.toString().trim());
        }
        return parts;
    }
}
