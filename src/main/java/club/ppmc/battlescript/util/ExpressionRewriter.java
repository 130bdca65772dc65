/**
 * ExpressionRewriter.java
 *
 * 把目标语言的单个表达式改写为 JibJab 标准表达式。
 * 处理顺序固定：去掉一层完整包裹的括号、替换运算符与字面量、给数字加 # 前缀、把用户函数调用改写为 invoke。
 * 每一步只处理上一步的输出，并且都会跳过双引号字符串内部的内容。
 * 该组件不会抛出异常，无法识别的内容原样保留。
 */
package club.ppmc.battlescript.util;

import club.ppmc.battlescript.model.LanguageProfile;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ExpressionRewriter {

    /** 标准符号运算符到 JibJab 记号的映射。 */
    private static final Map<String, String> STANDARD_OPERATORS = Map.ofEntries(
            Map.entry("<=", "<lte>"),
            Map.entry(">=", "<gte>"),
            Map.entry("==", "<=>"),
            Map.entry("!=", "<!=>"),
            Map.entry("&&", "<&&>"),
            Map.entry("||", "<||>"),
            Map.entry("<", "<lt>"),
            Map.entry(">", "<gt>"),
            Map.entry("+", "<+>"),
            Map.entry("-", "<->"),
            Map.entry("*", "<*>"),
            Map.entry("/", "</>"),
            Map.entry("%", "<%>"),
            Map.entry("!", "<!>"));

    /** 需要整体保留、不能被拆成单字符运算符的多字符记号。 */
    private static final List<String> PASS_THROUGH = List.of(
            "..<", "<<", ">>", "->", "~>", "::", ":=", "+=", "-=", "*=", "/=", "%=", "++", "--");

    /**
     * 改写一个表达式。
     *
     * @param expr 目标语言表达式，可以为 null。
     * @param profile 表达式所属的目标语言配置。
     * @return 标准表达式；输入为 null 时返回空字符串。
     */
    public String rewrite(String expr, LanguageProfile profile) {
        if (expr == null) {
            return "";
        }
        String s = stripEnclosingParens(expr.trim());
        s = replaceOperators(s, profile);
        s = tagNumbers(s);
        return rewriteCalls(s, profile);
    }

    // --- 第 1 步：括号 ---

    static String stripEnclosingParens(String s) {
        if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')') {
            return s;
        }
        int close = findClosingParen(s, 0);
        if (close != s.length() - 1) {
            return s;
        }
        return s.substring(1, s.length() - 1).trim();
    }

    /**
     * 找到与 open 位置的左括号匹配的右括号，忽略字符串中的括号。
     *
     * @return 右括号下标，不平衡时返回 -1。
     */
    static int findClosingParen(String s, int open) {
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // --- 第 2 步：运算符与字面量 ---

    private String replaceOperators(String s, LanguageProfile profile) {
        List<Spelling> spellings = spellingsFor(profile);
        var out = new StringBuilder(s.length() + 16);
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"') {
                int end = skipString(s, i);
                out.append(s, i, end);
                i = end;
                continue;
            }
            if (isIdentifierChar(c) && i > 0 && isIdentifierChar(s.charAt(i - 1))) {
                // 单词中间的字符不可能是单词拼写的开头
                out.append(c);
                i++;
                continue;
            }
            Spelling match = null;
            for (Spelling sp : spellings) {
                if (s.startsWith(sp.text(), i) && sp.fits(s, i, out)) {
                    match = sp;
                    break;
                }
            }
            if (match == null) {
                out.append(c);
                i++;
            } else {
                out.append(match.replacement());
                i += match.text().length();
            }
        }
        return out.toString();
    }

    private List<Spelling> spellingsFor(LanguageProfile profile) {
        var list = new ArrayList<Spelling>();
        for (String token : CanonicalSyntax.OPERATOR_TOKENS) {
            list.add(new Spelling(token, token));
        }
        list.add(new Spelling(CanonicalSyntax.TRUE, CanonicalSyntax.TRUE));
        list.add(new Spelling(CanonicalSyntax.FALSE, CanonicalSyntax.FALSE));
        list.add(new Spelling(CanonicalSyntax.NIL, CanonicalSyntax.NIL));
        for (String token : PASS_THROUGH) {
            list.add(new Spelling(token, token));
        }
        if (profile != null) {
            for (var entry : profile.operatorSpellings().entrySet()) {
                String standard = entry.getValue();
                list.add(new Spelling(entry.getKey(), STANDARD_OPERATORS.getOrDefault(standard, standard)));
            }
            list.add(new Spelling(profile.trueLiteral(), CanonicalSyntax.TRUE));
            list.add(new Spelling(profile.falseLiteral(), CanonicalSyntax.FALSE));
            if (profile.nullLiteral() != null) {
                list.add(new Spelling(profile.nullLiteral(), CanonicalSyntax.NIL));
            }
        }
        STANDARD_OPERATORS.forEach((symbol, token) -> list.add(new Spelling(symbol, token)));
        // 最长匹配优先；同长度时先登记的优先 (标准记号在最前)
        list.sort(Comparator.comparingInt((Spelling sp) -> sp.text().length()).reversed());
        return list;
    }

    /** 一种拼写及其替换结果。以字母开头的拼写必须落在单词边界上。 */
    private record Spelling(String text, String replacement) {

        boolean fits(String s, int at, StringBuilder written) {
            if (Character.isLetter(text.charAt(0)) || text.charAt(0) == '_') {
                int end = at + text.length();
                boolean leftOk = at == 0 || !isIdentifierChar(s.charAt(at - 1));
                boolean rightOk = end >= s.length()
                        || !isIdentifierChar(s.charAt(end))
                        || !isIdentifierChar(text.charAt(text.length() - 1));
                return leftOk && rightOk;
            }
            if ("-".equals(text)) {
                return isBinaryPosition(written);
            }
            return true;
        }
    }

    /** 减号只有跟在操作数之后才是二元运算符。 */
    private static boolean isBinaryPosition(StringBuilder written) {
        for (int j = written.length() - 1; j >= 0; j--) {
            char p = written.charAt(j);
            if (Character.isWhitespace(p)) {
                continue;
            }
            return isIdentifierChar(p) || p == ')' || p == ']' || p == '"';
        }
        return false;
    }

    // --- 第 3 步：数字 ---

    private String tagNumbers(String s) {
        var out = new StringBuilder(s.length() + 8);
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"') {
                int end = skipString(s, i);
                out.append(s, i, end);
                i = end;
            } else if (c == '#') {
                // 已标记的数字整体保留
                int j = i + 1;
                if (j < s.length() && s.charAt(j) == '-') {
                    j++;
                }
                j = skipNumber(s, j);
                out.append(s, i, j);
                i = j;
            } else if (Character.isLetter(c) || c == '_') {
                int j = i;
                while (j < s.length() && isIdentifierChar(s.charAt(j))) {
                    j++;
                }
                out.append(s, i, j);
                i = j;
            } else if (Character.isDigit(c) || isUnaryMinus(s, i)) {
                int start = i;
                int j = skipNumber(s, c == '-' ? i + 1 : i);
                if (j < s.length() && (Character.isLetter(s.charAt(j)) || s.charAt(j) == '_')) {
                    // 十六进制、带后缀的字面量等，不视为数字
                    while (j < s.length() && isIdentifierChar(s.charAt(j))) {
                        j++;
                    }
                    out.append(s, start, j);
                } else {
                    out.append(CanonicalSyntax.NUMBER_PREFIX).append(s, start, j);
                }
                i = j;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isUnaryMinus(String s, int i) {
        return s.charAt(i) == '-'
                && i + 1 < s.length()
                && Character.isDigit(s.charAt(i + 1))
                && (i == 0 || s.charAt(i - 1) != '-');
    }

    private static int skipNumber(String s, int from) {
        int j = from;
        while (j < s.length()) {
            char d = s.charAt(j);
            if (Character.isDigit(d)) {
                j++;
            } else if (d == '.' && j + 1 < s.length() && Character.isDigit(s.charAt(j + 1))) {
                j++;
            } else {
                break;
            }
        }
        return j;
    }

    // --- 第 4 步：函数调用 ---

    private String rewriteCalls(String s, LanguageProfile profile) {
        var out = new StringBuilder(s.length() + 32);
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"') {
                int end = skipString(s, i);
                out.append(s, i, end);
                i = end;
                continue;
            }
            if (!(Character.isLetter(c) || c == '_')) {
                out.append(c);
                i++;
                continue;
            }
            int nameEnd = i;
            while (nameEnd < s.length() && isIdentifierChar(s.charAt(nameEnd))) {
                nameEnd++;
            }
            String name = s.substring(i, nameEnd);
            if (nameEnd >= s.length() || s.charAt(nameEnd) != '(') {
                out.append(name);
                i = nameEnd;
                continue;
            }
            int close = findClosingParen(s, nameEnd);
            if (close < 0) {
                // 括号不平衡，余下部分原样保留
                out.append(s, i, s.length());
                break;
            }
            String args = rewriteCalls(s.substring(nameEnd + 1, close), profile);
            if (isUserCall(s, i, name, profile)) {
                out.append(CanonicalSyntax.invoke(name, args));
            } else {
                out.append(name).append('(').append(args).append(')');
            }
            i = close + 1;
        }
        return out.toString();
    }

    private boolean isUserCall(String s, int nameStart, String name, LanguageProfile profile) {
        if (CanonicalSyntax.KEYWORDS.contains(name)) {
            return false;
        }
        if (profile != null && (profile.builtins().contains(name) || profile.reservedWords().contains(name))) {
            return false;
        }
        if (nameStart > 0 && s.charAt(nameStart - 1) == '.') {
            return false;
        }
        return !(nameStart > 1 && s.startsWith("::", nameStart - 2));
    }

    // --- 工具方法 ---

    /** 返回从 start 处的双引号开始的字符串字面量之后的位置；未闭合时返回末尾。 */
    private static int skipString(String s, int start) {
        int i = start + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            i++;
        }
        return s.length();
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
