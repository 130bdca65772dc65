/**
 * LanguageProfiles.java
 *
 * 十种目标语言的配置定义。每种语言的识别正则都对应前向转译器生成代码的固定写法，
 * 同时放宽到能容忍常见的手工修改 (多余空格、省略分号、表达式作为循环边界等)。
 * 新增一种目标语言时，需要在 TargetId 中增加一个枚举值并在这里增加一个配置。
 */
package club.ppmc.battlescript.util;

import club.ppmc.battlescript.model.BlockStyle;
import club.ppmc.battlescript.model.LanguageProfile;
import club.ppmc.battlescript.model.LanguageProfile.BoolPrintRule;
import club.ppmc.battlescript.model.LanguageProfile.MainWrapper;
import club.ppmc.battlescript.model.ParamStyle;
import club.ppmc.battlescript.model.PrintfStyle;
import club.ppmc.battlescript.model.TargetId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class LanguageProfiles {

    private static final String BANNER = "// Transpiled from JibJab";

    // --- C 家族共用片段 ---
    private static final String C_TYPE =
            "(?:const\\s+)?(?:unsigned\\s+)?(?:long\\s+long|int|long|short|float|double|char|bool|BOOL|void"
                    + "|auto|size_t|NSInteger|NSUInteger|std::string|string|NSString|id|std::vector<[^>]+>)";
    /** 类型与名称之间的分隔，兼容 "char *s" 与 "char* s"。 */
    private static final String C_TYPE_SEP = "(?:\\s*[*&]+\\s*|\\s+)";

    private static final Pattern BRACE_CLOSE = Pattern.compile("^\\}\\s*;?$");
    private static final Pattern BRACE_ELSE = Pattern.compile("^\\}?\\s*else\\s*\\{?$");
    private static final Pattern PAREN_IF = Pattern.compile("^if\\s*\\((.+)\\)\\s*\\{$");
    private static final Pattern BARE_IF = Pattern.compile("^if\\s+(.+?)\\s*\\{$");
    private static final Pattern PAREN_ELSE_IF = Pattern.compile("^\\}?\\s*else\\s+if\\s*\\((.+)\\)\\s*\\{$");
    private static final Pattern BARE_ELSE_IF = Pattern.compile("^\\}?\\s*else\\s+if\\s+(.+?)\\s*\\{$");
    private static final Pattern C_FOR = Pattern.compile(
            "^for\\s*\\((?:int|long|let|var|auto|NSInteger|size_t)?\\s*(\\w+)\\s*=\\s*(.+?);\\s*\\w+\\s*<\\s*(.+?);[^)]*\\)\\s*\\{$");
    private static final Pattern C_FUNCTION = Pattern.compile(
            "^" + C_TYPE + C_TYPE_SEP + "(\\w+)\\s*\\(([^)]*)\\)\\s*\\{$");
    private static final Pattern C_FORWARD = Pattern.compile(
            "^" + C_TYPE + C_TYPE_SEP + "\\w+\\s*\\([^)]*\\)\\s*;$");
    private static final Pattern C_DECLARE = Pattern.compile(
            "^(?:static\\s+)?" + C_TYPE + C_TYPE_SEP + "(\\w+)\\s*=\\s*(.+?);$");
    private static final Pattern C_ASSIGN = Pattern.compile("^(\\w+)\\s*=(?!=)\\s*(.+?);$");
    private static final Pattern SEMI_RETURN = Pattern.compile("^return\\s+(.+?)\\s*;?$");
    private static final Pattern PRINTF_EMIT = Pattern.compile(
            "^printf\\(\"%[a-z]*\\\\n\",\\s*(?:\\(long\\)\\s*)?(.+)\\);$");
    private static final Pattern COUT_EMIT = Pattern.compile(
            "^(?:std::)?cout\\s*<<\\s*(.+?)\\s*<<\\s*(?:std::)?endl;$");
    private static final Pattern C_MAIN = Pattern.compile("^int\\s+main\\s*\\([^)]*\\)\\s*\\{$");

    private static final BoolPrintRule PRINTF_TERNARY = new BoolPrintRule(
            Pattern.compile("^printf\\(\"%s\\\\n\",\\s*(\\w+)\\s*\\?\\s*\"[^\"]*\"\\s*:\\s*\"[^\"]*\"\\);$"),
            "printf(\"%d\\n\", $1);");
    private static final BoolPrintRule COUT_TERNARY = new BoolPrintRule(
            Pattern.compile("^(?:std::)?cout\\s*<<\\s*\\((\\w+)\\s*\\?\\s*\"[^\"]*\"\\s*:\\s*\"[^\"]*\"\\)\\s*<<\\s*(?:std::)?endl;$"),
            "std::cout << $1 << std::endl;");
    private static final BoolPrintRule INLINE_TERNARY = new BoolPrintRule(
            Pattern.compile("\\{(\\w+)\\s*\\?\\s*\"[^\"]*\"\\s*:\\s*\"[^\"]*\"\\}"), "{$1}");

    private static final Set<String> C_BUILTINS = Set.of(
            "printf", "puts", "putchar", "scanf", "fgets", "strlen", "strcmp", "strcpy", "strcat", "strstr",
            "malloc", "calloc", "free", "sizeof", "abs", "atoi", "atof", "sqrt", "pow", "floor", "ceil", "exit",
            "main");
    private static final Set<String> C_RESERVED = Set.of(
            "if", "else", "for", "while", "do", "return", "switch", "case", "break", "continue", "int", "long",
            "char", "float", "double", "void", "bool", "const", "static", "struct", "typedef", "sizeof");

    private static final Map<TargetId, LanguageProfile> PROFILES = buildAll();

    private LanguageProfiles() {}

    /**
     * @return 全部目标语言的配置 (只读视图)。
     */
    public static Map<TargetId, LanguageProfile> all() {
        return PROFILES;
    }

    private static Map<TargetId, LanguageProfile> buildAll() {
        var map = new EnumMap<TargetId, LanguageProfile>(TargetId.class);
        map.put(TargetId.PY, python());
        map.put(TargetId.JS, javascript());
        map.put(TargetId.C, c());
        map.put(TargetId.CPP, cpp());
        map.put(TargetId.SWIFT, swift());
        map.put(TargetId.OBJC, objc());
        map.put(TargetId.OBJCPP, objcpp());
        map.put(TargetId.GO, go());
        map.put(TargetId.ASM, asm());
        map.put(TargetId.APPLESCRIPT, applescript());
        return Collections.unmodifiableMap(map);
    }

    private static LanguageProfile python() {
        return LanguageProfile.builder()
                .target(TargetId.PY)
                .reversible(true)
                .blockStyle(BlockStyle.INDENT)
                .indentWidth(4)
                .commentPrefix("#")
                .trueLiteral("True")
                .falseLiteral("False")
                .nullLiteral("None")
                .operatorSpellings(Map.of("and", "&&", "or", "||", "not", "!"))
                .headerPrefixes(List.of("# Transpiled from JibJab", "#!"))
                .functionDef(Pattern.compile("^def\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*:$"))
                .forLoop(Pattern.compile("^for\\s+(\\w+)\\s+in\\s+range\\(([^,]+),\\s*(.+)\\)\\s*:$"))
                .ifOpen(Pattern.compile("^if\\s+(.+?)\\s*:$"))
                .elseOpen(Pattern.compile("^else\\s*:$"))
                .elseIfOpen(Pattern.compile("^elif\\s+(.+?)\\s*:$"))
                .returnStmt(Pattern.compile("^return\\s+(.+)$"))
                .emitStatements(List.of(Pattern.compile("^print\\((.+)\\)$")))
                .bindStatements(List.of(Pattern.compile("^([A-Za-z_]\\w*)\\s*=(?!=)\\s*(.+)$")))
                .builtins(Set.of("print", "range", "str", "int", "float", "len", "input", "abs", "min", "max",
                        "round", "bool", "list", "dict"))
                .reservedWords(Set.of("if", "elif", "else", "for", "while", "def", "return", "print", "import",
                        "from", "class", "not", "and", "or", "in", "is", "pass", "True", "False", "None"))
                .paramStyle(ParamStyle.UNTYPED)
                .printStringTemplate("print({expr})")
                .boolPrintRules(List.of(
                        new BoolPrintRule(Pattern.compile("^print\\(str\\((\\w+)\\)\\.lower\\(\\)\\)$"), "print($1)"),
                        new BoolPrintRule(Pattern.compile("\\{str\\((\\w+)\\)\\.lower\\(\\)\\}"), "{$1}"),
                        new BoolPrintRule(Pattern.compile("^print\\(f(\".*\")\\)$"), "print($1)")))
                .build();
    }

    private static LanguageProfile javascript() {
        return LanguageProfile.builder()
                .target(TargetId.JS)
                .reversible(true)
                .commentPrefix("//")
                .nullLiteral("null")
                .operatorSpellings(Map.of("===", "==", "!==", "!="))
                .headerPrefixes(List.of(BANNER, "\"use strict\"", "#!"))
                .blockClose(BRACE_CLOSE)
                .functionDef(Pattern.compile("^function\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*\\{$"))
                .forLoop(C_FOR)
                .ifOpen(PAREN_IF)
                .elseOpen(BRACE_ELSE)
                .elseIfOpen(PAREN_ELSE_IF)
                .returnStmt(SEMI_RETURN)
                .emitStatements(List.of(Pattern.compile("^console\\.log\\((.+)\\);?$")))
                .bindStatements(List.of(
                        Pattern.compile("^(?:let|const|var)\\s+(\\w+)\\s*=\\s*(.+?);?$"),
                        Pattern.compile("^(\\w+)\\s*=(?!=)\\s*(.+?);?$")))
                .builtins(Set.of("console", "Math", "parseInt", "parseFloat", "String", "Number", "Boolean",
                        "prompt", "require", "Array"))
                .reservedWords(Set.of("if", "else", "for", "while", "do", "return", "function", "let", "const",
                        "var", "new", "typeof", "switch", "case", "break", "continue"))
                .paramStyle(ParamStyle.UNTYPED)
                .printStringTemplate("console.log({expr});")
                .splitStatements(true)
                .build();
    }

    private static LanguageProfile c() {
        return LanguageProfile.builder()
                .target(TargetId.C)
                .reversible(true)
                .commentPrefix("//")
                .nullLiteral("NULL")
                .headerPrefixes(List.of(BANNER, "#include"))
                .blockClose(BRACE_CLOSE)
                .functionDef(C_FUNCTION)
                .forLoop(C_FOR)
                .ifOpen(PAREN_IF)
                .elseOpen(BRACE_ELSE)
                .elseIfOpen(PAREN_ELSE_IF)
                .returnStmt(SEMI_RETURN)
                .emitStatements(List.of(PRINTF_EMIT, Pattern.compile("^puts\\((.+)\\);$")))
                .bindStatements(List.of(C_DECLARE, C_ASSIGN))
                .builtins(C_BUILTINS)
                .reservedWords(C_RESERVED)
                .paramStyle(ParamStyle.TYPE_FIRST)
                .mainWrapper(new MainWrapper(C_MAIN, null, "return 0;"))
                .forwardDeclaration(C_FORWARD)
                .printfStyle(PrintfStyle.C_PRINTF)
                .printStringTemplate("printf(\"%s\\n\", {expr});")
                .boolPrintRules(List.of(PRINTF_TERNARY, INLINE_TERNARY))
                .splitStatements(true)
                .build();
    }

    private static LanguageProfile cpp() {
        return LanguageProfile.builder()
                .target(TargetId.CPP)
                .reversible(true)
                .commentPrefix("//")
                .nullLiteral("nullptr")
                .headerPrefixes(List.of(BANNER, "#include", "using namespace"))
                .blockClose(BRACE_CLOSE)
                .functionDef(C_FUNCTION)
                .forLoop(C_FOR)
                .ifOpen(PAREN_IF)
                .elseOpen(BRACE_ELSE)
                .elseIfOpen(PAREN_ELSE_IF)
                .returnStmt(SEMI_RETURN)
                .emitStatements(List.of(COUT_EMIT, PRINTF_EMIT))
                .bindStatements(List.of(C_DECLARE, C_ASSIGN))
                .builtins(union(C_BUILTINS, Set.of("cout", "endl", "to_string", "stoi", "getline", "cin")))
                .reservedWords(union(C_RESERVED, Set.of("auto", "namespace", "using", "class", "new", "delete")))
                .paramStyle(ParamStyle.TYPE_FIRST)
                .mainWrapper(new MainWrapper(C_MAIN, null, "return 0;"))
                .forwardDeclaration(C_FORWARD)
                .printfStyle(PrintfStyle.C_PRINTF)
                .printStringTemplate("std::cout << {expr} << std::endl;")
                .boolPrintRules(List.of(COUT_TERNARY, PRINTF_TERNARY, INLINE_TERNARY))
                .splitStatements(true)
                .build();
    }

    private static LanguageProfile swift() {
        return LanguageProfile.builder()
                .target(TargetId.SWIFT)
                .reversible(true)
                .commentPrefix("//")
                .nullLiteral("nil")
                .headerPrefixes(List.of(BANNER, "import "))
                .blockClose(BRACE_CLOSE)
                .functionDef(Pattern.compile("^func\\s+(\\w+)\\s*\\(([^)]*)\\)(?:\\s*->\\s*[\\w\\[\\]?]+)?\\s*\\{$"))
                .forLoop(Pattern.compile("^for\\s+(\\w+)\\s+in\\s+(.+?)\\.\\.<(.+?)\\s*\\{$"))
                .ifOpen(BARE_IF)
                .elseOpen(BRACE_ELSE)
                .elseIfOpen(BARE_ELSE_IF)
                .returnStmt(SEMI_RETURN)
                .emitStatements(List.of(Pattern.compile("^print\\((.+)\\);?$")))
                .bindStatements(List.of(
                        Pattern.compile("^(?:var|let)\\s+(\\w+)(?:\\s*:\\s*[\\w\\[\\]?]+)?\\s*=\\s*(.+?);?$"),
                        Pattern.compile("^(\\w+)\\s*=(?!=)\\s*(.+?);?$")))
                .builtins(Set.of("print", "String", "Int", "Double", "Bool", "readLine", "abs", "min", "max",
                        "Array", "Dictionary"))
                .reservedWords(Set.of("if", "else", "for", "while", "func", "return", "var", "let", "in",
                        "guard", "switch", "case", "import", "struct", "class", "true", "false", "nil"))
                .paramStyle(ParamStyle.TYPE_AFTER_COLON)
                .printStringTemplate("print({expr})")
                .build();
    }

    private static LanguageProfile objc() {
        return LanguageProfile.builder()
                .target(TargetId.OBJC)
                .reversible(true)
                .commentPrefix("//")
                .trueLiteral("YES")
                .falseLiteral("NO")
                .nullLiteral("nil")
                .headerPrefixes(List.of(BANNER, "#import", "#include"))
                .blockClose(BRACE_CLOSE)
                .functionDef(C_FUNCTION)
                .forLoop(C_FOR)
                .ifOpen(PAREN_IF)
                .elseOpen(BRACE_ELSE)
                .elseIfOpen(PAREN_ELSE_IF)
                .returnStmt(SEMI_RETURN)
                .emitStatements(List.of(PRINTF_EMIT, Pattern.compile("^NSLog\\(@?(.+)\\);$")))
                .bindStatements(List.of(C_DECLARE, C_ASSIGN))
                .builtins(union(C_BUILTINS, Set.of("NSLog", "NSString", "stringWithFormat", "UTF8String",
                        "NSNumber", "NSArray", "NSDictionary")))
                .reservedWords(union(C_RESERVED, Set.of("BOOL", "id", "nil", "self", "super")))
                .paramStyle(ParamStyle.TYPE_FIRST)
                .mainWrapper(new MainWrapper(C_MAIN, Pattern.compile("^@autoreleasepool\\s*\\{$"), "return 0;"))
                .forwardDeclaration(C_FORWARD)
                .printfStyle(PrintfStyle.C_PRINTF)
                .printStringTemplate("printf(\"%s\\n\", {expr});")
                .boolPrintRules(List.of(PRINTF_TERNARY, INLINE_TERNARY))
                .splitStatements(true)
                .build();
    }

    private static LanguageProfile objcpp() {
        return LanguageProfile.builder()
                .target(TargetId.OBJCPP)
                .reversible(true)
                .commentPrefix("//")
                .nullLiteral("nullptr")
                // Objective-C 的 BOOL 字面量也可能出现在手工修改后的代码里
                .operatorSpellings(Map.of("YES", CanonicalSyntax.TRUE, "NO", CanonicalSyntax.FALSE))
                .headerPrefixes(List.of(BANNER, "#import", "#include", "using namespace"))
                .blockClose(BRACE_CLOSE)
                .functionDef(C_FUNCTION)
                .forLoop(C_FOR)
                .ifOpen(PAREN_IF)
                .elseOpen(BRACE_ELSE)
                .elseIfOpen(PAREN_ELSE_IF)
                .returnStmt(SEMI_RETURN)
                .emitStatements(List.of(COUT_EMIT, PRINTF_EMIT, Pattern.compile("^NSLog\\(@?(.+)\\);$")))
                .bindStatements(List.of(C_DECLARE, C_ASSIGN))
                .builtins(union(C_BUILTINS, Set.of("cout", "endl", "to_string", "NSLog", "NSString",
                        "stringWithFormat", "UTF8String", "static_cast")))
                .reservedWords(union(C_RESERVED, Set.of("auto", "namespace", "using", "class", "BOOL", "id",
                        "self", "nil")))
                .paramStyle(ParamStyle.TYPE_FIRST)
                .mainWrapper(new MainWrapper(C_MAIN, Pattern.compile("^@autoreleasepool\\s*\\{$"), "return 0;"))
                .forwardDeclaration(C_FORWARD)
                .printfStyle(PrintfStyle.C_PRINTF)
                .printStringTemplate("std::cout << {expr} << std::endl;")
                .boolPrintRules(List.of(COUT_TERNARY, PRINTF_TERNARY, INLINE_TERNARY))
                .splitStatements(true)
                .build();
    }

    private static LanguageProfile go() {
        return LanguageProfile.builder()
                .target(TargetId.GO)
                .reversible(true)
                .commentPrefix("//")
                .nullLiteral("nil")
                .headerPrefixes(List.of(BANNER, "package main", "import "))
                .blockClose(BRACE_CLOSE)
                .functionDef(Pattern.compile("^func\\s+(\\w+)\\s*\\(([^)]*)\\)(?:\\s*[\\w\\[\\]*]+)?\\s*\\{$"))
                .forLoop(Pattern.compile("^for\\s+(\\w+)\\s*:=\\s*(.+?);\\s*\\w+\\s*<\\s*(.+?);[^{]*\\{$"))
                .ifOpen(BARE_IF)
                .elseOpen(BRACE_ELSE)
                .elseIfOpen(BARE_ELSE_IF)
                .returnStmt(SEMI_RETURN)
                .emitStatements(List.of(Pattern.compile("^fmt\\.Println\\((.+)\\)$")))
                .bindStatements(List.of(
                        Pattern.compile("^var\\s+(\\w+)(?:\\s+[\\w\\[\\]*]+)?\\s*=\\s*(.+)$"),
                        Pattern.compile("^(\\w+)\\s*:=\\s*(.+)$"),
                        Pattern.compile("^(\\w+)\\s*=(?!=)\\s*(.+)$")))
                .builtins(Set.of("fmt", "len", "append", "make", "int", "float64", "string", "bool", "math",
                        "strconv", "panic"))
                .reservedWords(Set.of("if", "else", "for", "func", "return", "var", "const", "package", "import",
                        "range", "switch", "case", "go", "defer", "type", "struct", "map"))
                .paramStyle(ParamStyle.TYPE_LAST)
                .mainWrapper(new MainWrapper(Pattern.compile("^func\\s+main\\s*\\(\\s*\\)\\s*\\{$"), null, null))
                .printfStyle(PrintfStyle.GO_PRINTF)
                .printStringTemplate("fmt.Println({expr})")
                .build();
    }

    /** 汇编目标不支持反向转译，这里只提供注释前缀等基本信息。 */
    private static LanguageProfile asm() {
        return LanguageProfile.builder()
                .target(TargetId.ASM)
                .reversible(false)
                .commentPrefix("//")
                .build();
    }

    private static LanguageProfile applescript() {
        return LanguageProfile.builder()
                .target(TargetId.APPLESCRIPT)
                .reversible(true)
                .blockStyle(BlockStyle.KEYWORD)
                .commentPrefix("--")
                .nullLiteral("missing value")
                .operatorSpellings(Map.of(
                        "and", "&&", "or", "||", "not", "!", "mod", "%", "=", "==", "≠", "!=", "≤", "<=", "≥", ">="))
                .headerPrefixes(List.of("-- Transpiled from JibJab"))
                .blockClose(Pattern.compile("^end(?:\\s+\\w+)?$"))
                .functionDef(Pattern.compile("^on\\s+(\\w+)\\s*\\(([^)]*)\\)$"))
                .forLoop(Pattern.compile("^repeat\\s+with\\s+(\\w+)\\s+from\\s+(.+?)\\s+to\\s+\\((.+?)\\s*-\\s*1\\)$"))
                .ifOpen(Pattern.compile("^if\\s+(.+?)\\s+then$"))
                .elseOpen(Pattern.compile("^else$"))
                .elseIfOpen(Pattern.compile("^else\\s+if\\s+(.+?)\\s+then$"))
                .returnStmt(Pattern.compile("^return\\s+(.+)$"))
                .emitStatements(List.of(Pattern.compile("^log\\s+(.+)$")))
                .bindStatements(List.of(Pattern.compile("^set\\s+(\\w+)\\s+to\\s+(.+)$")))
                .builtins(Set.of("log", "display", "dialog", "count", "length", "text", "item", "character"))
                .reservedWords(Set.of("if", "then", "else", "end", "repeat", "with", "from", "to", "on", "return",
                        "set", "log", "tell", "my", "of"))
                .paramStyle(ParamStyle.UNTYPED)
                .printStringTemplate("log {expr}")
                .build();
    }

    private static Set<String> union(Set<String> base, Set<String> extra) {
        var all = new HashSet<>(base);
        all.addAll(extra);
        return all;
    }
}
