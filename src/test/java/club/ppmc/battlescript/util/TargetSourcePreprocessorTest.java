/**
 * TargetSourcePreprocessorTest.java
 */
package club.ppmc.battlescript.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import club.ppmc.battlescript.model.LanguageProfile;
import club.ppmc.battlescript.model.TargetId;
import java.util.List;
import org.junit.jupiter.api.Test;

class TargetSourcePreprocessorTest {

    private final TargetSourcePreprocessor preprocessor = new TargetSourcePreprocessor();

    private static LanguageProfile profile(TargetId target) {
        return LanguageProfiles.all().get(target);
    }

    @Test
    void splitsOneLineProgramIntoStatements() {
        assertEquals(
                List.of("int main(){", "int x = 1 + 2;", "printf(\"%d\\n\", x);", "return 0;", "}"),
                preprocessor.splitStatements("int main(){ int x = 1 + 2; printf(\"%d\\n\", x); return 0; }"));
    }

    @Test
    void keepsElseOnTheClosingBraceLine() {
        assertEquals(
                List.of("if (a) {", "x = 1;", "} else {", "x = 2;", "}"),
                preprocessor.splitStatements("if (a) { x = 1; } else { x = 2; }"));
    }

    @Test
    void doesNotSplitInitializersOrLoopHeaders() {
        assertEquals(List.of("int a[] = {1, 2};"), preprocessor.splitStatements("int a[] = {1, 2};"));
        assertEquals(
                List.of("for (int i = 0; i < 3; i++) {"),
                preprocessor.splitStatements("for (int i = 0; i < 3; i++) {"));
        assertEquals(
                List.of("printf(\"a; b {c}\\n\");"),
                preprocessor.splitStatements("printf(\"a; b {c}\\n\");"));
    }

    @Test
    void movesTrailingCommentToItsOwnLine() {
        assertEquals(List.of("let a = 1;", "// note"), preprocessor.splitStatements("let a = 1; // note"));
    }

    @Test
    void stripsHeadersForwardDeclarationsAndKeepsIndentation() {
        String code = "#include <stdio.h>\nint add(int a, int b);\n    int x = 1;\n";
        assertEquals(List.of("    int x = 1;", ""), preprocessor.preprocess(code, profile(TargetId.C)));
    }

    @Test
    void stripsGoImportBlock() {
        String code = "package main\nimport (\n\t\"fmt\"\n\t\"os\"\n)\nfunc main() {";
        assertEquals(List.of("func main() {"), preprocessor.preprocess(code, profile(TargetId.GO)));
    }

    @Test
    void mergesMultiVerbPrintfIntoInterpolatedString() {
        LanguageProfile c = profile(TargetId.C);
        assertEquals(
                "printf(\"%s\\n\", \"{1} + {2}\");",
                preprocessor.normalizePrintf("printf(\"%d + %d\\n\", 1, 2);", c));
        assertEquals(
                "printf(\"%s\\n\", \"a={a} b={b}\");",
                preprocessor.normalizePrintf("printf(\"a=%ld b=%d\\n\", (long)a, b);", c));
        assertEquals(
                "printf(\"%s\\n\", \"{p}%\");",
                preprocessor.normalizePrintf("printf(\"%d%%\\n\", p);", c));
    }

    @Test
    void printfWithoutVerbsBecomesStringOutput() {
        assertEquals(
                "printf(\"%s\\n\", \"hello\");",
                preprocessor.normalizePrintf("printf(\"hello\\n\");", profile(TargetId.C)));
    }

    @Test
    void singleVerbPrintfIsLeftForTheEmitRecognizer() {
        String line = "printf(\"%d\\n\", x);";
        assertEquals(line, preprocessor.normalizePrintf(line, profile(TargetId.C)));
    }

    @Test
    void goPrintfBecomesPrintln() {
        LanguageProfile go = profile(TargetId.GO);
        assertEquals("fmt.Println(x)", preprocessor.normalizePrintf("fmt.Printf(\"%d\\n\", x)", go));
        assertEquals(
                "fmt.Println(\"x is {x}, ok={ok}\")",
                preprocessor.normalizePrintf("fmt.Printf(\"x is %d, ok=%t\\n\", x, ok)", go));
    }

    @Test
    void simplifiesBooleanPrintHelpers() {
        assertEquals(
                "print(flag)",
                preprocessor.simplifyBoolPrint("print(str(flag).lower())", profile(TargetId.PY)));
        assertEquals(
                "std::cout << flag << std::endl;",
                preprocessor.simplifyBoolPrint(
                        "std::cout << (flag ? \"true\" : \"false\") << std::endl;", profile(TargetId.CPP)));
        assertEquals(
                "printf(\"%d\\n\", ok);",
                preprocessor.simplifyBoolPrint("printf(\"%s\\n\", ok ? \"true\" : \"false\");", profile(TargetId.C)));
    }

    @Test
    void splitsTopLevelArgumentsOnly() {
        assertEquals(
                List.of("f(a, b)", "\"x, y\"", "c"),
                TargetSourcePreprocessor.splitTopLevel("f(a, b), \"x, y\", c", ','));
    }
}
