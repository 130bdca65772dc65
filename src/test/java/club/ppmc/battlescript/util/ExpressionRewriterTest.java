/**
 * ExpressionRewriterTest.java
 *
 * 表达式改写的单元测试。
 */
package club.ppmc.battlescript.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import club.ppmc.battlescript.model.LanguageProfile;
import club.ppmc.battlescript.model.TargetId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ExpressionRewriterTest {

    private final ExpressionRewriter rewriter = new ExpressionRewriter();

    private static LanguageProfile profile(TargetId target) {
        return LanguageProfiles.all().get(target);
    }

    @Test
    void tagsNumbersAndReplacesArithmetic() {
        assertEquals("#1 <+> #2", rewriter.rewrite("1 + 2", profile(TargetId.C)));
        assertEquals("x <-> #1", rewriter.rewrite("x - 1", profile(TargetId.C)));
        assertEquals("#3.14", rewriter.rewrite("3.14", profile(TargetId.C)));
    }

    @Test
    void distinguishesUnaryMinusFromSubtraction() {
        assertEquals("#-5", rewriter.rewrite("-5", profile(TargetId.C)));
        assertEquals("a <*> #-3", rewriter.rewrite("a * -3", profile(TargetId.C)));
    }

    @Test
    void stripsOneLayerOfEnclosingParentheses() {
        assertEquals("a <+> b", rewriter.rewrite("(a + b)", profile(TargetId.C)));
        // 两侧括号并不互相匹配时保持原样
        assertEquals("(a) <+> (b)", rewriter.rewrite("(a) + (b)", profile(TargetId.C)));
    }

    @Test
    void replacesComparisonAndLogicalOperators() {
        assertEquals("a <=> b <&&> <!>c", rewriter.rewrite("a == b && !c", profile(TargetId.C)));
        assertEquals("a <lte> b <||> a <gte> c", rewriter.rewrite("a <= b || a >= c", profile(TargetId.C)));
        assertEquals("a <!=> b", rewriter.rewrite("a !== b", profile(TargetId.JS)));
        assertEquals("a <=> b", rewriter.rewrite("a === b", profile(TargetId.JS)));
    }

    @Test
    void replacesWordOperatorsAndLiteralsOnWordBoundaries() {
        assertEquals("x <=> ~yep <&&> <!> y", rewriter.rewrite("x == True and not y", profile(TargetId.PY)));
        assertEquals("band <+> notice", rewriter.rewrite("band + notice", profile(TargetId.PY)));
        assertEquals("~nil", rewriter.rewrite("None", profile(TargetId.PY)));
        assertEquals("~yep <&&> ~nope", rewriter.rewrite("YES && NO", profile(TargetId.OBJCPP)));
        assertEquals("~yep <||> ~nope", rewriter.rewrite("YES || NO", profile(TargetId.OBJC)));
    }

    @Test
    void replacesAppleScriptOperators() {
        LanguageProfile applescript = profile(TargetId.APPLESCRIPT);
        assertEquals("a <!=> b", rewriter.rewrite("a ≠ b", applescript));
        assertEquals("x <%> #2 <=> #0", rewriter.rewrite("x mod 2 = 0", applescript));
        assertEquals("~nil", rewriter.rewrite("missing value", applescript));
    }

    @Test
    void leavesStringContentsUntouched() {
        assertEquals("\"a + 1 == b\"", rewriter.rewrite("\"a + 1 == b\"", profile(TargetId.C)));
        assertEquals("\"n=\" <+> n", rewriter.rewrite("\"n=\" + n", profile(TargetId.JS)));
    }

    @Test
    void rewritesUserFunctionCallsOnly() {
        assertEquals("~>invoke{add}::with(#1, #2)", rewriter.rewrite("add(1, 2)", profile(TargetId.C)));
        assertEquals("sqrt(x)", rewriter.rewrite("sqrt(x)", profile(TargetId.C)));
        assertEquals("Math.max(a, b)", rewriter.rewrite("Math.max(a, b)", profile(TargetId.JS)));
        assertEquals(
                "~>invoke{f}::with(~>invoke{g}::with(#1))",
                rewriter.rewrite("f(g(1))", profile(TargetId.C)));
    }

    @Test
    void doesNotTagHexOrSuffixedLiterals() {
        assertEquals("0x1F", rewriter.rewrite("0x1F", profile(TargetId.C)));
        assertEquals("x1 <+> #2", rewriter.rewrite("x1 + 2", profile(TargetId.C)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1 + 2", "a == b && !c", "add(1, 2)", "-5", "x - 1", "\"s\" + f(x)"})
    void rewritingIsIdempotent(String expr) {
        LanguageProfile c = profile(TargetId.C);
        String once = rewriter.rewrite(expr, c);
        assertEquals(once, rewriter.rewrite(once, c));
    }

    @Test
    void nullBecomesEmpty() {
        assertEquals("", rewriter.rewrite(null, profile(TargetId.C)));
    }
}
