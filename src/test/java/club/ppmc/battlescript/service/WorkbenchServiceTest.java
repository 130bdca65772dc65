/**
 * WorkbenchServiceTest.java
 */
package club.ppmc.battlescript.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.battlescript.model.ExecutionRequest;
import club.ppmc.battlescript.model.ReconciledRun;
import club.ppmc.battlescript.model.RunOutcome;
import club.ppmc.battlescript.model.TargetId;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

class WorkbenchServiceTest {

    private ToolchainRunnerService runner;
    private ReverseTranspilerService reverseTranspiler;
    private ObjectProvider<ScriptCompiler> compilerProvider;
    private ScriptCompiler compiler;
    private WorkbenchService workbench;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        runner = mock(ToolchainRunnerService.class);
        reverseTranspiler = mock(ReverseTranspilerService.class);
        compilerProvider = mock(ObjectProvider.class);
        compiler = mock(ScriptCompiler.class);
        workbench = new WorkbenchService(runner, reverseTranspiler, compilerProvider);
    }

    @AfterEach
    void tearDown() {
        workbench.shutdown();
    }

    @Test
    void editedSuccessfulRunIsReconciled() throws Exception {
        ExecutionRequest request = ExecutionRequest.batch(TargetId.C, "int x = 1;");
        when(runner.submit(request)).thenReturn(CompletableFuture.completedFuture(RunOutcome.ok("", 0)));
        when(reverseTranspiler.decompile("int x = 1;", TargetId.C)).thenReturn(Optional.of("~>snag{x}::val(#1)\n"));

        ReconciledRun run = workbench.runTarget(request, true).get(5, TimeUnit.SECONDS);

        assertTrue(run.reconciled());
        assertEquals("~>snag{x}::val(#1)\n", run.canonical());
    }

    @Test
    void uneditedRunIsNotReconciled() throws Exception {
        ExecutionRequest request = ExecutionRequest.batch(TargetId.C, "int x = 1;");
        when(runner.submit(request)).thenReturn(CompletableFuture.completedFuture(RunOutcome.ok("", 0)));

        ReconciledRun run = workbench.runTarget(request, false).get(5, TimeUnit.SECONDS);

        assertFalse(run.reconciled());
        verify(reverseTranspiler, never()).decompile(anyString(), any());
    }

    @Test
    void failedRunIsNotReconciled() throws Exception {
        ExecutionRequest request = ExecutionRequest.batch(TargetId.C, "int x = ;");
        RunOutcome failure = RunOutcome.compileError("Compile error", "compile", "expected expression");
        when(runner.submit(request)).thenReturn(CompletableFuture.completedFuture(failure));

        ReconciledRun run = workbench.runTarget(request, true).get(5, TimeUnit.SECONDS);

        assertEquals(failure, run.outcome());
        assertNull(run.canonical());
        verify(reverseTranspiler, never()).decompile(anyString(), any());
    }

    @Test
    void decompileAsyncDelegates() throws Exception {
        when(reverseTranspiler.decompile("x = 1", TargetId.PY)).thenReturn(Optional.of("~>snag{x}::val(#1)\n"));
        assertEquals(
                Optional.of("~>snag{x}::val(#1)\n"),
                workbench.decompileAsync("x = 1", TargetId.PY).get(5, TimeUnit.SECONDS));
    }

    @Test
    void seedingWithoutCompilerProducesNothing() {
        when(compilerProvider.getIfAvailable()).thenReturn(null);
        assertTrue(workbench.seedTargets("~>frob{7a3}::emit(#1)").isEmpty());
    }

    @Test
    void parseErrorSeedsEveryTargetWithTheMessage() {
        when(compilerProvider.getIfAvailable()).thenReturn(compiler);
        when(compiler.parse("~>oops")).thenThrow(new IllegalArgumentException("unexpected token at 1:3"));

        Map<TargetId, String> seeded = workbench.seedTargets("~>oops").orElseThrow();

        assertEquals(TargetId.values().length, seeded.size());
        seeded.values().forEach(source -> assertEquals("// Parse error: unexpected token at 1:3", source));
    }

    @Test
    void failedTranspilationUsesPlaceholder() {
        Object program = new Object();
        when(compilerProvider.getIfAvailable()).thenReturn(compiler);
        when(compiler.parse("src")).thenReturn(program);
        when(compiler.transpile(eq(program), any())).thenReturn(Optional.of("generated"));
        when(compiler.transpile(program, TargetId.ASM)).thenReturn(Optional.empty());
        when(compiler.transpile(program, TargetId.GO)).thenThrow(new IllegalStateException("boom"));

        Map<TargetId, String> seeded = workbench.seedTargets("src").orElseThrow();

        assertEquals("generated", seeded.get(TargetId.C));
        assertEquals("// Transpilation failed", seeded.get(TargetId.ASM));
        assertEquals("// Transpilation failed", seeded.get(TargetId.GO));
    }

    @Test
    void canonicalRunNeedsTheCompiler() throws Exception {
        when(compilerProvider.getIfAvailable()).thenReturn(null);

        RunOutcome outcome = workbench.runCanonical("~>frob{7a3}::emit(#1)").get(5, TimeUnit.SECONDS);

        assertEquals(RunOutcome.Kind.RUN_ERROR, outcome.kind());
        assertEquals("Run error: JibJab compiler library is not installed", outcome.text());
    }

    @Test
    void canonicalRunInterpretsTheProgram() throws Exception {
        Object program = new Object();
        when(compilerProvider.getIfAvailable()).thenReturn(compiler);
        when(compiler.parse("~>frob{7a3}::emit(#1)")).thenReturn(program);
        when(compiler.interpret(program)).thenReturn("1\n");

        RunOutcome outcome = workbench.runCanonical("~>frob{7a3}::emit(#1)").get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isOk());
        assertEquals("1", outcome.text());
    }

    @Test
    void cancelDelegatesToRunner() {
        when(runner.cancel()).thenReturn(true);
        assertTrue(workbench.cancel());
    }
}
