/**
 * DecompileControllerTest.java
 */
package club.ppmc.battlescript.controller;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.service.WorkbenchService;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DecompileControllerTest {

    private WorkbenchService workbench;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        workbench = mock(WorkbenchService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DecompileController(workbench)).build();
    }

    @Test
    void returnsCanonicalSource() throws Exception {
        when(workbench.decompileAsync("print(1)", TargetId.PY))
                .thenReturn(CompletableFuture.completedFuture(Optional.of("~>frob{7a3}::emit(#1)\n")));

        MvcResult pending = mockMvc.perform(post("/api/decompile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"py\",\"code\":\"print(1)\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.produced").value(true))
                .andExpect(jsonPath("$.canonical").value("~>frob{7a3}::emit(#1)\n"));
    }

    @Test
    void reportsNothingProduced() throws Exception {
        when(workbench.decompileAsync("", TargetId.ASM))
                .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        MvcResult pending = mockMvc.perform(post("/api/decompile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"asm\",\"code\":\"\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.produced").value(false));
    }

    @Test
    void unknownTargetIsABadRequest() throws Exception {
        MvcResult pending = mockMvc.perform(post("/api/decompile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target\":\"rust\",\"code\":\"fn main() {}\"}"))
                .andReturn();

        mockMvc.perform(asyncDispatch(pending)).andExpect(status().isBadRequest());
        verifyNoInteractions(workbench);
    }
}
