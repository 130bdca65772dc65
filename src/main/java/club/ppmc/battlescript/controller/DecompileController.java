/**
 * DecompileController.java
 *
 * 反向转译接口：把目标语言源码还原为 JibJab 源码。
 */
package club.ppmc.battlescript.controller;

import club.ppmc.battlescript.model.DecompileRequest;
import club.ppmc.battlescript.model.DecompileResponse;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.service.WorkbenchService;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/decompile")
public class DecompileController {

    private final WorkbenchService workbenchService;

    public DecompileController(WorkbenchService workbenchService) {
        this.workbenchService = workbenchService;
    }

    @PostMapping
    public CompletableFuture<ResponseEntity<?>> decompile(@Valid @RequestBody DecompileRequest request) {
        TargetId target;
        try {
            target = TargetId.fromId(request.target());
        } catch (IllegalArgumentException e) {
            return CompletableFuture.completedFuture(
                    ResponseEntity.badRequest().body(Map.of("message", e.getMessage())));
        }
        return workbenchService.decompileAsync(request.code(), target)
                .thenApply(canonical -> ResponseEntity.ok(
                        new DecompileResponse(canonical.isPresent(), canonical.orElse(null))));
    }
}
