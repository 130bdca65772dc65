/**
 * TranspileController.java
 *
 * 用编译器库把 JibJab 源码转译到全部目标语言，作为各语言编辑器的初始内容。
 */
package club.ppmc.battlescript.controller;

import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.model.TranspileRequest;
import club.ppmc.battlescript.service.WorkbenchService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transpile")
public class TranspileController {

    private final WorkbenchService workbenchService;

    public TranspileController(WorkbenchService workbenchService) {
        this.workbenchService = workbenchService;
    }

    /**
     * @return 以目标语言 ID 为键的源码；没有安装编译器库时返回 503。
     */
    @PostMapping
    public ResponseEntity<?> transpile(@Valid @RequestBody TranspileRequest request) {
        Optional<Map<TargetId, String>> seeded = workbenchService.seedTargets(request.source());
        if (seeded.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("message", "没有安装 JibJab 编译器库。"));
        }
        var body = new LinkedHashMap<String, String>();
        seeded.get().forEach((target, source) -> body.put(target.id(), source));
        return ResponseEntity.ok(body);
    }
}
