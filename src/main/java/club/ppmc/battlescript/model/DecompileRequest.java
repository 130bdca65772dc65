/**
 * DecompileRequest.java
 *
 * 反向转译接口的请求体。
 */
package club.ppmc.battlescript.model;

import jakarta.validation.constraints.NotBlank;

public record DecompileRequest(@NotBlank String target, String code) {}
