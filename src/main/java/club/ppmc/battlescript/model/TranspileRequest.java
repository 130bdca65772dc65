/**
 * TranspileRequest.java
 *
 * 把 JibJab 源码转译到全部目标语言的请求体。
 */
package club.ppmc.battlescript.model;

import jakarta.validation.constraints.NotNull;

public record TranspileRequest(@NotNull String source) {}
