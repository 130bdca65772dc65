/**
 * RunRequest.java
 *
 * 运行接口的请求体。
 */
package club.ppmc.battlescript.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param target 目标语言标识，或 "jj" 表示直接解释 JibJab 源码。
 * @param source 源码。
 * @param edited 源码是否被用户修改过，修改过的源码在运行成功后会被反向转译。
 */
public record RunRequest(@NotBlank String target, String source, boolean edited) {}
