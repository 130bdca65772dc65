/**
 * DecompileResponse.java
 *
 * 反向转译接口的响应体。produced 为 false 时 canonical 为 null。
 */
package club.ppmc.battlescript.model;

public record DecompileResponse(boolean produced, String canonical) {}
