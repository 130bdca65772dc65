/**
 * ParamStyle.java
 *
 * 描述函数形参列表中类型标注的书写位置，用于在反向转译时剥离类型、只保留参数名。
 */
package club.ppmc.battlescript.model;

public enum ParamStyle {
    /** 形参无类型 (Python, JavaScript, AppleScript)。 */
    UNTYPED,
    /** 类型在前: "int a" (C 家族)。 */
    TYPE_FIRST,
    /** 类型在冒号后: "_ a: Int" (Swift)。 */
    TYPE_AFTER_COLON,
    /** 类型在名称后: "a int" (Go)。 */
    TYPE_LAST
}
