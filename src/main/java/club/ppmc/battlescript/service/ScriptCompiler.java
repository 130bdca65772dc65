/**
 * ScriptCompiler.java
 *
 * JibJab 编译器库的接入点。词法/语法分析、解释执行和前向转译都由外部库提供，
 * 后端只通过这个接口调用它。没有安装编译器库时容器中不存在该 Bean，
 * 相关功能 (生成各目标语言源码、直接运行 JibJab) 会报告编译器不可用。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.TargetId;
import java.util.Optional;

public interface ScriptCompiler {

    /**
     * 解析 JibJab 源码。
     *
     * @return 编译器库的程序对象。
     * @throws RuntimeException 源码有语法错误时，异常消息会展示给用户。
     */
    Object parse(String source);

    /**
     * 把程序转译为目标语言源码。
     *
     * @return 目标语言源码；该程序无法转译到此目标语言时为空。
     */
    Optional<String> transpile(Object program, TargetId target);

    /** 直接解释执行程序，返回其输出。 */
    String interpret(Object program);
}
