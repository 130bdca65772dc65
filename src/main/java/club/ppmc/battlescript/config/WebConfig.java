/**
 * WebConfig.java
 *
 * 全局 Spring Web MVC 配置：允许前端 (可能运行在其他端口) 跨域访问 /api 接口。
 */
package club.ppmc.battlescript.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*") // 与 allowCredentials 同时使用时不能写 allowedOrigins("*")
                .allowedMethods("GET", "POST")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
