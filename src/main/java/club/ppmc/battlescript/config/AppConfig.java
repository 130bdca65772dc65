/**
 * AppConfig.java
 *
 * 应用级别的 Bean 定义。
 */
package club.ppmc.battlescript.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * WebSocket 推送使用的 Gson 实例。
     * 保留 null 字段，前端据此区分“没有反向转译结果”和空源码。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder().serializeNulls().create();
    }
}
