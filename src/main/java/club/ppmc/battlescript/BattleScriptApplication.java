/**
 * BattleScriptApplication.java
 *
 * Spring Boot 应用的主入口类。
 */
package club.ppmc.battlescript;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BattleScriptApplication {

    public static void main(String[] args) {
        SpringApplication.run(BattleScriptApplication.class, args);
    }
}
