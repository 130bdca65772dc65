/**
 * TestSettings.java
 *
 * 测试用的 SettingsService 构造工具：设置文件和临时目录都放在 JUnit 的临时目录下。
 */
package club.ppmc.battlescript.service;

import java.nio.file.Path;

final class TestSettings {

    private TestSettings() {}

    static SettingsService create(Path root, long inputPollMillis) {
        var settingsService = new SettingsService(
                root.resolve("conf").toString(),
                root.resolve("scratch").toString(),
                inputPollMillis,
                500,
                new String[0]);
        settingsService.init();
        return settingsService;
    }
}
