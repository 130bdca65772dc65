/**
 * LanguageProfileService.java
 *
 * 目标语言配置的注册表。启动时检查每个目标语言都有配置，缺失即视为配置错误并阻止应用启动。
 * 之后只提供只读查询。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.exception.EnvironmentConfigurationException;
import club.ppmc.battlescript.model.LanguageProfile;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.util.LanguageProfiles;
import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LanguageProfileService {

    private final Map<TargetId, LanguageProfile> profiles;

    public LanguageProfileService() {
        this(LanguageProfiles.all());
    }

    LanguageProfileService(Map<TargetId, LanguageProfile> profiles) {
        this.profiles = profiles.isEmpty() ? new EnumMap<>(TargetId.class) : new EnumMap<>(profiles);
    }

    @PostConstruct
    public void verify() {
        for (TargetId target : TargetId.values()) {
            LanguageProfile profile = profiles.get(target);
            if (profile == null) {
                throw new EnvironmentConfigurationException(
                        "目标语言 " + target.id() + " 缺少语言配置。", "profile", target.id());
            }
            if (profile.target() != target) {
                throw new EnvironmentConfigurationException(
                        "目标语言 " + target.id() + " 的配置登记在了错误的位置: " + profile.target(),
                        "profile", target.id());
            }
        }
        log.info("已加载 {} 种目标语言的配置。", profiles.size());
    }

    /**
     * @param target 目标语言。
     * @return 该目标语言的配置，启动检查保证一定存在。
     */
    public LanguageProfile profile(TargetId target) {
        return profiles.get(target);
    }
}
