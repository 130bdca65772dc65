/**
 * LanguageProfileServiceTest.java
 */
package club.ppmc.battlescript.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.battlescript.exception.EnvironmentConfigurationException;
import club.ppmc.battlescript.model.LanguageProfile;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.util.LanguageProfiles;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LanguageProfileServiceTest {

    @Test
    void builtInProfilesCoverEveryTarget() {
        var service = new LanguageProfileService();
        assertDoesNotThrow(service::verify);
        for (TargetId target : TargetId.values()) {
            assertEquals(target, service.profile(target).target());
        }
        assertFalse(service.profile(TargetId.ASM).reversible());
        assertTrue(service.profile(TargetId.APPLESCRIPT).reversible());
    }

    @Test
    void missingProfileIsAConfigurationError() {
        Map<TargetId, LanguageProfile> profiles = new EnumMap<>(LanguageProfiles.all());
        profiles.remove(TargetId.SWIFT);

        var error = assertThrows(
                EnvironmentConfigurationException.class, () -> new LanguageProfileService(profiles).verify());
        assertEquals("swift", error.getTarget());
        assertEquals("profile", error.getComponent());
    }

    @Test
    void profileRegisteredUnderTheWrongTargetIsRejected() {
        Map<TargetId, LanguageProfile> profiles = new EnumMap<>(LanguageProfiles.all());
        profiles.put(TargetId.GO, LanguageProfiles.all().get(TargetId.C));

        assertThrows(EnvironmentConfigurationException.class, () -> new LanguageProfileService(profiles).verify());
    }
}
