package com.shiprule.config;

import com.shiprule.cost.ConditionalCostRule;
import com.shiprule.cost.FixedCostRule;
import com.shiprule.cost.PerItemCostRule;
import com.shiprule.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ProfileLoader.
 */
class ProfileLoaderTest {

    @Test
    @DisplayName("Should load profiles from the classpath")
    void shouldLoadFromClasspath() {
        List<ShippingProfile> profiles = ProfileLoader.load("classpath:test-profiles.yaml");

        assertEquals(List.of("plugs", "trees", "tiered", "fallback"),
                profiles.stream().map(ShippingProfile::id).toList());

        ShippingProfile plugs = profiles.get(0);
        assertEquals(10, plugs.priority());
        assertEquals("2 plug", plugs.matchConditions().value());
        assertEquals(new FixedCostRule(12.0), plugs.costRule());

        assertEquals(new PerItemCostRule(15.0), profiles.get(1).costRule());
        assertFalse(profiles.get(2).active());
        assertInstanceOf(ConditionalCostRule.class, profiles.get(2).costRule());

        ShippingProfile fallback = profiles.get(3);
        assertTrue(fallback.defaultProfile());
        assertEquals(ShippingProfile.DEFAULT_PRIORITY, fallback.priority());
    }

    @Test
    @DisplayName("Should load the bundled application profiles")
    void shouldLoadBundledProfiles() {
        List<ShippingProfile> profiles = ProfileLoader.load("classpath:shipping-profiles.yaml");

        assertFalse(profiles.isEmpty());
        assertEquals(1, profiles.stream().filter(p -> p.active() && p.defaultProfile()).count());
    }

    @Test
    @DisplayName("Should read profiles under a shipping section")
    void shouldReadShippingSection() {
        String yaml = """
                shipping:
                  profiles:
                    - id: only
                      cost_rules:
                        type: fixed
                        base_cost: 1
                """;

        List<ShippingProfile> profiles = ProfileLoader.parseYaml(stream(yaml));

        assertEquals(1, profiles.size());
        assertEquals("only", profiles.get(0).name());
    }

    @Test
    @DisplayName("Should reject duplicate profile ids")
    void shouldRejectDuplicateIds() {
        String yaml = """
                profiles:
                  - id: same
                  - id: same
                """;

        assertThrows(ConfigurationException.class, () -> ProfileLoader.parseYaml(stream(yaml)));
    }

    @Test
    @DisplayName("Should reject empty and malformed files")
    void shouldRejectMalformedFiles() {
        assertThrows(ConfigurationException.class, () -> ProfileLoader.parseYaml(stream("")));
        assertThrows(ConfigurationException.class, () -> ProfileLoader.parseYaml(stream("- a\n- b\n")));
        assertThrows(ConfigurationException.class, () -> ProfileLoader.parseYaml(stream("profiles: nope\n")));
    }

    @Test
    @DisplayName("Should allow a file without profiles")
    void shouldAllowNoProfiles() {
        assertTrue(ProfileLoader.parseYaml(stream("profiles: []\n")).isEmpty());
    }

    @Test
    @DisplayName("Should fail on a missing file")
    void shouldFailOnMissingFile() {
        assertThrows(ConfigurationException.class, () -> ProfileLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ProfileLoader.load("/no/such/profiles.yaml"));
    }

    private static InputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
