package com.shiprule.adapter.spring;

import com.shiprule.calculation.ShippingCostCalculator;
import com.shiprule.config.ShippingProfile;
import com.shiprule.exception.ConfigurationException;
import com.shiprule.service.CalculationDetailsSerializer;
import com.shiprule.service.InMemoryProfileRepository;
import com.shiprule.service.ProfileRepository;
import com.shiprule.service.ProfileTester;
import com.shiprule.service.ShippingCalculationService;
import com.shiprule.sweep.CalculationSweeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ShippingAutoConfiguration.
 */
class ShippingAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ShippingAutoConfiguration.class))
            .withPropertyValues("shipping.profiles-path=classpath:test-profiles.yaml");

    @Test
    @DisplayName("Should create the engine beans from the configured profile file")
    void shouldCreateEngineBeans() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertNotNull(context.getBean(ShippingCostCalculator.class));
            assertNotNull(context.getBean(ShippingCalculationService.class));
            assertNotNull(context.getBean(ProfileTester.class));
            assertNotNull(context.getBean(CalculationDetailsSerializer.class));
            assertTrue(context.getBeansOfType(CalculationSweeper.class).isEmpty());

            List<ShippingProfile> active = context.getBean(ProfileRepository.class).findActive();
            assertEquals(List.of("plugs", "trees", "fallback"), active.stream().map(ShippingProfile::id).toList());
        });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("shipping.enabled=false").run(context -> {
            assertNull(context.getStartupFailure());
            assertTrue(context.getBeansOfType(ShippingCalculationService.class).isEmpty());
        });
    }

    @Test
    @DisplayName("Should start the sweeper when enabled")
    void shouldStartSweeper() {
        contextRunner.withPropertyValues(
                        "shipping.sweep.enabled=true",
                        "shipping.sweep.interval-seconds=60",
                        "shipping.sweep.initial-delay-seconds=60")
                .run(context -> {
                    CalculationSweeper sweeper = context.getBean(CalculationSweeper.class);
                    assertTrue(sweeper.isRunning());
                    assertEquals(60, context.getBean(ShippingProperties.class).getSweep().getIntervalSeconds());
                });
    }

    @Test
    @DisplayName("Should keep a user-defined profile repository")
    void shouldKeepUserRepository() {
        InMemoryProfileRepository custom = new InMemoryProfileRepository();
        contextRunner.withBean(ProfileRepository.class, () -> custom).run(context ->
                assertSame(custom, context.getBean(ProfileRepository.class)));
    }

    @Test
    @DisplayName("Should fail to start on a missing profile file")
    void shouldFailOnMissingProfiles() {
        contextRunner.withPropertyValues("shipping.profiles-path=classpath:missing.yaml").run(context -> {
            Throwable failure = context.getStartupFailure();
            assertNotNull(failure);
            Throwable cause = failure;
            while (cause.getCause() != null && !(cause instanceof ConfigurationException)) {
                cause = cause.getCause();
            }
            assertInstanceOf(ConfigurationException.class, cause);
        });
    }
}
