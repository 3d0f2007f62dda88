package com.shiprule.adapter.spring;

import com.shiprule.calculation.DefaultShippingCostCalculator;
import com.shiprule.calculation.ShippingCostCalculator;
import com.shiprule.condition.ConditionEvaluator;
import com.shiprule.condition.DefaultConditionEvaluator;
import com.shiprule.config.ProfileLoader;
import com.shiprule.config.ShippingProfile;
import com.shiprule.cost.CostRuleEvaluator;
import com.shiprule.cost.DefaultCostRuleEvaluator;
import com.shiprule.expression.SafeExpressionEvaluator;
import com.shiprule.resolver.DefaultProfileResolver;
import com.shiprule.resolver.ProfileResolver;
import com.shiprule.service.CalculationDetailsSerializer;
import com.shiprule.service.InMemoryOrderRepository;
import com.shiprule.service.InMemoryProfileRepository;
import com.shiprule.service.OrderRepository;
import com.shiprule.service.ProfileRepository;
import com.shiprule.service.ProfileTester;
import com.shiprule.service.ShippingCalculationService;
import com.shiprule.sweep.CalculationSweeper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Spring Boot auto-configuration for the shipping engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "shipping", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ShippingProperties.class)
public class ShippingAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ShippingAutoConfiguration.class);

    private CalculationSweeper sweeper;

    @Bean
    @ConditionalOnMissingBean
    public ProfileRepository profileRepository(ShippingProperties properties) {
        log.info("Loading shipping profiles from: {}", properties.getProfilesPath());
        List<ShippingProfile> profiles = ProfileLoader.load(properties.getProfilesPath());
        return new InMemoryProfileRepository(profiles);
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderRepository orderRepository() {
        return new InMemoryOrderRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator conditionEvaluator() {
        return new DefaultConditionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SafeExpressionEvaluator safeExpressionEvaluator() {
        return new SafeExpressionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public CostRuleEvaluator costRuleEvaluator(SafeExpressionEvaluator expressionEvaluator) {
        return new DefaultCostRuleEvaluator(expressionEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProfileResolver profileResolver(ConditionEvaluator conditionEvaluator) {
        return new DefaultProfileResolver(conditionEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ShippingCostCalculator shippingCostCalculator(ProfileResolver profileResolver,
                                                         CostRuleEvaluator costRuleEvaluator) {
        return new DefaultShippingCostCalculator(profileResolver, costRuleEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ShippingCalculationService shippingCalculationService(OrderRepository orderRepository,
                                                                 ProfileRepository profileRepository,
                                                                 ShippingCostCalculator calculator) {
        return new ShippingCalculationService(orderRepository, profileRepository, calculator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProfileTester profileTester(ConditionEvaluator conditionEvaluator, CostRuleEvaluator costRuleEvaluator) {
        return new ProfileTester(conditionEvaluator, costRuleEvaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public CalculationDetailsSerializer calculationDetailsSerializer() {
        return new CalculationDetailsSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "shipping.sweep", name = "enabled", havingValue = "true")
    public CalculationSweeper calculationSweeper(ShippingProperties properties,
                                                 OrderRepository orderRepository,
                                                 ShippingCalculationService calculationService) {
        ShippingProperties.Sweep sweep = properties.getSweep();
        log.info("Creating CalculationSweeper (interval {}s)", sweep.getIntervalSeconds());
        this.sweeper = new CalculationSweeper(orderRepository, calculationService,
                Duration.ofSeconds(sweep.getInitialDelaySeconds()),
                Duration.ofSeconds(sweep.getIntervalSeconds()));
        this.sweeper.start();
        return this.sweeper;
    }

    @PreDestroy
    public void shutdown() {
        if (sweeper != null && sweeper.isRunning()) {
            log.info("Shutting down CalculationSweeper");
            sweeper.stop();
        }
    }
}
