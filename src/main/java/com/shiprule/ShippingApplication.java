package com.shiprule;

import com.shiprule.calculation.BreakdownEntry;
import com.shiprule.calculation.CalculationResult;
import com.shiprule.config.ShippingProfile;
import com.shiprule.core.LineItem;
import com.shiprule.core.Order;
import com.shiprule.service.CalculationDetailsSerializer;
import com.shiprule.service.InMemoryOrderRepository;
import com.shiprule.service.OrderRepository;
import com.shiprule.service.ProfileRepository;
import com.shiprule.service.ProfileTestResult;
import com.shiprule.service.ProfileTester;
import com.shiprule.service.ShippingCalculationService;
import com.shiprule.spring.EnableShippingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application demonstrating the shipping engine.
 */
@SpringBootApplication
@EnableShippingEngine
public class ShippingApplication {

    private static final Logger log = LoggerFactory.getLogger(ShippingApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ShippingApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(OrderRepository orderRepository,
                                  ProfileRepository profileRepository,
                                  ShippingCalculationService calculationService,
                                  ProfileTester profileTester,
                                  CalculationDetailsSerializer serializer) {
        return args -> {
            log.info("=== Shipping Demo Started ===");
            log.info("Active profiles: {}", profileRepository.findActive().size());

            if (orderRepository instanceof InMemoryOrderRepository demoOrders) {
                demoOrders.save(
                        new Order("demo-1001", 1001L, 130.0, 142.0, 12.0, "USD",
                                "customer@example.com", "paid", null),
                        List.of(
                                LineItem.of("Smart Plug Mini", 2, 25.0, 50.0),
                                LineItem.of("Outdoor Camera", 1, 80.0, 80.0)));
            }

            CalculationResult result = calculationService.calculate("demo-1001");
            log.info("Order {} estimated shipping cost: {}", result.orderId(), result.totalCost());
            for (BreakdownEntry entry : result.breakdown()) {
                log.info("  {} -> {} (items: {})", entry.profileName(), entry.cost(), entry.items());
            }
            log.info("Calculation details: {}", serializer.toJson(result));

            List<ShippingProfile> profiles = profileRepository.findActive();
            if (!profiles.isEmpty()) {
                String testData = """
                    {
                        "product_title": "Smart Plug Mini",
                        "group_subtotal": 50.0,
                        "quantity": 2
                    }
                    """;
                ProfileTestResult dryRun = profileTester.test(profiles.get(0), testData);
                log.info("Dry run of '{}': matched={}, cost={}",
                        profiles.get(0).name(), dryRun.matched(), dryRun.calculatedCost());
            }

            log.info("=== Shipping Demo Completed ===");
        };
    }
}
