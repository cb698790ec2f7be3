package com.example.scenariogen.service;

import com.example.scenariogen.model.TestType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TestTypeClassifier}.
 */
class TestTypeClassifierTest {

    private final TestTypeClassifier classifier = new TestTypeClassifier();

    @Test
    @DisplayName("plain business flow is functional")
    void functionalByDefault() {
        assertEquals(TestType.FUNCTIONAL, classifier.classify(
                "Add item to shopping cart", "Customer adds a product to the cart and sees the updated total."));
    }

    @Test
    @DisplayName("permission wording is security")
    void security() {
        assertEquals(TestType.SECURITY, classifier.classify(
                "Reject access without permission", "A clerk opens the payroll page."));
    }

    @Test
    @DisplayName("response time wording is performance")
    void performance() {
        assertEquals(TestType.PERFORMANCE, classifier.classify(
                "Checkout under peak traffic", "Measure response time with 500 concurrent shoppers."));
    }

    @Test
    @DisplayName("user experience wording is usability")
    void usability() {
        assertEquals(TestType.USABILITY, classifier.classify(
                "Checkout user experience", "New shoppers complete checkout without help."));
    }

    @Test
    @DisplayName("webhook wording is integration")
    void integration() {
        assertEquals(TestType.INTEGRATION, classifier.classify(
                "Order webhook delivery", "Orders are pushed to the shipping webhook."));
    }

    @Test
    @DisplayName("security wins over performance and integration")
    void securityHasPrecedence() {
        assertEquals(TestType.SECURITY, classifier.classify(
                "Load test of the login API", "Authentication stays correct under stress."));
    }

    @Test
    @DisplayName("performance wins over integration")
    void performanceBeatsIntegration() {
        assertEquals(TestType.PERFORMANCE, classifier.classify(
                "API latency", "Response time stays under two seconds under load."));
    }

    @Test
    @DisplayName("usability wins over integration")
    void usabilityBeatsIntegration() {
        assertEquals(TestType.USABILITY, classifier.classify(
                "Dashboard UI", "Renders the webhook status."));
    }

    @Test
    @DisplayName("classification is case-insensitive, null-safe and repeatable")
    void deterministic() {
        assertEquals(TestType.SECURITY, classifier.classify("SECURITY review", null));
        assertEquals(TestType.FUNCTIONAL, classifier.classify(null, null));
        TestType first = classifier.classify("Order webhook delivery", "Pushed to shipping.");
        for (int i = 0; i < 5; i++) {
            assertEquals(first, classifier.classify("Order webhook delivery", "Pushed to shipping."));
        }
    }
}
