package me.golemcore.testinsight;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class TestInsightApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(TestInsightApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(TestInsightApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(TestInsightApplication.class.getMethod("main", String[].class));
    }
}
