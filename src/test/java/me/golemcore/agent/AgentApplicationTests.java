package me.golemcore.agent;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class AgentApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(AgentApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(AgentApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(AgentApplication.class.getMethod("main", String[].class));
    }
}
