package me.golemcore.krishi;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class KrishiMitraApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(KrishiMitraApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(KrishiMitraApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
        assertNotNull(KrishiMitraApplication.class.getAnnotation(EnableScheduling.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(KrishiMitraApplication.class.getMethod("main", String[].class));
    }
}
