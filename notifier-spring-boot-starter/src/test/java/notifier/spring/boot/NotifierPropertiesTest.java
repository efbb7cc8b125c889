package notifier.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotifierPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(NotifierProperties.class);
            assertNull(props.getChannelId());
            assertEquals(20, props.getRateLimit());
            assertEquals(Duration.ofMinutes(1), props.getWindow());
            assertEquals("Europe/Istanbul", props.getTimeZone());
            assertEquals("tr-TR", props.getLocale());
            assertEquals(NotifierProperties.Labels.TURKISH, props.getLabels());
            assertEquals(5, props.getMaxThrottleRetries());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("notifier", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "notifier.channel-id=@visa_slots",
                "notifier.rate-limit=30",
                "notifier.window=PT30S",
                "notifier.time-zone=Europe/Berlin",
                "notifier.locale=de-DE",
                "notifier.labels=ENGLISH",
                "notifier.max-throttle-retries=2",
                "notifier.metrics.enabled=false",
                "notifier.metrics.name-prefix=visa.notifier"
        ).run(ctx -> {
            var props = ctx.getBean(NotifierProperties.class);
            assertEquals("@visa_slots", props.getChannelId());
            assertEquals(30, props.getRateLimit());
            assertEquals(Duration.ofSeconds(30), props.getWindow());
            assertEquals("Europe/Berlin", props.getTimeZone());
            assertEquals("de-DE", props.getLocale());
            assertEquals(NotifierProperties.Labels.ENGLISH, props.getLabels());
            assertEquals(2, props.getMaxThrottleRetries());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("visa.notifier", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(NotifierProperties.class)
    static class PropsConfig {
    }
}
