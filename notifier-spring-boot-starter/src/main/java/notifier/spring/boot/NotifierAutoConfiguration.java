package notifier.spring.boot;

import notifier.dispatch.NotificationDispatcher;
import notifier.ratelimit.RateLimiter;
import notifier.ratelimit.WindowRateLimiter;
import notifier.render.HtmlMessageRenderer;
import notifier.render.MessageLabels;
import notifier.render.MessageRenderer;
import notifier.spi.MessageTransport;
import notifier.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.ZoneId;
import java.util.Locale;

/**
 * Auto-configuration for the notifier.
 *
 * <p>Activates when the application declares a {@link MessageTransport} bean. Every bean
 * backs off if the application defines its own.
 *
 * @see NotifierProperties
 * @see NotifierMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(NotificationDispatcher.class)
@ConditionalOnBean(MessageTransport.class)
@EnableConfigurationProperties(NotifierProperties.class)
public class NotifierAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public MessageRenderer messageRenderer(NotifierProperties props) {
    MessageLabels labels = switch (props.getLabels()) {
      case TURKISH -> MessageLabels.TURKISH;
      case ENGLISH -> MessageLabels.ENGLISH;
    };
    return HtmlMessageRenderer.builder()
        .zoneId(ZoneId.of(props.getTimeZone()))
        .locale(Locale.forLanguageTag(props.getLocale()))
        .labels(labels)
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(RateLimiter.class)
  public WindowRateLimiter rateLimiter(NotifierProperties props) {
    WindowRateLimiter limiter = WindowRateLimiter.builder()
        .quota(props.getRateLimit())
        .window(props.getWindow())
        .build();
    limiter.start();
    return limiter;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public NotificationDispatcher notificationDispatcher(NotifierProperties props,
      MessageTransport transport,
      RateLimiter rateLimiter,
      MessageRenderer messageRenderer,
      ObjectProvider<MetricsExporter> metricsProvider) {
    String channelId = props.getChannelId();
    if (channelId == null || channelId.isBlank()) {
      throw new IllegalStateException("notifier.channel-id must be set");
    }
    return NotificationDispatcher.builder()
        .transport(transport)
        .destination(channelId)
        .rateLimiter(rateLimiter)
        .renderer(messageRenderer)
        .maxThrottleRetries(props.getMaxThrottleRetries())
        .metrics(metricsProvider.getIfAvailable())
        .build();
  }
}
