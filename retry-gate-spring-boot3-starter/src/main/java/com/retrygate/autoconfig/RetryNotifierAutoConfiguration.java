package com.retrygate.autoconfig;

import com.retrygate.config.RetryNotifierProperties;
import com.retrygate.core.metric.RetryGateMetrics;
import com.retrygate.core.notify.AsyncNotifyingService;
import com.retrygate.core.notify.NotifyingFacade;
import com.retrygate.core.notify.notifier.LoggingNotifier;
import com.retrygate.core.notify.ratelimit.RateLimitFilter;
import com.retrygate.core.notify.route.SimpleRouter;
import com.retrygate.core.spi.notify.Notifier;
import com.retrygate.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@AutoConfiguration(after = RetryGateMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RetryNotifierProperties.class)
public class RetryNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers) {
        return new SimpleRouter(notifiers.orderedStream().toList());
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "retry.gate.notify", name = "enabled", havingValue = "true")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       RetryGateMetrics metrics,
                                                       RetryNotifierProperties props) {
        RetryNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "retry-gate-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                // 队列满时丢弃, 通知不反压准入路径
                new ThreadPoolExecutor.AbortPolicy());
        RateLimitFilter filter = new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
        return new AsyncNotifyingService(exec, router, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
