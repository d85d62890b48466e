package com.retrygate.autoconfig;

import com.retrygate.core.metric.RetryGateMeterRegistryProvider;
import com.retrygate.core.metric.RetryGateMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
public class RetryGateMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryGateMeterRegistryProvider retryGateMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RetryGateMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryGateMetrics retryGateMetrics(RetryGateMeterRegistryProvider provider) {
        return RetryGateMetrics.create(provider.getRegistry());
    }
}
