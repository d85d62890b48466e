package com.retrygate.autoconfig;

import com.retrygate.config.RetryGateProperties;
import com.retrygate.core.RetryGateEngine;
import com.retrygate.core.admin.RetryAdminOperations;
import com.retrygate.core.counter.RetryCounter;
import com.retrygate.core.decision.AdmissionDecider;
import com.retrygate.core.metric.RetryGateMetrics;
import com.retrygate.core.notify.NotifyingFacade;
import com.retrygate.core.policy.RetryPolicy;
import com.retrygate.core.spi.PolicyStore;
import com.retrygate.core.spi.RetryCounterStore;
import com.retrygate.core.store.InMemoryPolicyStore;
import com.retrygate.core.store.InMemoryRetryCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.UUID;

/**
 * 闸门核心组件
 * 未提供 DataSource 时回落到内存存储
 */
@AutoConfiguration(after = {
        RetryGateMybatisAutoConfiguration.class,
        RetryGateMetricsAutoConfiguration.class,
        RetryNotifierAutoConfiguration.class
})
@EnableConfigurationProperties(RetryGateProperties.class)
public class RetryGateAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RetryGateAutoConfiguration.class);

    /**
     * 内存配置存储
     */
    @Bean
    @ConditionalOnMissingBean(PolicyStore.class)
    public PolicyStore policyStore() {
        log.warn("[Retry-Gate] no PolicyStore available, policy changes will not survive a restart");
        return new InMemoryPolicyStore();
    }

    /**
     * 内存计数存储
     */
    @Bean
    @ConditionalOnMissingBean(RetryCounterStore.class)
    public RetryCounterStore retryCounterStore() {
        log.warn("[Retry-Gate] no RetryCounterStore available, using in-memory counters");
        return new InMemoryRetryCounterStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(PolicyStore policyStore, RetryGateProperties props) {
        return new RetryPolicy(policyStore, props.getPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryCounter retryCounter(RetryCounterStore retryCounterStore) {
        return new RetryCounter(retryCounterStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public AdmissionDecider admissionDecider() {
        return new AdmissionDecider();
    }

    /**
     * 准入入口
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryGateEngine retryGateEngine(RetryPolicy retryPolicy,
                                           RetryCounter retryCounter,
                                           AdmissionDecider admissionDecider,
                                           RetryGateMetrics meter,
                                           NotifyingFacade notifyingFacade,
                                           Environment env) {
        return new RetryGateEngine(retryPolicy, retryCounter, admissionDecider, meter, notifyingFacade, nodeId(env));
    }

    /**
     * 管理端操作
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryAdminOperations retryAdminOperations(RetryPolicy retryPolicy,
                                                     RetryCounter retryCounter,
                                                     AdmissionDecider admissionDecider,
                                                     RetryGateMetrics meter,
                                                     NotifyingFacade notifyingFacade,
                                                     Environment env) {
        return new RetryAdminOperations(retryPolicy, retryCounter, admissionDecider, meter, notifyingFacade, nodeId(env));
    }

    private static String nodeId(Environment env) {
        return env.getProperty("spring.application.name", "retry-gate") + "-" + UUID.randomUUID();
    }
}
