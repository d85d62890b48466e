package com.retrygate.autoconfig;

import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.retrygate.core.spi.PolicyStore;
import com.retrygate.core.spi.RetryCounterStore;
import com.retrygate.core.store.MybatisPolicyStore;
import com.retrygate.core.store.MybatisRetryCounterStore;
import com.retrygate.mapper.RetryAttemptMapper;
import com.retrygate.mapper.SystemSettingMapper;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

@AutoConfiguration(
        after = RetryTxAutoConfiguration.class,
        afterName = {
                "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
                "com.baomidou.mybatisplus.autoconfigure.MybatisPlusAutoConfiguration"
        })
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean(DataSource.class)
@MapperScan(basePackages = "com.retrygate.mapper")
public class RetryGateMybatisAutoConfiguration {

    /**
     * system_settings 表
     */
    @Bean
    @ConditionalOnMissingBean(PolicyStore.class)
    public PolicyStore mybatisPolicyStore(SystemSettingMapper mapper, TransactionTemplate tt) {
        return new MybatisPolicyStore(mapper, tt);
    }

    /**
     * media_file.retry_attempts 列
     */
    @Bean
    @ConditionalOnMissingBean(RetryCounterStore.class)
    public RetryCounterStore mybatisRetryCounterStore(RetryAttemptMapper mapper) {
        return new MybatisRetryCounterStore(mapper);
    }
}
