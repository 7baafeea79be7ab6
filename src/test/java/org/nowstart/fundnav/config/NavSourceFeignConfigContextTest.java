package org.nowstart.fundnav.config;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import org.junit.jupiter.api.Test;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.nowstart.fundnav.data.property.NavSyncPropertiesFixture;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.cloud.autoconfigure.RefreshAutoConfiguration;
import org.springframework.cloud.context.scope.refresh.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class NavSourceFeignConfigContextTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(RefreshScopeTestConfig.class, NavSourceFeignConfig.class, NavSyncPropsTestConfig.class)
            .withConfiguration(AutoConfigurations.of(RefreshAutoConfiguration.class));

    @Test
    void contextLoadsWithRefreshScopedInterceptor() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            RequestInterceptor interceptor = context.getBean("navSourceRequestInterceptor", RequestInterceptor.class);

            RequestTemplate template = new RequestTemplate();
            interceptor.apply(template);

            assertThat(template.headers().get("User-Agent")).containsExactly("fundnav-test/1.0");
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class RefreshScopeTestConfig {

        @Bean
        RefreshScope refreshScope() {
            return new RefreshScope();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class NavSyncPropsTestConfig {

        @Bean
        NavSyncProperties navSyncProperties() {
            return NavSyncPropertiesFixture.defaults();
        }
    }
}
