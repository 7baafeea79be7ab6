package org.nowstart.fundnav.config;

import feign.RequestInterceptor;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.nowstart.fundnav.service.source.NavSourceRequestInterceptor;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NavSourceFeignConfig {

    @Bean
    @RefreshScope
    public RequestInterceptor navSourceRequestInterceptor(NavSyncProperties navSyncProperties) {
        return new NavSourceRequestInterceptor(navSyncProperties.userAgent());
    }
}
