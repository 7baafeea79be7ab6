package org.nowstart.fundnav.repository;

import org.nowstart.fundnav.config.NavSourceFeignConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;

@FeignClient(
        name = "amfiClient",
        url = "${fundnav.sync.amfi-base-url}",
        configuration = NavSourceFeignConfig.class
)
public interface AmfiFeignClient {

    @GetMapping(value = "/spages/NAVAll.txt", produces = "text/plain")
    String getNavAll();
}
