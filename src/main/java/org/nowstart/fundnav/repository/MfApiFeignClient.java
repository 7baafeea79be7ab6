package org.nowstart.fundnav.repository;

import org.nowstart.fundnav.config.NavSourceFeignConfig;
import org.nowstart.fundnav.data.dto.MfApiSchemeResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@FeignClient(
        name = "mfApiClient",
        url = "${fundnav.sync.mf-api-base-url}",
        configuration = NavSourceFeignConfig.class
)
public interface MfApiFeignClient {

    @GetMapping("/mf/{schemeCode}")
    MfApiSchemeResponse getScheme(@PathVariable("schemeCode") String schemeCode);
}
