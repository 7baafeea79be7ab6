package org.nowstart.fundnav.service.source;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.util.Collection;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class NavSourceRequestInterceptor implements RequestInterceptor {

    private static final String DEFAULT_ACCEPT = "application/json";

    private final String userAgent;

    @Override
    public void apply(RequestTemplate template) {
        template.header("User-Agent", userAgent);
        if (isMissing(template.headers().get("Accept"))) {
            template.header("Accept", DEFAULT_ACCEPT);
        }
    }

    private boolean isMissing(Collection<String> values) {
        return values == null || values.isEmpty();
    }
}
