package org.nowstart.fundnav.service.source;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestTemplate;
import org.junit.jupiter.api.Test;

class NavSourceRequestInterceptorTest {

    private final NavSourceRequestInterceptor interceptor = new NavSourceRequestInterceptor("fundnav-sync/1.0");

    @Test
    void apply_setsUserAgentAndDefaultAccept() {
        RequestTemplate template = new RequestTemplate();
        template.method("GET");
        template.uri("/mf/119551");

        interceptor.apply(template);

        assertThat(template.headers().get("User-Agent")).containsExactly("fundnav-sync/1.0");
        assertThat(template.headers().get("Accept")).containsExactly("application/json");
    }

    @Test
    void apply_keepsAcceptDeclaredByClient() {
        RequestTemplate template = new RequestTemplate();
        template.method("GET");
        template.uri("/spages/NAVAll.txt");
        template.header("Accept", "text/plain");

        interceptor.apply(template);

        assertThat(template.headers().get("Accept")).containsExactly("text/plain");
    }
}
