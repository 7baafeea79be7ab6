package org.nowstart.fundnav.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.nowstart.fundnav.data.property.NavSyncPropertiesFixture;
import org.springframework.boot.info.BuildProperties;

class SwaggerConfigTest {

    @Test
    void fundNavOpenAPI_describesNavSyncEndpointsAndSource() {
        Properties properties = new Properties();
        properties.setProperty("version", "0.0.1-test");
        SwaggerConfig config = new SwaggerConfig(new BuildProperties(properties), NavSyncPropertiesFixture.defaults());

        OpenAPI openApi = config.fundNavOpenAPI();

        assertThat(openApi.getInfo().getTitle()).isEqualTo("fundnav API");
        assertThat(openApi.getInfo().getVersion()).isEqualTo("0.0.1-test");
        assertThat(openApi.getInfo().getDescription()).endsWith("PER_SCHEME");
        assertThat(openApi.getTags()).extracting(Tag::getName).containsExactly(SwaggerConfig.NAV_SYNC_TAG);
        assertThat(openApi.getTags().get(0).getDescription()).contains("/runs", "/returns/recompute");
        assertThat(openApi.getExternalDocs().getUrl()).endsWith("/spages/NAVAll.txt");
    }
}
