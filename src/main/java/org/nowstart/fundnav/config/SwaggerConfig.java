package org.nowstart.fundnav.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.fundnav.data.property.NavSyncProperties;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    public static final String NAV_SYNC_TAG = "NAV Sync";

    private final BuildProperties buildProperties;
    private final NavSyncProperties navSyncProperties;

    @Bean
    public OpenAPI fundNavOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("fundnav API")
                        .description("펀드 NAV 동기화 및 수익률 재계산 API 문서입니다. 기본 수집 모드: "
                                + navSyncProperties.sourceMode())
                        .version(buildProperties.getVersion()))
                .tags(List.of(new Tag()
                        .name(NAV_SYNC_TAG)
                        .description("NAV 수집 실행(/runs), 진행 상태 조회 및 중지(/runs/current), 수익률 재계산(/returns/recompute)")))
                .externalDocs(new ExternalDocumentation()
                        .description("AMFI 일별 NAV 공시 파일")
                        .url(navSyncProperties.amfiBaseUrl() + "/spages/NAVAll.txt"));
    }
}
