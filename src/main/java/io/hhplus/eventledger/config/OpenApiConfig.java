package io.hhplus.eventledger.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Order Event Ledger API")
                .description("주문 생성 명령 → 이벤트 원장 기록 → Kafka 발행, 읽기 모델 조회 API 문서")
                .version("1.0.0"));
    }
}
