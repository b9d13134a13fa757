package com.bank.aml.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI amlTribunalOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("AML Tribunal API")
                        .version("1.0.0")
                        .description(
                                "Staged money-laundering screening for financial transactions.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Submit transaction and account history via `POST /api/v1/pipeline/evaluate`\n" +
                                "2. Statistical gate: peer-group deviation score (0-10). Score <= 3.0 is **APPROVE**\n" +
                                "3. Narrative gate: coherence with history (0-1). Score >= 0.7 is **APPROVE**\n" +
                                "4. Adjudication: typology detection, risk factors, regulatory retrieval and " +
                                "language-model reasoning produce **BLOCK**, **REVIEW** or **APPROVE**\n" +
                                "5. BLOCK and REVIEW verdicts carry a draft Suspicious Activity Report\n\n" +
                                "**Typologies:** Structuring, Smurfing, Layering, Shell Company Activity, " +
                                "Trade-Based Money Laundering\n\n" +
                                "**Errors:** 400 invalid input, 503 collaborator unavailable, 504 deadline exceeded")
                        .contact(new Contact().name("Financial Crime Engineering")));
    }
}
