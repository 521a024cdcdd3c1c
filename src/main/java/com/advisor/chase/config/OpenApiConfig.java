package com.advisor.chase.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI chaseOrchestratorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Chase Orchestrator API")
                        .version("1.0.0")
                        .description(
                                "Automated chasing of outstanding documents and Letters of Authority (LOAs) " +
                                "on behalf of financial advisors.\n\n" +
                                "**Chase lifecycle:**\n" +
                                "CREATED → PENDING → SENT → AWAITING_RESPONSE → OVERDUE → ESCALATED → " +
                                "AWAITING_RESPONSE ... until RECEIVED, COMPLETED or FAILED.\n\n" +
                                "**Each scheduler tick:**\n" +
                                "1. Select due items (overdue/escalated first, then priority, risk, due time)\n" +
                                "2. Lease each item exclusively\n" +
                                "3. Predict delay risk from the provider's learned response profile\n" +
                                "4. Apply the escalation policy: backoff delay, tone (FRIENDLY → GENTLE → URGENT), " +
                                "channel (EMAIL → SMS → PHONE)\n" +
                                "5. Let the Document or LOA chaser decide the action and dispatch it\n" +
                                "6. Commit the transition and its activity atomically, publish the event\n\n" +
                                "**Live activity:** `GET /api/v1/activity/stream` (Server-Sent Events)")
                        .contact(new Contact().name("Chase Orchestration Team")));
    }
}
