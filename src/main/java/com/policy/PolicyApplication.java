package com.policy;

import com.policy.context.EvaluationContextFactory;
import com.policy.context.UserInfo;
import com.policy.field.AllowedFields;
import com.policy.field.FieldFilter;
import com.policy.policy.AccessDecision;
import com.policy.policy.AccessRequest;
import com.policy.policy.Action;
import com.policy.policy.PolicyEngine;
import com.policy.spring.EnablePolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating policy engine usage.
 */
@SpringBootApplication
@EnablePolicyEngine
public class PolicyApplication {

    private static final Logger log = LoggerFactory.getLogger(PolicyApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PolicyApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(PolicyEngine policyEngine) {
        return args -> {
            log.info("=== Policy Demo Started ===");

            UserInfo alice = new UserInfo("user-123", List.of("user"));
            UserInfo admin = new UserInfo("admin-1", List.of("admin"));
            UserInfo anonymous = UserInfo.anonymous();

            String privateTrack = """
                {
                    "id": "t-1",
                    "title": "Demo",
                    "artist": "Alice",
                    "isPublic": false,
                    "uploadedBy": "user-123",
                    "storageKey": "s3://bucket/t-1.mp3"
                }
                """;
            Map<String, Object> track = EvaluationContextFactory.parseJson(privateTrack);

            // Owner, stranger and admin asking for the same private track
            for (UserInfo user : List.of(alice, anonymous, admin)) {
                AccessDecision decision = policyEngine.evaluate(
                        new AccessRequest("Track", Action.READ, user, track));
                log.info("read Track t-1 as '{}': allowed={}", user.id(), decision.isAllowed());
                if (decision.isAllowed()) {
                    log.info("  visible fields: {}",
                            FieldFilter.filterReadable(track, decision.getAllowedFields()).keySet());
                }
            }

            // Query-level filter pushed to storage
            log.info("Track list filter for '{}': {}", alice.id(),
                    policyEngine.applyRowFilters("Track", Action.READ, alice, Map.of("artist", "Alice")).toMap());
            log.info("Track list filter for anonymous: {}",
                    policyEngine.applyRowFilters("Track", Action.READ, anonymous, null).toMap());

            // Write payload with a smuggled field
            Map<String, Object> payload = Map.of("title", "Renamed", "uploadedBy", "someone-else");
            AllowedFields writable = policyEngine.getAllowedFields("Track", Action.UPDATE, alice);
            log.info("update payload {} reduced to {}", payload.keySet(),
                    FieldFilter.filterWritable(payload, writable).keySet());

            log.info("delete Track as '{}': {}", alice.id(),
                    policyEngine.checkAccess(new AccessRequest("Track", Action.DELETE, alice, track)));
            log.info("delete Track as '{}': {}", admin.id(),
                    policyEngine.checkAccess(new AccessRequest("Track", Action.DELETE, admin, track)));

            log.info("=== Policy Demo Completed ===");
        };
    }
}
