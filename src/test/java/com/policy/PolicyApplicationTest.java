package com.policy;

import com.policy.config.PolicyConfig;
import com.policy.config.PolicyLoader;
import com.policy.context.EvaluationContextFactory;
import com.policy.context.UserInfo;
import com.policy.field.AllowedFields;
import com.policy.field.FieldFilter;
import com.policy.operation.OperationRegistry;
import com.policy.policy.AccessDecision;
import com.policy.policy.AccessRequest;
import com.policy.policy.Action;
import com.policy.policy.DefaultPolicyEngine;
import com.policy.policy.PolicyEngine;
import com.policy.policy.PolicyRule;
import com.policy.policy.PolicySet;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.policy.expression.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests against the bundled policies.yaml.
 * Tests cover:
 * - Track visibility (public, owner, stranger, anonymous)
 * - Row filters for list queries
 * - Field stripping on read and write
 * - User profile rules (implicit AND, deny list)
 * - Concurrent checks during policy reloads
 */
class PolicyApplicationTest {

    private PolicyConfig config;
    private PolicyEngine policyEngine;

    private final UserInfo alice = new UserInfo("user-123", List.of("user"));
    private final UserInfo bob = new UserInfo("user-456", List.of("user"));
    private final UserInfo admin = new UserInfo("admin-1", List.of("admin"));

    @BeforeEach
    void setUp() {
        config = PolicyLoader.load("classpath:policies.yaml");
        policyEngine = new DefaultPolicyEngine(config.policySet(), config.budget(), OperationRegistry.defaults());
    }

    private Map<String, Object> track(boolean isPublic, String uploadedBy) {
        return EvaluationContextFactory.parseJson("""
                {
                    "id": "t-1",
                    "title": "Demo",
                    "artist": "Alice",
                    "isPublic": %s,
                    "uploadedBy": "%s",
                    "storageKey": "s3://bucket/t-1.mp3"
                }
                """.formatted(isPublic, uploadedBy));
    }

    // =====================================================================
    // Document
    // =====================================================================

    @Test
    @DisplayName("Bundled policy document loads")
    void bundledDocumentLoads() {
        assertEquals("music-library", config.name());
        assertEquals(6, config.policySet().size());
        assertEquals(10, config.budget().maxDepth());
    }

    // =====================================================================
    // Track visibility
    // =====================================================================

    @ParameterizedTest(name = "public={0}, owner={1}, reader={2} -> {3}")
    @CsvSource({
            "true,  user-123, user-123, true",
            "true,  user-123, user-456, true",
            "false, user-123, user-123, true",
            "false, user-123, user-456, false",
            "false, user-123, '',       false"
    })
    @DisplayName("Track read access")
    void trackReadAccess(boolean isPublic, String uploadedBy, String readerId, boolean expected) {
        UserInfo reader = new UserInfo(readerId, List.of("user"));
        AccessRequest request = new AccessRequest("Track", Action.READ, reader, track(isPublic, uploadedBy));

        assertEquals(expected, policyEngine.checkAccess(request));
    }

    @Test
    @DisplayName("Only admins delete tracks")
    void onlyAdminsDelete() {
        Map<String, Object> own = track(false, "user-123");
        assertFalse(policyEngine.checkAccess(new AccessRequest("Track", Action.DELETE, alice, own)));
        assertTrue(policyEngine.checkAccess(new AccessRequest("Track", Action.DELETE, admin, own)));
    }

    @Test
    @DisplayName("Owner or admin may update; anonymous may not create")
    void updateAndCreate() {
        Map<String, Object> own = track(false, "user-123");
        assertTrue(policyEngine.checkAccess(new AccessRequest("Track", Action.UPDATE, alice, own)));
        assertTrue(policyEngine.checkAccess(new AccessRequest("Track", Action.UPDATE, admin, own)));
        assertFalse(policyEngine.checkAccess(new AccessRequest("Track", Action.UPDATE, bob, own)));
        assertTrue(policyEngine.checkAccess(new AccessRequest("Track", Action.CREATE, bob)));
        assertFalse(policyEngine.checkAccess(new AccessRequest("Track", Action.CREATE, UserInfo.anonymous())));
    }

    // =====================================================================
    // Row filters
    // =====================================================================

    @Test
    @DisplayName("Track list filter is public-or-own")
    void trackListFilter() {
        assertEquals(
                Map.of("OR", List.of(Map.of("isPublic", true), Map.of("uploadedBy", "user-123"))),
                policyEngine.applyRowFilters("Track", Action.READ, alice, null).toMap());
    }

    @Test
    @DisplayName("Track list filter is ANDed with the caller's where")
    void trackListFilterWithWhere() {
        assertEquals(
                Map.of("AND", List.of(
                        Map.of("OR", List.of(Map.of("isPublic", true), Map.of("uploadedBy", "user-123"))),
                        Map.of("artist", "Alice"))),
                policyEngine.applyRowFilters("Track", Action.READ, alice, Map.of("artist", "Alice")).toMap());
    }

    @Test
    @DisplayName("Update filter mixes an ownership predicate with a role check")
    void updateFilterWidensForRoleCheck() {
        // or(owner, hasRole admin): the role branch cannot become a predicate
        assertEquals(Map.of(), policyEngine.applyRowFilters("Track", Action.UPDATE, alice, null).toMap());
    }

    // =====================================================================
    // Fields
    // =====================================================================

    @Test
    @DisplayName("Storage key is never readable")
    void storageKeyHidden() {
        AccessDecision decision = policyEngine.evaluate(
                new AccessRequest("Track", Action.READ, alice, track(false, "user-123")));

        Map<String, Object> visible = FieldFilter.filterReadable(track(false, "user-123"), decision.getAllowedFields());
        assertFalse(visible.containsKey("storageKey"));
        assertEquals("Demo", visible.get("title"));
    }

    @Test
    @DisplayName("Smuggled ownership change is stripped from an update payload")
    void smuggledOwnershipStripped() {
        AllowedFields writable = policyEngine.getAllowedFields("Track", Action.UPDATE, alice);
        Map<String, Object> payload = Map.of("title", "Renamed", "uploadedBy", "user-456");

        assertEquals(Map.of("title", "Renamed"), FieldFilter.filterWritable(payload, writable));
    }

    @Test
    @DisplayName("Profiles: readable without password hash, editable only by self")
    void userProfiles() {
        Map<String, Object> profile = Map.of("id", "user-123", "name", "Alice", "passwordHash", "x", "role", "user");

        AccessDecision read = policyEngine.evaluate(new AccessRequest("User", Action.READ, bob, profile));
        assertTrue(read.isAllowed());
        assertEquals(Map.of("id", "user-123", "name", "Alice", "role", "user"),
                FieldFilter.filterReadable(profile, read.getAllowedFields()));

        assertTrue(policyEngine.checkAccess(new AccessRequest("User", Action.UPDATE, alice, profile)));
        assertFalse(policyEngine.checkAccess(new AccessRequest("User", Action.UPDATE, bob, profile)));
        assertFalse(policyEngine.checkAccess(new AccessRequest("User", Action.READ, UserInfo.anonymous(), profile)));
        assertEquals(Map.of("id", "user-123"), policyEngine.applyRowFilters("User", Action.UPDATE, alice, null).toMap());
    }

    // =====================================================================
    // Concurrency
    // =====================================================================

    @Test
    @DisplayName("Concurrent checks see a consistent policy set while reloading")
    void concurrentChecksDuringReload() throws Exception {
        PolicySet original = policyEngine.getPolicySet();
        // same rules for Track:read, everything else removed
        PolicySet reduced = PolicySet.of(new PolicyRule("Track", Action.READ,
                or(eq(field("isPublic"), literal(true)), ownedBy("uploadedBy"))));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean running = new AtomicBoolean(true);
        List<Future<Integer>> futures = new ArrayList<>();

        Map<String, Object> own = track(false, "user-123");
        Map<String, Object> foreign = track(false, "user-456");

        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    int checks = 0;
                    while (running.get()) {
                        assertTrue(policyEngine.checkAccess(new AccessRequest("Track", Action.READ, alice, own)));
                        assertFalse(policyEngine.checkAccess(new AccessRequest("Track", Action.READ, alice, foreign)));
                        checks++;
                    }
                    return checks;
                }));
            }

            start.countDown();
            for (int i = 0; i < 50; i++) {
                policyEngine.reload(i % 2 == 0 ? reduced : original);
                Thread.sleep(2);
            }
            running.set(false);

            int total = 0;
            for (Future<Integer> future : futures) {
                total += future.get(10, TimeUnit.SECONDS);
            }
            assertTrue(total > 0);
        } finally {
            pool.shutdownNow();
        }
    }
}
