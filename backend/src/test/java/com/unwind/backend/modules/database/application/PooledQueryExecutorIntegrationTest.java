package com.unwind.backend.modules.database.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.unwind.backend.global.config.DatabaseProperties;
import com.unwind.backend.global.error.QueryExecutionException;
import com.unwind.backend.modules.auth.application.VerifiedIdentity;
import com.unwind.backend.modules.database.domain.ExecutionStatus;
import com.unwind.backend.modules.database.domain.PoolState;
import com.unwind.backend.modules.database.domain.PoolStatsSnapshot;
import com.unwind.backend.modules.database.domain.QueryRequest;
import com.unwind.backend.modules.database.infrastructure.HikariConnectionPoolFactory;
import com.unwind.backend.support.AbstractPostgresIntegrationTest;
import com.unwind.backend.support.TestIdentities;

@Testcontainers(disabledWithoutDocker = true)
class PooledQueryExecutorIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String USER_ID = "11111111-1111-1111-1111-111111111111";
    private static final String OTHER_USER_ID = "33333333-3333-3333-3333-333333333333";

    private static final String MARK_COMPLETE_SQL = """
            UPDATE items
            SET status = 'completed',
                completed_at = NOW(),
                updated_at = NOW()
            WHERE user_id = ?
              AND id = ?
              AND status = 'pending'
            RETURNING id, title
            """;

    private PooledQueryExecutor executor;
    private VerifiedIdentity identity;

    @BeforeEach
    void setUp() {
        executor = new PooledQueryExecutor(databaseProperties(), new HikariConnectionPoolFactory());
        executor.connect();
        identity = TestIdentities.service(USER_ID);
    }

    @AfterEach
    void tearDown() {
        executor.disconnect();
    }

    @Test
    @DisplayName("대기 중인 항목을 완료 처리하면 id와 제목이 반환되고 상태가 바뀐다")
    void completesPendingItem() {
        UUID itemId = insertItem(USER_ID, "Pay rent", "pending");

        Map<String, Object> completed = executor.executeReturning(
                QueryRequest.scopedTo(identity, MARK_COMPLETE_SQL, itemId));

        assertThat(completed).containsEntry("id", itemId).containsEntry("title", "Pay rent");
        assertThat(completed).containsOnlyKeys("id", "title");
        Map<String, Object> stored = executor.fetchOne(identity,
                "SELECT status, completed_at FROM items WHERE id = ?", itemId);
        assertThat(stored).containsEntry("status", "completed");
        assertThat(stored.get("completed_at")).isNotNull();
    }

    @Test
    @DisplayName("이미 완료된 항목은 null을 반환하고 행을 바꾸지 않는다")
    void alreadyCompletedItemYieldsNull() {
        UUID itemId = insertItem(USER_ID, "Call mom", "completed");
        Map<String, Object> before = executor.fetchOne("SELECT updated_at FROM items WHERE id = ?", itemId);

        Map<String, Object> result = executor.executeReturning(
                QueryRequest.scopedTo(identity, MARK_COMPLETE_SQL, itemId));

        assertThat(result).isNull();
        Map<String, Object> after = executor.fetchOne("SELECT status, updated_at FROM items WHERE id = ?", itemId);
        assertThat(after).containsEntry("status", "completed");
        assertThat(after.get("updated_at")).isEqualTo(before.get("updated_at"));
    }

    @Test
    @DisplayName("다른 사용자의 항목은 식별자 필터에 걸려 수정되지 않는다")
    void otherUsersItemIsNotTouched() {
        UUID itemId = insertItem(OTHER_USER_ID, "Someone else's task", "pending");

        assertThat(executor.executeReturning(QueryRequest.scopedTo(identity, MARK_COMPLETE_SQL, itemId))).isNull();
        assertThat(executor.fetchOne("SELECT status FROM items WHERE id = ?", itemId))
                .containsEntry("status", "pending");
    }

    @Test
    @DisplayName("fetchAll은 일치하는 행이 없으면 빈 목록을 반환한다")
    void fetchAllWithNoMatchReturnsEmptyList() {
        List<Map<String, Object>> rows = executor.fetchAll(
                QueryRequest.scopedTo(identity, "SELECT id FROM items WHERE user_id = ? AND status = 'pending'"));

        assertThat(rows).isNotNull().isEmpty();
    }

    @Test
    @DisplayName("fetchAll은 백엔드가 정렬한 순서를 유지한다")
    void fetchAllKeepsBackendOrder() {
        insertItem(USER_ID, "b-task", "pending");
        insertItem(USER_ID, "a-task", "pending");
        insertItem(USER_ID, "c-task", "pending");

        List<Map<String, Object>> rows = executor.fetchAll(QueryRequest.scopedTo(identity,
                "SELECT title FROM items WHERE user_id = ? ORDER BY title DESC"));

        assertThat(rows).extracting(row -> row.get("title")).containsExactly("c-task", "b-task", "a-task");
    }

    @Test
    @DisplayName("execute는 영향받은 행 수를 커맨드 태그로 돌려준다")
    void executeReturnsAffectedRowCount() {
        insertItem(USER_ID, "one", "pending");
        insertItem(USER_ID, "two", "pending");
        insertItem(OTHER_USER_ID, "three", "pending");

        ExecutionStatus status = executor.execute(QueryRequest.scopedTo(identity,
                "UPDATE items SET priority = 'high', updated_at = NOW() WHERE user_id = ? AND status = ?",
                "pending"));

        assertThat(status.tag()).isEqualTo("UPDATE 2");
    }

    @Test
    @DisplayName("제약 조건 위반은 QueryExecutionException으로 전달된다")
    void constraintViolationIsRaised() {
        UUID itemId = insertItem(USER_ID, "Stretch", "pending");

        assertThatThrownBy(() -> executor.execute(identity,
                "UPDATE items SET priority = ? WHERE id = ?", "urgent", itemId))
                .isInstanceOf(QueryExecutionException.class)
                .satisfies(ex -> assertThat(((QueryExecutionException) ex).getIdentityTag()).isEqualTo("11111111..."));
    }

    @Test
    @DisplayName("명령 타임아웃을 넘긴 문장은 취소된다")
    void commandTimeoutCancelsStatement() {
        DatabaseProperties properties = databaseProperties();
        properties.setCommandTimeout(Duration.ofSeconds(1));
        PooledQueryExecutor impatient = new PooledQueryExecutor(properties, new HikariConnectionPoolFactory());
        try {
            long started = System.nanoTime();
            assertThatThrownBy(() -> impatient.fetchOne("SELECT pg_sleep(5)"))
                    .isInstanceOf(QueryExecutionException.class);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));

            assertThat(impatient.fetchOne("SELECT 1 AS ok")).containsEntry("ok", 1);
        } finally {
            impatient.disconnect();
        }
    }

    @Test
    @DisplayName("최대 풀 크기보다 많은 동시 요청은 실패하지 않고 대기한다")
    void excessCallersQueueForConnections() throws Exception {
        DatabaseProperties properties = databaseProperties();
        properties.setMinPoolSize(0);
        properties.setMaxPoolSize(2);
        PooledQueryExecutor small = new PooledQueryExecutor(properties, new HikariConnectionPoolFactory());
        small.connect();
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Map<String, Object>>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return small.fetchOne("SELECT pg_sleep(0.2), pg_backend_pid() AS pid");
                }));
            }
            start.countDown();

            Set<Object> backends = new HashSet<>();
            for (Future<Map<String, Object>> future : futures) {
                backends.add(future.get(30, TimeUnit.SECONDS).get("pid"));
            }
            assertThat(backends).hasSizeLessThanOrEqualTo(2);
            PoolStatsSnapshot stats = small.poolStats().orElseThrow();
            assertThat(stats.maxPoolSize()).isEqualTo(2);
            assertThat(stats.totalConnections()).isLessThanOrEqualTo(2);
        } finally {
            pool.shutdownNow();
            small.disconnect();
        }
    }

    @Test
    @DisplayName("disconnect 이후 다음 쿼리가 풀을 다시 연다")
    void reconnectsLazilyAfterDisconnect() {
        executor.disconnect();
        assertThat(executor.state()).isEqualTo(PoolState.UNINITIALIZED);

        assertThat(executor.fetchOne("SELECT 1 AS ok")).containsEntry("ok", 1);
        assertThat(executor.state()).isEqualTo(PoolState.CONNECTED);
    }

    @Test
    @DisplayName("withConnection으로 여러 문장을 한 커넥션에서 실행한다")
    void withConnectionRunsOnOneConnection() {
        Integer pid = executor.withConnection(connection -> {
            try (var statement = connection.createStatement();
                 var resultSet = statement.executeQuery("SELECT pg_backend_pid()")) {
                resultSet.next();
                return resultSet.getInt(1);
            }
        });

        assertThat(pid).isPositive();
    }

    private UUID insertItem(String userId, String title, String status) {
        Map<String, Object> row = executor.executeReturning(
                "INSERT INTO items (user_id, title, status) VALUES (?, ?, ?) RETURNING id",
                UUID.fromString(userId), title, status);
        return (UUID) row.get("id");
    }
}
