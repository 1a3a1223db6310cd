package com.my.caddy.domain.session;

import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.model.ConversationTurn;
import com.my.caddy.domain.model.Role;
import com.my.caddy.domain.model.RoundState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionContextTest {

    private static final Instant NOW = Instant.parse("2026-06-01T12:00:00Z");

    @Test
    void evicts_oldest_turn_when_full() {
        SessionContext session = new SessionContext(3);
        for (int i = 1; i <= 5; i++) {
            session.addTurn(turn(Role.USER, "u" + i));
        }

        assertThat(session.size()).isEqualTo(3);
        assertThat(session.turns()).extracting(ConversationTurn::content).containsExactly("u3", "u4", "u5");
    }

    @Test
    void recent_returns_newest_turns_oldest_first() {
        SessionContext session = new SessionContext();
        session.addTurn(turn(Role.USER, "a"));
        session.addTurn(turn(Role.ASSISTANT, "b"));
        session.addTurn(turn(Role.USER, "c"));

        assertThat(session.recent(2)).extracting(ConversationTurn::content).containsExactly("b", "c");
        assertThat(session.recent(0)).isEmpty();
    }

    @Test
    void last_user_input_skips_assistant_turns() {
        SessionContext session = new SessionContext();
        session.addTurn(turn(Role.USER, "how's my recovery"));
        session.addTurn(turn(Role.ASSISTANT, "no data"));

        assertThat(session.lastUserInput()).contains("how's my recovery");
    }

    @Test
    void round_pointers_follow_hole_updates() {
        SessionContext session = new SessionContext();
        session.updateHole(3, 4);
        assertThat(session.round()).isEmpty();

        session.startRound(new RoundState("r1", "Pebble", 1, 4, 0));
        session.updateHole(5, 3);

        assertThat(session.round()).get().satisfies(round -> {
            assertThat(round.currentHole()).isEqualTo(5);
            assertThat(round.currentPar()).isEqualTo(3);
            assertThat(round.holesCompleted()).isEqualTo(4);
        });
        assertThat(session.snapshot().activeRound()).isPresent();

        session.endRound();
        assertThat(session.round()).isEmpty();
    }

    @Test
    void invalid_round_state_is_rejected() {
        assertThatThrownBy(() -> new RoundState("r1", null, 19, 4, 0)).isInstanceOf(ContractViolationException.class);
        assertThatThrownBy(() -> new RoundState("r1", null, 1, 6, 0)).isInstanceOf(ContractViolationException.class);
    }

    @Test
    void clear_resets_everything() {
        SessionContext session = new SessionContext();
        session.addTurn(turn(Role.USER, "x"));
        session.startRound(new RoundState("r1", null, 1, 4, 0));

        session.clear();

        assertThat(session.size()).isZero();
        assertThat(session.round()).isEmpty();
    }

    @Test
    void concurrent_writers_never_exceed_capacity() throws Exception {
        SessionContext session = new SessionContext(10);
        int writers = 8;
        int perWriter = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        session.addTurn(turn(Role.USER, writer + "-" + i));
                        assertThat(session.recent(10)).hasSizeLessThanOrEqualTo(10);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(session.size()).isEqualTo(10);
        assertThat(session.turns()).hasSize(10).doesNotContainNull();
    }

    @Test
    void registry_returns_same_session_per_user() {
        SessionRegistry registry = new SessionRegistry(5);

        SessionContext first = registry.session("u1");

        assertThat(registry.session("u1")).isSameAs(first);
        assertThat(first.capacity()).isEqualTo(5);
        assertThat(registry.existing("u2")).isEmpty();
    }

    private static ConversationTurn turn(Role role, String content) {
        return new ConversationTurn(role, content, NOW);
    }
}
