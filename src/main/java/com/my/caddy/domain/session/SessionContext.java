package com.my.caddy.domain.session;

import com.my.caddy.domain.exception.ContractViolationException;
import com.my.caddy.domain.model.ConversationTurn;
import com.my.caddy.domain.model.Role;
import com.my.caddy.domain.model.RoundState;
import com.my.caddy.domain.model.SessionSnapshot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 한 사용자 세션의 최근 대화와 라운드 위치를 보관한다. 동시에 들어오는 발화가 버퍼를 깨뜨리거나 용량을 넘지 않도록 모든 접근을 하나의 락으로 직렬화한다.
 *
 * <p>고정 용량 원형 버퍼이며 가득 차면 가장 오래된 턴부터 밀어낸다.
 */
public class SessionContext {

    public static final int DEFAULT_CAPACITY = 10;

    private final ReentrantLock lock = new ReentrantLock();
    private final ConversationTurn[] turns;
    private int head;
    private int size;
    private RoundState round;

    public SessionContext() {
        this(DEFAULT_CAPACITY);
    }

    public SessionContext(int capacity) {
        if (capacity <= 0) {
            throw new ContractViolationException("세션 용량은 양수여야 합니다: " + capacity);
        }
        this.turns = new ConversationTurn[capacity];
    }

    public void addTurn(ConversationTurn turn) {
        lock.lock();
        try {
            int tail = (head + size) % turns.length;
            turns[tail] = turn;
            if (size == turns.length) {
                head = (head + 1) % turns.length;
            } else {
                size++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 오래된 것부터 최대 {@code limit}개의 최근 턴.
     */
    public List<ConversationTurn> recent(int limit) {
        lock.lock();
        try {
            int count = Math.max(0, Math.min(limit, size));
            List<ConversationTurn> result = new ArrayList<>(count);
            for (int i = size - count; i < size; i++) {
                result.add(turns[(head + i) % turns.length]);
            }
            return List.copyOf(result);
        } finally {
            lock.unlock();
        }
    }

    public List<ConversationTurn> turns() {
        return recent(turns.length);
    }

    public Optional<String> lastUserInput() {
        lock.lock();
        try {
            for (int i = size - 1; i >= 0; i--) {
                ConversationTurn turn = turns[(head + i) % turns.length];
                if (turn.role() == Role.USER) {
                    return Optional.of(turn.content());
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public void startRound(RoundState state) {
        lock.lock();
        try {
            this.round = state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 진행 중인 라운드가 없으면 무시한다.
     */
    public void updateHole(int hole, int par) {
        lock.lock();
        try {
            if (round != null) {
                round = round.atHole(hole, par);
            }
        } finally {
            lock.unlock();
        }
    }

    public void endRound() {
        lock.lock();
        try {
            round = null;
        } finally {
            lock.unlock();
        }
    }

    public Optional<RoundState> round() {
        lock.lock();
        try {
            return Optional.ofNullable(round);
        } finally {
            lock.unlock();
        }
    }

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            return new SessionSnapshot(turns(), round);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return turns.length;
    }

    public void clear() {
        lock.lock();
        try {
            Arrays.fill(turns, null);
            head = 0;
            size = 0;
            round = null;
        } finally {
            lock.unlock();
        }
    }
}
