package com.my.caddy.domain.model;

import com.my.caddy.domain.exception.ContractViolationException;

import java.util.Objects;

/**
 * 진행 중인 라운드의 현재 위치.
 */
public record RoundState(String roundId, String courseName, int currentHole, int currentPar, int holesCompleted) {

    public RoundState {
        Objects.requireNonNull(roundId, "roundId");
        if (roundId.isBlank()) {
            throw new ContractViolationException("라운드 ID가 비어 있습니다.");
        }
        if (currentHole < 1 || currentHole > 18) {
            throw new ContractViolationException("홀 번호는 1~18 사이여야 합니다: " + currentHole);
        }
        if (currentPar < 3 || currentPar > 5) {
            throw new ContractViolationException("파는 3~5 사이여야 합니다: " + currentPar);
        }
        if (holesCompleted < 0 || holesCompleted > 18) {
            throw new ContractViolationException("완료 홀 수는 0~18 사이여야 합니다: " + holesCompleted);
        }
        courseName = courseName == null || courseName.isBlank() ? null : courseName;
    }

    public boolean hasCourse() {
        return courseName != null;
    }

    public RoundState atHole(int hole, int par) {
        int completed = Math.max(holesCompleted, Math.min(18, hole - 1));
        return new RoundState(roundId, courseName, hole, par, completed);
    }
}
