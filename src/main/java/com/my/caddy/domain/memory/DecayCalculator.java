package com.my.caddy.domain.memory;

import com.my.caddy.domain.exception.ContractViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 오래된 미스가 조언을 지배하지 않도록 시간 감쇠를 순수 함수로 고정하기 위함. 모든 입력(특히 현재 시각)은 명시적으로 받는다.
 *
 * <p>감쇠 = 0.5^(경과일 / 반감기). 경과일이 반감기 6배를 넘으면 부동소수 잡음 대신 정확히 0을 돌려준다.
 * 미래 시각이나 [0,1] 밖의 신뢰도는 호출자 버그로 보고 {@link ContractViolationException}을 던진다.
 */
public class DecayCalculator {

    public static final double DEFAULT_HALF_LIFE_DAYS = 14.0;
    public static final int DEFAULT_RETENTION_DAYS = 90;
    public static final double CUTOFF_HALF_LIVES = 6.0;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final double halfLifeDays;
    private final int retentionDays;

    public DecayCalculator() {
        this(DEFAULT_HALF_LIFE_DAYS, DEFAULT_RETENTION_DAYS);
    }

    public DecayCalculator(double halfLifeDays, int retentionDays) {
        if (!(halfLifeDays > 0.0)) {
            throw new ContractViolationException("반감기는 양수여야 합니다: " + halfLifeDays);
        }
        if (retentionDays <= 0) {
            throw new ContractViolationException("보존 기간은 양수여야 합니다: " + retentionDays);
        }
        this.halfLifeDays = halfLifeDays;
        this.retentionDays = retentionDays;
    }

    public double decay(Instant eventTimestamp, Instant now) {
        double ageDays = ageDays(eventTimestamp, now);
        if (ageDays == 0.0) {
            return 1.0;
        }
        if (ageDays > cutoffDays()) {
            return 0.0;
        }
        return Math.pow(0.5, ageDays / halfLifeDays);
    }

    public double decayedConfidence(double baseConfidence, Instant lastOccurrence, Instant now) {
        if (Double.isNaN(baseConfidence) || baseConfidence < 0.0 || baseConfidence > 1.0) {
            throw new ContractViolationException("기준 신뢰도는 0과 1 사이여야 합니다: " + baseConfidence);
        }
        return baseConfidence * decay(lastOccurrence, now);
    }

    public double ageDays(Instant timestamp, Instant now) {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(now, "now");
        if (timestamp.isAfter(now)) {
            throw new ContractViolationException("이벤트 시각이 현재보다 미래입니다: " + timestamp + " > " + now);
        }
        return Duration.between(timestamp, now).toMillis() / MILLIS_PER_DAY;
    }

    /**
     * 경계 포함: 경과일이 정확히 {@code retentionDays}여도 보존 범위 안이다.
     */
    public boolean isWithinRetentionWindow(Instant timestamp, int retentionDays, Instant now) {
        return ageDays(timestamp, now) <= retentionDays;
    }

    public boolean isWithinRetentionWindow(Instant timestamp, Instant now) {
        return isWithinRetentionWindow(timestamp, retentionDays, now);
    }

    /**
     * 이 시각보다 엄격히 이전인 이벤트는 보존 범위를 벗어난다.
     */
    public Instant retentionCutoff(Instant now) {
        return now.minus(Duration.ofDays(retentionDays));
    }

    public double cutoffDays() {
        return halfLifeDays * CUTOFF_HALF_LIVES;
    }

    public double halfLifeDays() {
        return halfLifeDays;
    }

    public int retentionDays() {
        return retentionDays;
    }
}
