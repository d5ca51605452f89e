package com.ryuqq.aiorchestrator.core.model;

import java.util.Optional;

/**
 * 호출자 권한 등급.
 *
 * <p>Tier는 전순서(total order)를 가지며, 상위 등급은 하위 등급의 모든 권한을 포함합니다.
 * 비교는 {@link #level()} 값으로만 수행합니다 (enum ordinal에 의존하지 않음).</p>
 *
 * <ul>
 *   <li>GUEST (0): 게시글 열람, 제한된 채팅</li>
 *   <li>BASIC (1): 등록 사용자, 위젯 채팅</li>
 *   <li>NEURAL (2): 신경망 분류/예측 모델 접근</li>
 *   <li>VISION (3): 이미지/PDF 분석 모델 접근</li>
 *   <li>ADMIN (4): 모든 모델 접근</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Tier {

    GUEST(0),
    BASIC(1),
    NEURAL(2),
    VISION(3),
    ADMIN(4);

    private final int level;

    Tier(int level) {
        this.level = level;
    }

    /**
     * 등급 수준 조회.
     *
     * @return 0 이상의 등급 수준
     */
    public int level() {
        return level;
    }

    /**
     * 이 등급이 주어진 등급 이상인지 확인.
     *
     * @param other 비교 대상 등급
     * @return other가 null이 아니고 this.level &gt;= other.level인 경우 true
     */
    public boolean isAtLeast(Tier other) {
        return other != null && this.level >= other.level;
    }

    /**
     * 등급 수준으로 Tier 조회.
     *
     * <p>정의되지 않은 수준은 빈 Optional을 반환합니다. 권한 검사는 이 경우 거부(fail closed)해야 합니다.</p>
     *
     * @param level 등급 수준
     * @return 해당 Tier 또는 empty
     */
    public static Optional<Tier> fromLevel(int level) {
        for (Tier tier : values()) {
            if (tier.level == level) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * 이름으로 Tier 조회 (대소문자 무시).
     *
     * @param name 등급 이름 (예: "neural")
     * @return 해당 Tier 또는 empty
     */
    public static Optional<Tier> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (Tier tier : values()) {
            if (tier.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }
}
