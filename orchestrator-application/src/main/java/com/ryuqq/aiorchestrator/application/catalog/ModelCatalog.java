package com.ryuqq.aiorchestrator.application.catalog;

import com.ryuqq.aiorchestrator.core.model.Tier;

import java.util.List;

/**
 * 모델 목록 조회 (헬스/인트로스펙션 인터페이스).
 *
 * <p>목록 조회는 권한 검사와 분리되어 있습니다. 등급을 지정하면 각 항목에
 * 해당 등급의 사용 가능 여부만 표시하고, 항목을 숨기지는 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ModelCatalog {

    /**
     * 등록된 모든 모델 (등록 순서).
     *
     * @return 모델 뷰 목록 (authorized 플래그는 모두 false)
     */
    List<ModelView> listModels();

    /**
     * 등급 기준으로 사용 가능 여부를 표시한 모델 목록.
     *
     * @param tier 조회 기준 등급 (null이면 모두 사용 불가로 표시)
     * @return 모델 뷰 목록
     */
    List<ModelView> listModels(Tier tier);
}
