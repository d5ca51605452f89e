package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.application.catalog.ModelCatalog;
import com.ryuqq.aiorchestrator.application.catalog.ModelView;
import com.ryuqq.aiorchestrator.core.model.Tier;
import com.ryuqq.aiorchestrator.core.permission.TierChecker;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 레지스트리 기반 ModelCatalog 구현체.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RegistryModelCatalog implements ModelCatalog {

    private final ModelRegistry registry;
    private final TierChecker tierChecker;

    public RegistryModelCatalog(ModelRegistry registry) {
        this(registry, new TierChecker());
    }

    public RegistryModelCatalog(ModelRegistry registry, TierChecker tierChecker) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (tierChecker == null) {
            throw new IllegalArgumentException("tierChecker cannot be null");
        }
        this.registry = registry;
        this.tierChecker = tierChecker;
    }

    @Override
    public List<ModelView> listModels() {
        return registry.listAll().stream()
            .map(ModelView::unchecked)
            .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public List<ModelView> listModels(Tier tier) {
        return registry.listAll().stream()
            .map(descriptor -> ModelView.forTier(descriptor, tierChecker.authorize(tier, descriptor)))
            .collect(Collectors.toUnmodifiableList());
    }
}
