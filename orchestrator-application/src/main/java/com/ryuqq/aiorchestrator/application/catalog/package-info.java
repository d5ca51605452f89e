/**
 * Model catalog introspection.
 *
 * <p>Listing is independent of authorization: a tier-scoped listing only flags which entries the
 * tier may use.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.aiorchestrator.application.catalog;
