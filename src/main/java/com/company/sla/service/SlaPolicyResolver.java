package com.company.sla.service;

import com.company.sla.domain.SlaPolicy;
import com.company.sla.repository.SlaPolicyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks the single policy governing a resource: project scope first, then client scope,
 * then tenant-wide. Within a scope the oldest policy passing the resource-type and
 * priority filters wins; a scope with no passing policy falls through to the next one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaPolicyResolver {

    private final SlaPolicyRepository policyRepository;

    public Optional<SlaPolicy> findApplicablePolicy(String tenantId, String clientId, String projectId,
                                                    String resourceType, String priority) {
        return findApplicablePolicy(policyRepository.findActiveByTenant(tenantId),
                clientId, projectId, resourceType, priority);
    }

    /**
     * Resolution over an already loaded list of active policies, ordered oldest first.
     * The detector uses this to avoid reloading policies for every task.
     */
    public Optional<SlaPolicy> findApplicablePolicy(List<SlaPolicy> activePolicies, String clientId,
                                                    String projectId, String resourceType, String priority) {
        Predicate<SlaPolicy> passesFilters = policy ->
                policy.appliesToResource(resourceType) && policy.appliesToPriority(priority);

        if (projectId != null) {
            Optional<SlaPolicy> projectPolicy = firstMatching(activePolicies,
                    policy -> projectId.equals(policy.getProjectId()), passesFilters);
            if (projectPolicy.isPresent()) {
                return projectPolicy;
            }
        }

        if (clientId != null) {
            Optional<SlaPolicy> clientPolicy = firstMatching(activePolicies,
                    policy -> policy.isClientScoped() && clientId.equals(policy.getClientId()), passesFilters);
            if (clientPolicy.isPresent()) {
                return clientPolicy;
            }
        }

        Optional<SlaPolicy> tenantPolicy = firstMatching(activePolicies, SlaPolicy::isTenantWide, passesFilters);
        if (tenantPolicy.isEmpty()) {
            log.debug("No SLA policy applies to {} (client={}, project={}, priority={})",
                    resourceType, clientId, projectId, priority);
        }
        return tenantPolicy;
    }

    private Optional<SlaPolicy> firstMatching(List<SlaPolicy> policies, Predicate<SlaPolicy> scope,
                                              Predicate<SlaPolicy> filters) {
        return policies.stream()
                .filter(SlaPolicy::isActive)
                .filter(scope)
                .filter(filters)
                .findFirst();
    }
}
