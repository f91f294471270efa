package com.securehealth.policy;

import com.securehealth.audit.AuditEntry;
import com.securehealth.audit.AuditLogWriter;
import com.securehealth.exception.MissingSubjectException;
import com.securehealth.exception.PolicyDeniedException;
import com.securehealth.model.EntityType;
import com.securehealth.model.Principal;
import com.securehealth.model.Role;
import com.securehealth.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a principal may perform an action on an entity type.
 *
 * <p>Combining algorithm, applied in order:
 * <ol>
 *   <li>no roles: DENY, the rule table is not consulted</li>
 *   <li>action needs a target and none was given: DENY</li>
 *   <li>any held role with a DENY rule: DENY</li>
 *   <li>any held role with an ALLOW rule: GRANT (own-record actions also need a matching owner)</li>
 *   <li>otherwise ABSTAIN</li>
 * </ol>
 *
 * <p>Every call appends exactly one audit entry before returning. If that entry cannot be
 * written the evaluation fails with {@link com.securehealth.exception.AuditWriteFailureException}
 * instead of returning a decision.
 */
@Component
public class PolicyEvaluator {
    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    private final PolicyRuleTable rules;
    private final AuditLogWriter auditLogWriter;

    public PolicyEvaluator(PolicyRuleTable rules, AuditLogWriter auditLogWriter) {
        this.rules = rules;
        this.auditLogWriter = auditLogWriter;
        log.info("Policy evaluator initialized with {} rules", rules.size());
    }

    public PolicyDecision evaluate(Principal principal, EntityType entityType, Action action, PolicyTarget target) {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(action, "action");
        Principal caller = principal != null ? principal : Principal.anonymous();

        PolicyDecision decision = decide(caller, entityType, action, target);

        String entityId = target != null ? target.entityId() : null;
        this.auditLogWriter.append(AuditEntry.policyDecision(caller, entityType, action, entityId, decision));

        if (decision.isGranted()) {
            log.debug("Access GRANTED: actor={}, entity={}/{}, action={}",
                    caller.auditId(), entityType, LogSanitizer.sanitize(entityId), action);
        } else {
            log.warn("Access {} ({}): actor={}, entity={}/{}, action={}",
                    decision.decision(), decision.detail(), caller.auditId(), entityType,
                    LogSanitizer.sanitize(entityId), action);
        }
        return decision;
    }

    public PolicyDecision evaluate(Principal principal, EntityType entityType, Action action) {
        return evaluate(principal, entityType, action, null);
    }

    /**
     * Evaluates and converts anything but a grant into an exception. ABSTAIN is refused like
     * a deny.
     */
    public PolicyDecision enforce(Principal principal, EntityType entityType, Action action, PolicyTarget target) {
        PolicyDecision decision = evaluate(principal, entityType, action, target);
        if (decision.isGranted()) {
            return decision;
        }
        if (decision.detail() == PolicyDecision.Detail.MISSING_SUBJECT) {
            throw new MissingSubjectException(decision);
        }
        throw new PolicyDeniedException(decision);
    }

    public PolicyDecision enforce(Principal principal, EntityType entityType, Action action) {
        return enforce(principal, entityType, action, null);
    }

    private PolicyDecision decide(Principal principal, EntityType entityType, Action action, PolicyTarget target) {
        if (!principal.isAuthenticated()) {
            return PolicyDecision.deny(PolicyDecision.Detail.UNAUTHENTICATED, Set.of(),
                    "No roles resolved for caller");
        }
        if (action.requiresTarget() && (target == null || target.entityId() == null)) {
            return PolicyDecision.deny(PolicyDecision.Detail.MISSING_SUBJECT, Set.of(),
                    action + " requires a target " + entityType);
        }

        Set<Role> allowing = EnumSet.noneOf(Role.class);
        Set<Role> denying = EnumSet.noneOf(Role.class);
        for (Role role : principal.roles()) {
            this.rules.lookup(entityType, role, action).ifPresent(effect -> {
                if (effect == RuleEffect.DENY) {
                    denying.add(role);
                } else {
                    allowing.add(role);
                }
            });
        }

        if (!denying.isEmpty()) {
            return PolicyDecision.deny(PolicyDecision.Detail.EXPLICIT_DENY, denying,
                    "Explicitly denied for role(s) " + denying);
        }
        if (allowing.isEmpty()) {
            return PolicyDecision.abstain("No rule for " + action + " on " + entityType);
        }
        if (action == Action.VIEW_OWN_RECORD_ONLY && !ownsTarget(principal, target)) {
            return PolicyDecision.deny(PolicyDecision.Detail.OWNERSHIP_MISMATCH, allowing,
                    "Target is not the caller's own record");
        }
        return PolicyDecision.grant(allowing, "Allowed for role(s) " + allowing);
    }

    private static boolean ownsTarget(Principal principal, PolicyTarget target) {
        return principal.linkedPatientId() != null && principal.linkedPatientId().equals(target.ownerId());
    }
}
