package com.streamearn.service;

import com.streamearn.config.StreamEarnProperties;
import com.streamearn.model.ContentDailyUsage;
import com.streamearn.model.ContentDailyUsageId;
import com.streamearn.model.RewardRole;
import com.streamearn.model.SessionState;
import com.streamearn.repository.ContentDailyUsageRepository;
import com.streamearn.repository.SessionStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Anti-farm state machine.
 *
 * Checks run in this order and the first failure wins:
 * <ol>
 *   <li>self-consumption: a listener never earns on content it owns</li>
 *   <li>cooldown: after the session idle timeout, a new session may only start
 *       once the cooldown has elapsed since the last activity</li>
 *   <li>continuous-session ceiling for the role</li>
 *   <li>per-content daily ceiling</li>
 * </ol>
 * Evaluation reads a single {@link ActivitySnapshot}. State is only advanced by
 * {@link #recordAccepted} once the payout has committed.
 */
@Service
public class AntiFarmPolicyService {

    private static final Logger log = LoggerFactory.getLogger(AntiFarmPolicyService.class);

    private final SessionStateRepository sessionStateRepository;
    private final ContentDailyUsageRepository contentDailyUsageRepository;
    private final StreamEarnProperties streamEarnProperties;

    public AntiFarmPolicyService(SessionStateRepository sessionStateRepository,
                                 ContentDailyUsageRepository contentDailyUsageRepository,
                                 StreamEarnProperties streamEarnProperties) {
        this.sessionStateRepository = sessionStateRepository;
        this.contentDailyUsageRepository = contentDailyUsageRepository;
        this.streamEarnProperties = streamEarnProperties;
    }

    public PolicyDecision evaluate(ActivitySubmission submission, String contentOwner, ActivitySnapshot snapshot, Instant now) {
        if (submission.role() == RewardRole.LISTENER && submission.identity().equals(contentOwner)) {
            return PolicyDecision.rejected(RejectionReason.SELF_CONSUMPTION_BLOCKED);
        }

        SessionPhase phase = classify(snapshot.lastActivityAt(), now);
        if (phase == SessionPhase.COOLDOWN) {
            return PolicyDecision.rejected(RejectionReason.COOLDOWN_ACTIVE);
        }

        long requested = submission.durationSeconds();
        long continuous = phase == SessionPhase.NEW_SESSION ? 0L : snapshot.continuousSeconds();
        long sessionCeiling = sessionCeiling(submission.role()).toSeconds();
        if (requested > sessionCeiling - continuous) {
            return PolicyDecision.rejected(RejectionReason.SESSION_CAP_EXCEEDED);
        }

        long contentCeiling = streamEarnProperties.getPolicy().getContentDailyCeiling().toSeconds();
        if (requested > contentCeiling - snapshot.contentSecondsToday()) {
            return PolicyDecision.rejected(RejectionReason.CONTENT_DAILY_LIMIT_EXCEEDED);
        }

        return PolicyDecision.approved(requested, phase);
    }

    public SessionPhase classify(OffsetDateTime lastActivityAt, Instant now) {
        if (lastActivityAt == null) {
            return SessionPhase.NEW_SESSION;
        }
        Duration gap = Duration.between(lastActivityAt.toInstant(), now);
        StreamEarnProperties.Policy policy = streamEarnProperties.getPolicy();
        if (gap.compareTo(policy.getCooldown()) >= 0) {
            return SessionPhase.NEW_SESSION;
        }
        if (gap.compareTo(policy.getSessionIdleTimeout()) <= 0) {
            return SessionPhase.CONTINUING;
        }
        return SessionPhase.COOLDOWN;
    }

    /**
     * Time left before a new session may start, or zero when none is pending.
     */
    public Duration cooldownRemaining(OffsetDateTime lastActivityAt, Instant now) {
        if (classify(lastActivityAt, now) != SessionPhase.COOLDOWN) {
            return Duration.ZERO;
        }
        return streamEarnProperties.getPolicy().getCooldown()
                .minus(Duration.between(lastActivityAt.toInstant(), now));
    }

    public Duration sessionCeiling(RewardRole role) {
        StreamEarnProperties.Policy policy = streamEarnProperties.getPolicy();
        return role == RewardRole.ARTIST ? policy.getArtistSessionCeiling() : policy.getListenerSessionCeiling();
    }

    /**
     * Returns the identity's session row, creating it if needed, locked for the
     * rest of the surrounding transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public SessionState lockSessionState(String identity, OffsetDateTime now) {
        sessionStateRepository.insertIfAbsent(identity, now);
        return sessionStateRepository.findByIdentityForUpdate(identity)
                .orElseThrow(() -> new IllegalStateException("Session state missing for identity " + identity));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ContentDailyUsage loadContentUsage(String identity, String contentId, LocalDate usageDate) {
        return contentDailyUsageRepository.findById(new ContentDailyUsageId(identity, contentId, usageDate))
                .orElseGet(() -> {
                    ContentDailyUsage usage = new ContentDailyUsage();
                    usage.setIdentity(identity);
                    usage.setContentId(contentId);
                    usage.setUsageDate(usageDate);
                    return usage;
                });
    }

    public ActivitySnapshot snapshot(SessionState session, ContentDailyUsage usage) {
        return new ActivitySnapshot(
                session.getLastActivityAt(),
                session.getContinuousSeconds(),
                usage.getSecondsAccrued()
        );
    }

    /**
     * Advances session and per-content usage after a committed payout.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordAccepted(SessionState session, ContentDailyUsage usage, PolicyDecision decision, OffsetDateTime now) {
        if (!decision.isApproved()) {
            throw new IllegalArgumentException("Only approved activity can be recorded");
        }
        if (decision.phase() == SessionPhase.NEW_SESSION) {
            session.setSessionStartedAt(now);
            session.setContinuousSeconds(0L);
            log.debug("Starting new session for identity {}", session.getIdentity());
        }
        session.setContinuousSeconds(session.getContinuousSeconds() + decision.approvedSeconds());
        session.setLastActivityAt(now);
        session.setUpdatedAt(now);
        sessionStateRepository.save(session);

        usage.setSecondsAccrued(usage.getSecondsAccrued() + decision.approvedSeconds());
        usage.setUpdatedAt(now);
        contentDailyUsageRepository.save(usage);
    }
}
