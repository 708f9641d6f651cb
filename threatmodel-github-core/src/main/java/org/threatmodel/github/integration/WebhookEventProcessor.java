package org.threatmodel.github.integration;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Drives a webhook delivery from receipt to a terminal state.
 *
 * <p>
 * Every delivery is audited as received and processing, then dispatched by event type:
 * <ul>
 * <li>{@code ping}: nothing else to do</li>
 * <li>{@code push}: analyzed when the pushed branch is the repository's default branch or
 * {@code main}/{@code master}</li>
 * <li>{@code pull_request}: the head branch is analyzed for {@code opened} and
 * {@code synchronize}</li>
 * <li>anything else: recorded as unhandled</li>
 * </ul>
 * An analysis ensures a threat model exists for the repository, clones and analyzes it,
 * stores an {@link AnalysisRecord} and then runs the configured
 * {@link PostAnalysisEffect}s. Effect failures are reported in the
 * {@link WebhookOutcome}; any other failure marks the event failed, is audited and is
 * rethrown.
 */
public class WebhookEventProcessor {

	private static final Logger logger = LoggerFactory.getLogger(WebhookEventProcessor.class);

	public static final String DEFAULT_SYSTEM_ACTOR = "system@threatmodel.local";

	private static final Set<String> ANALYZED_PR_ACTIONS = Set.of("opened", "synchronize");

	private static final Set<String> ALWAYS_ANALYZED_BRANCHES = Set.of("main", "master");

	private final WebhookSignatureVerifier signatureVerifier;

	private final ThreatModelStore store;

	private final AuditSink auditSink;

	private final RepositoryFetcher fetcher;

	private final List<PostAnalysisEffect> effects;

	private final String systemActorEmail;

	@Nullable
	private final Duration cloneTimeout;

	private final Clock clock;

	@Nullable
	private final String webhookSecret;

	public WebhookEventProcessor(WebhookSignatureVerifier signatureVerifier, ThreatModelStore store,
			AuditSink auditSink, RepositoryFetcher fetcher, List<PostAnalysisEffect> effects) {
		this(signatureVerifier, store, auditSink, fetcher, effects, DEFAULT_SYSTEM_ACTOR, null, Clock.systemUTC());
	}

	public WebhookEventProcessor(WebhookSignatureVerifier signatureVerifier, ThreatModelStore store,
			AuditSink auditSink, RepositoryFetcher fetcher, List<PostAnalysisEffect> effects, String systemActorEmail,
			@Nullable Duration cloneTimeout, Clock clock) {
		this(signatureVerifier, store, auditSink, fetcher, effects, systemActorEmail, cloneTimeout, clock, null);
	}

	/**
	 * @param webhookSecret secret used by
	 * {@link #processWebhook(String, JsonNode, String, byte[], String)}; when absent every
	 * delivery through that method is rejected
	 */
	public WebhookEventProcessor(WebhookSignatureVerifier signatureVerifier, ThreatModelStore store,
			AuditSink auditSink, RepositoryFetcher fetcher, List<PostAnalysisEffect> effects, String systemActorEmail,
			@Nullable Duration cloneTimeout, Clock clock, @Nullable String webhookSecret) {
		this.signatureVerifier = signatureVerifier;
		this.store = store;
		this.auditSink = auditSink;
		this.fetcher = fetcher;
		this.effects = List.copyOf(effects);
		this.systemActorEmail = systemActorEmail;
		this.cloneTimeout = cloneTimeout;
		this.clock = clock;
		this.webhookSecret = webhookSecret;
	}

	/**
	 * Verify the delivery against the configured webhook secret, then process it.
	 * @throws SignatureVerificationException if the signature does not match or no secret
	 * is configured
	 */
	public WebhookOutcome processWebhook(String eventType, JsonNode payload, String deliveryId, byte[] rawBody,
			@Nullable String signatureHeader) {
		return processWebhook(eventType, payload, deliveryId, rawBody, signatureHeader, webhookSecret);
	}

	/**
	 * Verify the delivery's signature, then process it.
	 * @throws SignatureVerificationException if the signature does not match; nothing is
	 * audited in that case
	 */
	public WebhookOutcome processWebhook(String eventType, JsonNode payload, String deliveryId, byte[] rawBody,
			@Nullable String signatureHeader, @Nullable String secret) {
		if (!signatureVerifier.verify(rawBody, signatureHeader, secret)) {
			logger.warn("Rejected {} delivery {}: invalid signature", eventType, deliveryId);
			throw new SignatureVerificationException("Invalid webhook signature for delivery " + deliveryId);
		}
		return process(eventType, payload, deliveryId, signatureHeader);
	}

	/**
	 * Process an already authenticated delivery.
	 * @return the terminal event with its disposition and effect results
	 */
	public WebhookOutcome process(String eventType, JsonNode payload, String deliveryId, @Nullable String signature) {
		WebhookEvent event = WebhookEvent.received(eventType, payload, signature, deliveryId, clock.instant());
		logger.info("Processing GitHub webhook {} ({}, delivery {}, repository {}, action {})", event.getId(),
				eventType, deliveryId, JsonNodeUtils.getString(payload, "repository", "full_name").orElse("-"),
				JsonNodeUtils.getString(payload, "action").orElse("-"));

		audit(event, AuditEvent.Action.WEBHOOK_RECEIVED, "Event: " + eventType + ", Delivery: " + deliveryId, payload);

		Dispatch result;
		try {
			event.markProcessing();
			audit(event, AuditEvent.Action.WEBHOOK_PROCESSING, "Webhook processing", null);
			result = dispatch(event);
		}
		catch (RuntimeException e) {
			logger.error("Webhook {} ({}) processing failed: {}", event.getId(), eventType, e.getMessage());
			String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
			event.markFailed(message);
			try {
				audit(event, AuditEvent.Action.WEBHOOK_FAILED, message, null);
			}
			catch (RuntimeException auditFailure) {
				e.addSuppressed(auditFailure);
			}
			throw e;
		}

		event.markProcessed(result.note());
		audit(event, AuditEvent.Action.WEBHOOK_PROCESSED, "Webhook processed: " + result.note(), null);
		return new WebhookOutcome(event, result.disposition(), result.effects());
	}

	private Dispatch dispatch(WebhookEvent event) {
		JsonNode payload = event.getPayload();
		return switch (event.getEventType()) {
			case "ping" -> {
				logger.info("Webhook ping received (delivery {})", event.getDeliveryId());
				yield Dispatch.of(WebhookDisposition.PING, "ping");
			}
			case "push" -> handlePush(payload);
			case "pull_request" -> handlePullRequest(payload);
			default -> {
				logger.info("Unhandled webhook event: {}", event.getEventType());
				yield Dispatch.of(WebhookDisposition.UNHANDLED, "unhandled event " + event.getEventType());
			}
		};
	}

	private Dispatch handlePush(JsonNode payload) {
		RemoteRepositoryRef repository = RemoteRepositoryRef.fromWebhookRepository(payload.path("repository"));
		String ref = JsonNodeUtils.getString(payload, "ref").orElse("");
		String branch = ref.startsWith("refs/heads/") ? ref.substring("refs/heads/".length()) : ref;
		if (!branch.equals(repository.defaultBranch()) && !ALWAYS_ANALYZED_BRANCHES.contains(branch)) {
			logger.info("Skipping analysis of {} for non-default branch '{}'", repository.fullName(), branch);
			return Dispatch.of(WebhookDisposition.SKIPPED, "skipped push to non-default branch " + branch);
		}
		List<EffectOutcome> outcomes = analyze("push", repository, branch, null);
		return new Dispatch(WebhookDisposition.ANALYZED, "analyzed " + repository.fullName() + "@" + branch, outcomes);
	}

	private Dispatch handlePullRequest(JsonNode payload) {
		if (!JsonNodeUtils.has(payload, "pull_request")) {
			logger.warn("Pull request data missing in payload");
			return Dispatch.of(WebhookDisposition.SKIPPED, "pull_request data missing");
		}
		String action = JsonNodeUtils.getString(payload, "action").orElse("");
		if (!ANALYZED_PR_ACTIONS.contains(action)) {
			logger.info("Skipping PR analysis for action '{}'", action);
			return Dispatch.of(WebhookDisposition.SKIPPED, "skipped pull_request action " + action);
		}
		RemoteRepositoryRef repository = RemoteRepositoryRef.fromWebhookRepository(payload.path("repository"));
		JsonNode pullRequest = payload.path("pull_request");
		Integer number = JsonNodeUtils.getInt(pullRequest, "number")
			.orElseThrow(() -> new IllegalArgumentException("pull_request.number missing"));
		String branch = JsonNodeUtils.getString(pullRequest, "head", "ref")
			.orElseThrow(() -> new IllegalArgumentException("pull_request.head.ref missing"));

		List<EffectOutcome> outcomes = analyze("pull_request", repository, branch, number);
		return new Dispatch(WebhookDisposition.ANALYZED,
				"analyzed " + repository.fullName() + "#" + number + "@" + branch, outcomes);
	}

	private List<EffectOutcome> analyze(String eventType, RemoteRepositoryRef repository, String branch,
			@Nullable Integer pullRequestNumber) {
		ThreatModelRef threatModel = ensureThreatModel(repository);
		logger.info("Triggering analysis of {} ({}) for threat model {}", repository.cloneUrl(), branch,
				threatModel.id());

		FetchOptions options = FetchOptions.forBranch(branch).withTimeout(cloneTimeout);
		RepositoryAnalysis analysis = fetcher.fetchAndAnalyze(repository.cloneUrl(), options);
		AnalysisRecord record = store.createAnalysisRecord(threatModel.id(), repository.cloneUrl(), branch, analysis);
		logger.info("Analysis {} stored: {}", record.id(), record.summary());

		AnalysisContext context = new AnalysisContext(eventType, repository, branch, pullRequestNumber, threatModel,
				record, analysis);
		return runEffects(context);
	}

	ThreatModelRef ensureThreatModel(RemoteRepositoryRef repository) {
		String name = repository.fullName();
		Optional<ThreatModelRef> existing = store.findThreatModelByName(name);
		if (existing.isPresent()) {
			return existing.get();
		}
		UUID actor = store.findOrCreateSystemActor(systemActorEmail);
		try {
			return store.createThreatModel(name, "Auto-generated threat model for " + name, actor);
		}
		catch (DuplicateRecordException e) {
			logger.debug("Threat model for {} created concurrently, reusing it", name);
			return store.findThreatModelByName(name)
				.orElseThrow(() -> new IntegrationException("Threat model " + name + " reported duplicate but not found",
						e));
		}
	}

	private List<EffectOutcome> runEffects(AnalysisContext context) {
		List<EffectOutcome> outcomes = new ArrayList<>();
		for (PostAnalysisEffect effect : effects) {
			if (!effect.appliesTo(context)) {
				continue;
			}
			try {
				effect.apply(context);
				outcomes.add(EffectOutcome.succeeded(effect.name()));
			}
			catch (NotConfiguredException e) {
				logger.warn("Skipping {}: {}", effect.name(), e.getMessage());
				outcomes.add(EffectOutcome.skipped(effect.name(), e.getMessage()));
			}
			catch (RuntimeException e) {
				logger.error("Post-analysis effect {} failed for {}: {}", effect.name(),
						context.repository().fullName(), e.getMessage());
				outcomes.add(EffectOutcome.failed(effect.name(), String.valueOf(e.getMessage())));
			}
		}
		return outcomes;
	}

	private void audit(WebhookEvent event, AuditEvent.Action action, String details, @Nullable JsonNode payload) {
		auditSink.appendAuditEvent(AuditEvent.of(event, action, details, payload, clock.instant()));
	}

	private record Dispatch(WebhookDisposition disposition, String note, List<EffectOutcome> effects) {

		static Dispatch of(WebhookDisposition disposition, String note) {
			return new Dispatch(disposition, note, List.of());
		}

	}

}
