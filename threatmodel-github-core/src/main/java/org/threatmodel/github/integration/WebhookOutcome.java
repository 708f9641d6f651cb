package org.threatmodel.github.integration;

import java.util.List;

/**
 * @param event the event, in a terminal state
 * @param disposition how it was handled
 * @param effects post-analysis effect results, empty unless {@code ANALYZED}
 */
public record WebhookOutcome(WebhookEvent event, WebhookDisposition disposition, List<EffectOutcome> effects) {

	public WebhookOutcome {
		effects = List.copyOf(effects);
	}

}
