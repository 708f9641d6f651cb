package org.threatmodel.github.integration;

/**
 * Side effect run after an analysis has been persisted, such as commenting on a pull
 * request. A failing effect is reported but never fails the webhook.
 */
public interface PostAnalysisEffect {

	String name();

	boolean appliesTo(AnalysisContext context);

	/**
	 * @throws NotConfiguredException if the effect lacks a collaborator; reported as
	 * skipped
	 */
	void apply(AnalysisContext context);

}
