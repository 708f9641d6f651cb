package org.threatmodel.github.integration;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts an analysis summary as a comment on the pull request that triggered it.
 */
public class PullRequestCommentEffect implements PostAnalysisEffect {

	private static final Logger logger = LoggerFactory.getLogger(PullRequestCommentEffect.class);

	public static final String NAME = "pull-request-comment";

	@Nullable
	private final RestService restService;

	private final String platformUrl;

	public PullRequestCommentEffect(@Nullable RestService restService, String platformUrl) {
		this.restService = restService;
		this.platformUrl = platformUrl;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public boolean appliesTo(AnalysisContext context) {
		return context.pullRequestNumber() != null;
	}

	@Override
	public void apply(AnalysisContext context) {
		if (restService == null) {
			throw new NotConfiguredException("GitHub API client not configured, cannot comment on pull requests");
		}
		Integer prNumber = context.pullRequestNumber();
		if (prNumber == null) {
			throw new IllegalArgumentException("Not a pull request analysis");
		}
		RemoteRepositoryRef repository = context.repository();
		restService.createComment(repository.owner(), repository.name(), prNumber,
				renderComment(context.record().summary()));
		logger.info("Comment posted on PR {}#{}", repository.fullName(), prNumber);
	}

	String renderComment(AnalysisSummary summary) {
		StringBuilder body = new StringBuilder();
		body.append("## Threat Model Analysis Results\n\n");
		body.append("**Files analyzed:** ").append(summary.totalFiles()).append("\n\n");
		body.append("### Breakdown\n");
		body.append("- **Infrastructure:** ").append(summary.infrastructureFiles()).append('\n');
		body.append("- **Code:** ").append(summary.codeFiles()).append('\n');
		body.append("- **Configuration:** ").append(summary.configFiles()).append('\n');
		if (!summary.dependencyEcosystems().isEmpty()) {
			body.append("- **Dependency manifests:** ")
				.append(String.join(", ", summary.dependencyEcosystems()))
				.append('\n');
		}
		body.append("\n### Recommendations\n");
		body.append("- Review identified threats in the [Threat Modeling Platform](").append(platformUrl).append(")\n");
		body.append("- Address high and critical severity threats before merging\n");
		body.append("- Update mitigation strategies for accepted risks\n\n");
		body.append("---\n*This analysis was automatically generated by the Threat Modeling Platform*\n");
		return body.toString();
	}

}
