package org.threatmodel.github.integration;

/**
 * Pull request details needed to analyze its head and report back.
 *
 * @param number PR number
 * @param title PR title
 * @param state PR state (open, closed)
 * @param htmlUrl web URL
 * @param headRef head branch name
 * @param headSha head commit SHA
 * @param baseRef base branch name
 * @param baseSha base commit SHA
 */
public record PullRequestInfo(int number, String title, String state, String htmlUrl, String headRef, String headSha,
		String baseRef, String baseSha) {

}
