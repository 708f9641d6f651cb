package org.threatmodel.github.integration;

/**
 * An issue created through the GitHub API.
 *
 * @param number issue number
 * @param title issue title
 * @param state issue state
 * @param htmlUrl web URL
 */
public record IssueInfo(int number, String title, String state, String htmlUrl) {

}
