package org.threatmodel.github.integration;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Transport-level tests for {@link GitHubHttpClient} against a local mock server.
 */
@DisplayName("GitHubHttpClient Tests")
class GitHubHttpClientTest {

	private MockWebServer server;

	private GitHubHttpClient client;

	@BeforeEach
	void setUp() throws IOException {
		server = new MockWebServer();
		server.start();
		client = new GitHubHttpClient("test-token", server.url("/").toString(), Duration.ofSeconds(5));
	}

	@AfterEach
	void tearDown() throws IOException {
		server.shutdown();
	}

	@Nested
	@DisplayName("Request Tests")
	class RequestTest {

		@Test
		@DisplayName("Should send auth, accept and user agent headers")
		void shouldSendHeaders() throws Exception {
			server.enqueue(new MockResponse().setBody("{\"id\":1}"));

			String body = client.get("/repos/octo/app");

			assertThat(body).isEqualTo("{\"id\":1}");
			RecordedRequest request = server.takeRequest();
			assertThat(request.getMethod()).isEqualTo("GET");
			assertThat(request.getPath()).isEqualTo("/repos/octo/app");
			assertThat(request.getHeader("Authorization")).isEqualTo("Bearer test-token");
			assertThat(request.getHeader("Accept")).isEqualTo("application/vnd.github.v3+json");
			assertThat(request.getHeader("User-Agent")).isNotBlank();
		}

		@Test
		@DisplayName("Should send JSON body on POST")
		void shouldSendJsonBody() throws Exception {
			server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"number\":7}"));

			client.post("/repos/octo/app/issues", "{\"title\":\"t\"}");

			RecordedRequest request = server.takeRequest();
			assertThat(request.getMethod()).isEqualTo("POST");
			assertThat(request.getHeader("Content-Type")).startsWith("application/json");
			assertThat(request.getBody().readUtf8()).isEqualTo("{\"title\":\"t\"}");
		}

	}

	@Nested
	@DisplayName("Rate Limit State Tests")
	class RateLimitStateTest {

		@Test
		@DisplayName("Should start with unknown state")
		void shouldStartUnknown() {
			assertThat(client.getRateLimitState().isKnown()).isFalse();
		}

		@Test
		@DisplayName("Should parse rate limit headers into state")
		void shouldParseHeaders() {
			server.enqueue(new MockResponse().setBody("{}")
				.addHeader("x-ratelimit-limit", "5000")
				.addHeader("x-ratelimit-remaining", "4321")
				.addHeader("x-ratelimit-reset", "1714564800")
				.addHeader("x-ratelimit-used", "679"));

			client.get("/rate_limit");

			assertThat(client.getRateLimitState()).isEqualTo(new RateLimitState(5000, 4321, 1714564800L, 679));
		}

		@Test
		@DisplayName("Should keep previous state when headers are absent")
		void shouldKeepStateWithoutHeaders() {
			server.enqueue(new MockResponse().setBody("{}").addHeader("x-ratelimit-remaining", "5"));
			server.enqueue(new MockResponse().setBody("{}"));

			client.get("/a");
			client.get("/b");

			assertThat(client.getRateLimitState().remaining()).isEqualTo(5);
		}

	}

	@Nested
	@DisplayName("Error Classification Tests")
	class ErrorClassificationTest {

		@ParameterizedTest
		@ValueSource(ints = { 500, 502, 503, 408, 429 })
		@DisplayName("Should classify as transient")
		void shouldClassifyTransient(int status) {
			server.enqueue(new MockResponse().setResponseCode(status).setBody("err"));

			assertThatThrownBy(() -> client.get("/x")).isInstanceOf(TransientApiException.class)
				.satisfies(e -> assertThat(((GitHubApiException) e).getStatusCode()).isEqualTo(status));
		}

		@ParameterizedTest
		@ValueSource(ints = { 400, 401, 403, 404, 422 })
		@DisplayName("Should classify as permanent")
		void shouldClassifyPermanent(int status) {
			server.enqueue(new MockResponse().setResponseCode(status).setBody("err"));

			assertThatThrownBy(() -> client.get("/x")).isInstanceOf(PermanentApiException.class)
				.satisfies(e -> assertThat(((GitHubApiException) e).isTransient()).isFalse());
		}

		@Test
		@DisplayName("Should classify 403 with exhausted quota as rate limited")
		void shouldClassifyExhausted403() {
			server.enqueue(new MockResponse().setResponseCode(403)
				.addHeader("x-ratelimit-remaining", "0")
				.addHeader("x-ratelimit-reset", "1714564800"));

			assertThatThrownBy(() -> client.get("/x")).isInstanceOfSatisfying(TransientApiException.class, e -> {
				assertThat(e.isRateLimited()).isTrue();
				assertThat(e.getResetEpochSeconds()).isEqualTo(1714564800L);
			});
		}

		@Test
		@DisplayName("Should classify connection failure as transient")
		void shouldClassifyNetworkFailure() throws IOException {
			String url = server.url("/").toString();
			server.shutdown();
			GitHubHttpClient offline = new GitHubHttpClient("t", url, Duration.ofSeconds(2));

			assertThatThrownBy(() -> offline.get("/x")).isInstanceOf(TransientApiException.class);
		}

	}

	@Nested
	@DisplayName("Base URL Tests")
	class BaseUrlTest {

		@Test
		@DisplayName("Should use github.com without enterprise URL")
		void shouldDefaultToGitHubCom() {
			assertThat(GitHubHttpClient.apiBaseUrl(null)).isEqualTo("https://api.github.com");
			assertThat(GitHubHttpClient.apiBaseUrl(" ")).isEqualTo("https://api.github.com");
		}

		@Test
		@DisplayName("Should append /api/v3 to enterprise URL")
		void shouldAppendApiPath() {
			assertThat(GitHubHttpClient.apiBaseUrl("https://ghe.example.com/")).isEqualTo("https://ghe.example.com/api/v3");
			assertThat(GitHubHttpClient.apiBaseUrl("https://ghe.example.com/api/v3"))
				.isEqualTo("https://ghe.example.com/api/v3");
		}

	}

}
