package com.scholary.video.summarizer.gemini;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import java.net.http.HttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

class GeminiFilesClientTest {

  @RegisterExtension
  static WireMockExtension wireMock =
      WireMockExtension.newInstance().options(wireMockConfig().dynamicPort()).build();

  private GeminiFilesClient client;

  @BeforeEach
  void setUp() {
    GeminiProperties properties =
        new GeminiProperties(wireMock.baseUrl(), "test-key", "gemini-2.0-flash-001", 5, 5, 5);
    HttpClient httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    client = new GeminiFilesClient(httpClient, properties, new ObjectMapper());
  }

  @Test
  void getStatus_readsState() {
    wireMock.stubFor(
        get(urlEqualTo("/v1beta/files/abc123"))
            .willReturn(
                aResponse()
                    .withStatus(200)
                    .withBody(
                        "{\"name\":\"files/abc123\",\"state\":\"ACTIVE\",\"mimeType\":\"video/mp4\"}")));

    RemoteFileStatus status = client.getStatus("files/abc123");

    assertThat(status.name()).isEqualTo("files/abc123");
    assertThat(status.state()).isEqualTo(RemoteFileState.ACTIVE);
    assertThat(status.mimeType()).isEqualTo("video/mp4");
    wireMock.verify(
        getRequestedFor(urlEqualTo("/v1beta/files/abc123"))
            .withHeader("x-goog-api-key", equalTo("test-key")));
  }

  @Test
  void getStatus_throwsOnErrorStatus() {
    wireMock.stubFor(
        get(urlEqualTo("/v1beta/files/abc123"))
            .willReturn(aResponse().withStatus(404).withBody("not found")));

    assertThatThrownBy(() -> client.getStatus("files/abc123"))
        .isInstanceOfSatisfying(
            RemoteFileException.class, e -> assertThat(e.getStatusCode()).isEqualTo(404));
  }

  @Test
  void delete_returnsTrueOnSuccess() {
    wireMock.stubFor(delete(urlEqualTo("/v1beta/files/abc123")).willReturn(aResponse().withStatus(200)));

    assertThat(client.delete("files/abc123")).isTrue();
  }

  @Test
  void delete_returnsFalseOnErrorStatus() {
    wireMock.stubFor(delete(urlEqualTo("/v1beta/files/abc123")).willReturn(aResponse().withStatus(500)));

    assertThat(client.delete("files/abc123")).isFalse();
  }

  @Test
  void delete_returnsFalseOnTransportFailure() {
    wireMock.stubFor(
        delete(urlEqualTo("/v1beta/files/abc123"))
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

    assertThat(client.delete("files/abc123")).isFalse();
  }
}
