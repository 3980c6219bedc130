package cardsdk.attestation;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import cardsdk.CardSdkException;
import cardsdk.SdkConfig;
import cardsdk.SdkError;

import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link OnlineCardVerifier} calling the issuer's JSON endpoint:
 * {@code {"requests":[{"CID":..,"publicKey":..}]}} answered by
 * {@code {"results":[{"passed":..,"error":..,"CID":..,"batch":..}]}}.
 */
public final class HttpOnlineCardVerifier implements OnlineCardVerifier {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);

  private final HttpClient client;
  private final URI endpoint;
  private final Duration timeout;

  public HttpOnlineCardVerifier(SdkConfig config) {
    this(HttpClient.newBuilder().connectTimeout(config.verifierTimeout).build(),
        config.verifierEndpoint, config.verifierTimeout);
  }

  public HttpOnlineCardVerifier(HttpClient client, URI endpoint, Duration timeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public CompletableFuture<VerificationRecord> getCardInfo(String cardId, byte[] cardPublicKey) {
    byte[] body;
    try {
      body = MAPPER.writeValueAsBytes(RawRequests.of(cardId, cardPublicKey));
    } catch (IOException e) {
      return CompletableFuture.failedFuture(
          new CardSdkException(SdkError.NETWORK_ERROR, "Unable to encode verification request", e));
    }
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(body))
        .build();
    return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
        .handle((response, error) -> {
          if (error != null) {
            throw new CompletionException(new CardSdkException(SdkError.NETWORK_ERROR,
                "Verification service unreachable: " + error.getMessage(), error));
          }
          try {
            return parse(cardId, response);
          } catch (CardSdkException e) {
            throw new CompletionException(e);
          }
        });
  }

  static VerificationRecord parse(String cardId, HttpResponse<byte[]> response) throws CardSdkException {
    if (response.statusCode() != 200) {
      throw new CardSdkException(SdkError.NETWORK_ERROR,
          "Verification service answered HTTP " + response.statusCode());
    }
    RawResults results;
    try {
      results = MAPPER.readValue(response.body(), RawResults.class);
    } catch (IOException e) {
      throw new CardSdkException(SdkError.NETWORK_ERROR, "Unreadable verification response", e);
    }
    if (results == null || results.results == null || results.results.isEmpty()) {
      throw new CardSdkException(SdkError.NETWORK_ERROR, "Verification response has no results");
    }
    RawResult result = results.results.get(0);
    if (!result.passed) {
      throw new CardSdkException(SdkError.CARD_VERIFICATION_FAILED,
          result.error != null ? result.error : "Card rejected by verification service");
    }
    return new VerificationRecord(result.cardId != null ? result.cardId : cardId, result.batch);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class RawRequests {
    List<RawRequest> requests;

    static RawRequests of(String cardId, byte[] cardPublicKey) {
      RawRequest request = new RawRequest();
      request.cardId = cardId;
      request.publicKey = Hex.toHexString(cardPublicKey).toUpperCase(Locale.ROOT);
      RawRequests requests = new RawRequests();
      requests.requests = List.of(request);
      return requests;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class RawRequest {
    @JsonProperty("CID")
    String cardId;
    String publicKey;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class RawResults {
    List<RawResult> results;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class RawResult {
    boolean passed;
    String error;
    @JsonProperty("CID")
    String cardId;
    String batch;
  }
}
