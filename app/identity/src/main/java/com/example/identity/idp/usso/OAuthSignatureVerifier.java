/*
 * どこで: identity の Ubuntu SSO OAuth IdP
 * 何を: 署名付きリクエストを検証サービスへ 1 回だけ問い合わせ、外部 ID を返す
 * なぜ: OAuth 署名の検証を SSO 側に委ね、consumer key を安定した外部 ID に変換するため
 */
package com.example.identity.idp.usso;

import com.example.identity.config.UssoOAuthProperties;
import com.example.identity.idp.LoginContext;
import com.example.identity.idp.LoginFailureException;
import com.example.identity.idp.LoginFailureException.Reason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class OAuthSignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(OAuthSignatureVerifier.class);

  private static final Pattern CONSUMER_KEY = Pattern.compile("oauth_consumer_key=\"([^\"]*)\"");

  private final RestClient validatorRestClient;
  private final ObjectMapper objectMapper;
  private final UssoOAuthProperties properties;

  public OAuthSignatureVerifier(
      RestClient validatorRestClient, ObjectMapper objectMapper, UssoOAuthProperties properties) {
    this.validatorRestClient = validatorRestClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /**
   * Checks with the validator that the callback request is correctly signed.
   *
   * @return the external identity of the signing consumer
   * @throws LoginFailureException on any verification failure
   */
  public String verify(LoginContext context) {
    final String authorization = context.authorization();
    final OAuthValidationRequest request =
        new OAuthValidationRequest(
            stripQuery(context.requestUrl()),
            context.method(),
            authorization,
            encodeForm(context.params()));

    final OAuthValidationResponse validated = callValidate(request);
    if (validated.hasError()) {
      throw new LoginFailureException(
          Reason.REJECTED, "cannot validate OAuth credentials: " + validated.error());
    }
    if (!validated.valid()) {
      throw new LoginFailureException(Reason.REJECTED, "invalid OAuth credentials");
    }
    return externalId(extractConsumerKey(authorization));
  }

  public String externalId(String consumerKey) {
    return properties.baseUrl() + "/+id/" + consumerKey;
  }

  private OAuthValidationResponse callValidate(OAuthValidationRequest request) {
    try {
      return validatorRestClient
          .post()
          .uri(properties.validatePath())
          .contentType(MediaType.APPLICATION_JSON)
          .body(request)
          .exchange((clientRequest, clientResponse) -> readValidation(clientResponse));
    } catch (LoginFailureException ex) {
      throw ex;
    } catch (RestClientException ex) {
      logger.warn("oauth validator call failed: {}", ex.getMessage());
      throw new LoginFailureException(
          Reason.TRANSPORT, "cannot reach OAuth validation service", ex);
    }
  }

  // exchange() はこの関数の戻り後に必ずレスポンスを close する
  private OAuthValidationResponse readValidation(ClientHttpResponse response) throws IOException {
    final String contentType = response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
    final MediaType mediaType;
    try {
      mediaType = MediaType.parseMediaType(contentType);
    } catch (InvalidMediaTypeException ex) {
      throw new LoginFailureException(
          Reason.INVALID_RESPONSE, "bad content type \"" + nullToEmpty(contentType) + "\"", ex);
    }
    if (!MediaType.APPLICATION_JSON.equalsTypeAndSubtype(mediaType)) {
      final String type = mediaType.getType() + "/" + mediaType.getSubtype();
      throw new LoginFailureException(
          Reason.INVALID_RESPONSE, "unexpected response type \"" + type + "\"");
    }

    final OAuthValidationResponse validated;
    try {
      validated = objectMapper.readValue(response.getBody(), OAuthValidationResponse.class);
    } catch (JsonProcessingException ex) {
      throw new LoginFailureException(
          Reason.INVALID_RESPONSE, "cannot unmarshal validation response", ex);
    }
    if (validated == null) {
      throw new LoginFailureException(Reason.INVALID_RESPONSE, "validation response is empty");
    }
    return validated;
  }

  private String extractConsumerKey(String authorization) {
    final Matcher matcher = CONSUMER_KEY.matcher(authorization);
    final List<String> keys = new ArrayList<>();
    while (matcher.find()) {
      keys.add(matcher.group(1));
    }
    if (keys.size() != 1) {
      // ヘッダーの中身はログにもメッセージにも出さない
      throw new LoginFailureException(
          Reason.MALFORMED_CREDENTIAL, "no consumer key in authorization");
    }
    return keys.get(0);
  }

  @VisibleForTesting
  static String stripQuery(String requestUrl) {
    try {
      new URI(requestUrl);
    } catch (URISyntaxException ex) {
      throw new LoginFailureException(Reason.BAD_REQUEST, "cannot parse request URL", ex);
    }
    final int query = requestUrl.indexOf('?');
    if (query < 0) {
      return requestUrl;
    }
    final int fragment = requestUrl.indexOf('#', query);
    return requestUrl.substring(0, query) + (fragment < 0 ? "" : requestUrl.substring(fragment));
  }

  /** Form-encodes parameters with keys sorted, as the validator recomputes the signature base. */
  @VisibleForTesting
  static String encodeForm(MultiValueMap<String, String> params) {
    final StringBuilder encoded = new StringBuilder();
    for (Map.Entry<String, List<String>> entry : new TreeMap<>(params).entrySet()) {
      final String key = queryEscape(entry.getKey());
      for (String value : entry.getValue()) {
        if (encoded.length() > 0) {
          encoded.append('&');
        }
        encoded.append(key).append('=').append(queryEscape(value == null ? "" : value));
      }
    }
    return encoded.toString();
  }

  private static String queryEscape(String value) {
    // URLEncoder は '*' を残し '~' を符号化するので RFC 3986 の unreserved に揃える
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("*", "%2A").replace("%7E", "~");
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
