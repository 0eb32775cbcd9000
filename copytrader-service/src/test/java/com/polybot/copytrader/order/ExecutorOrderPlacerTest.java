package com.polybot.copytrader.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polybot.copytrader.domain.TradeSide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutorOrderPlacerTest {

  private static final CopyOrder ORDER = new CopyOrder("7123", TradeSide.BUY, 0.52, 40.0, "0xt1");

  @Mock
  private HttpClient httpClient;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ExecutorOrderPlacer placer;

  @BeforeEach
  void setUp() {
    placer = new ExecutorOrderPlacer("http://executor:8080/", httpClient, objectMapper);
  }

  @Test
  void postsALimitOrderToTheExecutor() throws Exception {
    HttpResponse<String> response = response(200, "{\"mode\":\"LIVE\",\"clobResponse\":{\"orderID\":\"0xorder\",\"status\":\"live\"}}");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    OrderResult result = placer.place(ORDER);

    assertThat(result).isEqualTo(OrderResult.submitted("0xorder"));
    ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(request.capture(), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any());
    assertThat(request.getValue().method()).isEqualTo("POST");
    assertThat(request.getValue().uri()).isEqualTo(URI.create("http://executor:8080/api/polymarket/orders/limit"));
  }

  @Test
  void bodyCarriesTheOrderFields() {
    JsonNode body = placer.body(ORDER);

    assertThat(body.get("tokenId").asText()).isEqualTo("7123");
    assertThat(body.get("side").asText()).isEqualTo("BUY");
    assertThat(body.get("price").asDouble()).isEqualTo(0.52);
    assertThat(body.get("size").asDouble()).isEqualTo(40.0);
  }

  @Test
  void rejectedOrdersAreClassified() throws Exception {
    HttpResponse<String> response = response(400, "{\"error\":\"not enough balance / allowance\"}");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    OrderResult result = placer.place(ORDER);

    assertThat(result.isFailure()).isTrue();
    assertThat(result.failureKind()).isEqualTo(OrderFailureKind.INSUFFICIENT_BALANCE);
  }

  @Test
  void transportErrorsBecomeFailedResults() throws Exception {
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenThrow(new IOException("Connection refused"));

    OrderResult result = placer.place(ORDER);

    assertThat(result.status()).isEqualTo(OrderResult.Status.FAILED);
    assertThat(result.failureKind()).isEqualTo(OrderFailureKind.OTHER);
  }

  @Test
  void readsEitherOrderIdSpelling() throws Exception {
    assertThat(ExecutorOrderPlacer.resolveOrderId(objectMapper.readTree("{\"orderId\":\"a\"}"))).isEqualTo("a");
    assertThat(ExecutorOrderPlacer.resolveOrderId(objectMapper.readTree("{\"clobResponse\":{}}"))).isEqualTo("unknown");
  }

  @Test
  void classifiesCommonFailures() {
    assertThat(OrderFailureKind.classify("Insufficient funds for order")).isEqualTo(OrderFailureKind.INSUFFICIENT_BALANCE);
    assertThat(OrderFailureKind.classify("allowance too low")).isEqualTo(OrderFailureKind.INSUFFICIENT_ALLOWANCE);
    assertThat(OrderFailureKind.classify("tick size mismatch")).isEqualTo(OrderFailureKind.OTHER);
    assertThat(OrderFailureKind.classify(null)).isEqualTo(OrderFailureKind.OTHER);
  }

  @Test
  void paperPlacerNeverSends() {
    assertThat(new PaperOrderPlacer().place(ORDER).status()).isEqualTo(OrderResult.Status.DRY_RUN);
  }

  @SuppressWarnings("unchecked")
  private static HttpResponse<String> response(int status, String body) {
    HttpResponse<String> response = mock(HttpResponse.class);
    lenient().when(response.statusCode()).thenReturn(status);
    lenient().when(response.body()).thenReturn(body);
    return response;
  }
}
