package io.doers.escrow.gateway;

import io.doers.escrow.config.EscrowProperties;
import org.springframework.stereotype.Component;

@Component
public class PaymentGatewayFactory {

  private final EscrowProperties props;
  private final NoopPaymentGatewayClient noop;
  private final HttpPaymentGatewayClient http;

  public PaymentGatewayFactory(EscrowProperties props, NoopPaymentGatewayClient noop, HttpPaymentGatewayClient http) {
    this.props = props;
    this.noop = noop;
    this.http = http;
  }

  public PaymentGatewayClient get() {
    return "HTTP".equalsIgnoreCase(props.getGateway().getStrategy()) ? http : noop;
  }
}
