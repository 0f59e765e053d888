package com.acme.gateway.web;

import com.acme.gateway.config.RateLimitingConfig;
import com.acme.gateway.error.GatewayException;
import com.acme.gateway.ratelimit.RateLimitDecision;
import com.acme.gateway.ratelimit.RateLimiter;
import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.core.order.Ordered;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST tier admission control. Every {@code /api} response carries the sustained-window quota
 * headers; rejected requests get 429 with Retry-After and never reach a controller.
 */
@Filter("/api/**")
public class RateLimitFilter implements HttpServerFilter {
  private static final Logger LOG = LoggerFactory.getLogger(RateLimitFilter.class);

  static final String LIMIT_HEADER = "X-RateLimit-Limit";
  static final String REMAINING_HEADER = "X-RateLimit-Remaining";
  static final String RESET_HEADER = "X-RateLimit-Reset";

  private final RateLimiter rateLimiter;
  private final RateLimitingConfig config;
  private final IdentityResolver identities;

  public RateLimitFilter(
      RateLimiter rateLimiter, RateLimitingConfig config, IdentityResolver identities) {
    this.rateLimiter = rateLimiter;
    this.config = config;
    this.identities = identities;
  }

  @Override
  public Publisher<MutableHttpResponse<?>> doFilter(
      HttpRequest<?> request, ServerFilterChain chain) {
    String identity = identities.resolve(request);
    RateLimitDecision decision =
        rateLimiter.admit(identity, config.restFor(identities.apiKeyId(request)));
    if (decision.rejected()) {
      LOG.debug("Rejected {} {} for {}", request.getMethod(), request.getPath(), identity);
      MutableHttpResponse<?> rejected =
          Responses.error(GatewayException.rateLimited(decision.retryAfterSeconds()).toError());
      return Publishers.just(withQuota(rejected, decision));
    }
    return Publishers.map(chain.proceed(request), response -> withQuota(response, decision));
  }

  private static MutableHttpResponse<?> withQuota(
      MutableHttpResponse<?> response, RateLimitDecision decision) {
    response.header(LIMIT_HEADER, String.valueOf(decision.limit()));
    response.header(REMAINING_HEADER, String.valueOf(decision.remaining()));
    response.header(RESET_HEADER, String.valueOf(decision.resetEpochSecond()));
    return response;
  }

  @Override
  public int getOrder() {
    return Ordered.HIGHEST_PRECEDENCE + 100;
  }
}
