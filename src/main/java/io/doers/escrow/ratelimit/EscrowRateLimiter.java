package io.doers.escrow.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Token buckets protecting the payment gateway and the admin API.
 */
@Component
public class EscrowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(EscrowRateLimiter.class);

    // admin API: 100 requests per minute
    private final Bucket adminApiBucket;

    // gateway: 50 calls per second
    private final Bucket gatewayBucket;

    public EscrowRateLimiter() {
        this.adminApiBucket = Bucket.builder()
            .addLimit(Bandwidth.classic(100, Refill.intervally(100, Duration.ofMinutes(1))))
            .build();

        this.gatewayBucket = Bucket.builder()
            .addLimit(Bandwidth.classic(50, Refill.intervally(50, Duration.ofSeconds(1))))
            .build();
    }

    /**
     * @return true if token consumed, false if rate limit exceeded
     */
    public boolean tryConsumeAdminApi() {
        boolean consumed = adminApiBucket.tryConsume(1);
        if (!consumed) {
            log.warn("Admin API rate limit exceeded. Available tokens: {}", adminApiBucket.getAvailableTokens());
        }
        return consumed;
    }

    public boolean tryConsumeGateway() {
        boolean consumed = gatewayBucket.tryConsume(1);
        if (!consumed) {
            log.warn("Gateway rate limit exceeded. Available tokens: {}", gatewayBucket.getAvailableTokens());
        }
        return consumed;
    }

    public long getRemainingGatewayTokens() {
        return gatewayBucket.getAvailableTokens();
    }
}
