package com.coinledger.session;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Session storage (coinledger.session.*). {@code store} is {@code memory} (default) or {@code mongo}.
 */
@ConfigurationProperties(prefix = "coinledger.session")
@Getter
@Setter
public class SessionProperties {

    private String store = "memory";
    /** Idle time after which an in-memory session is evicted. */
    private long ttlHours = 24;
    private long maxSessions = 100;
}
