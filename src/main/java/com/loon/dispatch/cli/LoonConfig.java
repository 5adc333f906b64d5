package com.loon.dispatch.cli;

import com.loon.Loon;
import com.loon.core.session.LoonSession;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the process-wide session, so units that use the static {@link Loon}
 * facade and units that use the session they are given share one registry.
 */
@Configuration
public class LoonConfig {

    @Bean
    public LoonSession loonSession() {
        return Loon.session();
    }
}
