package com.bsl.dimrank.service;

import com.bsl.dimrank.config.RetrievalConfigProperties;
import com.bsl.dimrank.store.ChunkStoreProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
    RankGuardrailsProperties.class,
    RetrievalConfigProperties.class,
    ChunkStoreProperties.class
})
public class RankingConfig {

    @Bean
    public Clock rankingClock() {
        return Clock.systemUTC();
    }
}
