package com.acme.strmatch.config;

import com.acme.strmatch.adapters.index.LocusAlleleIndexCache;
import com.acme.strmatch.domain.scoring.ProfileAssembler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MatchingProperties.class)
public class MatchingConfig {

    @Bean
    public ProfileAssembler profileAssembler(MatchingProperties props) {
        return new ProfileAssembler(props.getIdColumn(), props.getAlleleCacheSize());
    }

    @Bean
    public LocusAlleleIndexCache locusAlleleIndexCache() {
        return new LocusAlleleIndexCache();
    }
}
