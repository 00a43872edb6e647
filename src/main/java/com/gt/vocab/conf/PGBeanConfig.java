package com.gt.vocab.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.vocab.ai.AiCacheDao;
import com.gt.vocab.ai.impl.AiCacheDaoPG;
import com.gt.vocab.event.EventDao;
import com.gt.vocab.event.impl.EventDaoPG;
import com.gt.vocab.review.ReviewLogDao;
import com.gt.vocab.review.impl.ReviewLogDaoPG;
import com.gt.vocab.sync.MergeLockDao;
import com.gt.vocab.sync.impl.MergeLockDaoPG;
import com.gt.vocab.util.JsonColumnMapper;
import com.gt.vocab.vocab.VocabDao;
import com.gt.vocab.vocab.impl.VocabDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${vocab.datasource.postgres.url}") String url,
                                    @Value("${vocab.datasource.postgres.username}") String username,
                                    @Value("${vocab.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public JsonColumnMapper getJsonColumnMapper(ObjectMapper objectMapper) {
        return new JsonColumnMapper(objectMapper);
    }

    @Bean
    public VocabDao getVocabDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, JsonColumnMapper jsonColumnMapper) {
        return new VocabDaoPG(namedParameterJdbcTemplate, jsonColumnMapper);
    }

    @Bean
    public ReviewLogDao getReviewLogDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ReviewLogDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public EventDao getEventDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, JsonColumnMapper jsonColumnMapper) {
        return new EventDaoPG(namedParameterJdbcTemplate, jsonColumnMapper);
    }

    @Bean
    public AiCacheDao getAiCacheDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, JsonColumnMapper jsonColumnMapper) {
        return new AiCacheDaoPG(namedParameterJdbcTemplate, jsonColumnMapper);
    }

    @Bean
    public MergeLockDao getMergeLockDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new MergeLockDaoPG(namedParameterJdbcTemplate);
    }
}
