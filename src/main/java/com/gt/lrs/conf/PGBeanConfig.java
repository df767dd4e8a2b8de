package com.gt.lrs.conf;

import com.gt.lrs.character.CharacterDao;
import com.gt.lrs.character.impl.CharacterDaoPG;
import com.gt.lrs.dictionary.DictionaryHistoryDao;
import com.gt.lrs.dictionary.impl.DictionaryHistoryDaoPG;
import com.gt.lrs.mastery.CharacterMasteryDao;
import com.gt.lrs.mastery.impl.CharacterMasteryDaoPG;
import com.gt.lrs.word.WordDao;
import com.gt.lrs.word.impl.WordDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Random;

@Configuration
@EnableTransactionManagement
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${lrs.datasource.postgres.url}") String url,
                                    @Value("${lrs.datasource.postgres.username}") String username,
                                    @Value("${lrs.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager getTransactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    // Due dates are calendar days in this zone
    @Bean
    public Clock getClock(@Value("${lrs.schedule.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public Random getRandom() {
        return new Random();
    }

    @Bean
    public WordDao getWordDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new WordDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public DictionaryHistoryDao getDictionaryHistoryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new DictionaryHistoryDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public CharacterDao getCharacterDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CharacterDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public CharacterMasteryDao getCharacterMasteryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new CharacterMasteryDaoPG(namedParameterJdbcTemplate);
    }
}
