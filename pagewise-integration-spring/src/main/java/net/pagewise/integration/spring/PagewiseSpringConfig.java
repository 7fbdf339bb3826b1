package net.pagewise.integration.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.pagewise.adapter.jdbc.json.MetadataCodec;
import net.pagewise.adapter.jdbc.repo.JdbcItemStore;
import net.pagewise.adapter.jdbc.repo.JdbcJobRecordRepository;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.DomainStore;
import net.pagewise.core.spi.JobRecordRepository;
import net.pagewise.core.spi.TxRunner;
import net.pagewise.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;

@Configuration
public class PagewiseSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public MetadataCodec metadataCodec(ObjectProvider<ObjectMapper> mapper) {
        return new MetadataCodec(mapper.getIfAvailable(ObjectMapper::new));
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean
    public JobRecordRepository jobRecordRepository(DataSource ds, MetadataCodec codec,
                                                   @Value("${pagewise.worker.statement-timeout:30s}") Duration statementTimeout) {
        return new JdbcJobRecordRepository(ds, codec, statementTimeout);
    }

    @Bean
    public DomainStore domainStore(DataSource ds,
                                   @Value("${pagewise.worker.statement-timeout:30s}") Duration statementTimeout) {
        return new JdbcItemStore(ds, statementTimeout);
    }

    @Bean public Clock systemClock() { return Instant::now; }
}
