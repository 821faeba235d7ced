package io.doers.escrow.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

@Configuration
public class EscrowDataSourceConfig {

  @Bean
  @Primary
  @ConfigurationProperties("spring.datasource.escrow")
  public DataSourceProperties escrowDataSourceProperties() {
    return new DataSourceProperties();
  }

  @Bean(name = "escrowDataSource")
  @Primary
  public DataSource escrowDataSource(@Qualifier("escrowDataSourceProperties") DataSourceProperties props) {
    return props.initializeDataSourceBuilder().build();
  }

  @Bean(name = "escrowJdbcTemplate")
  @Primary
  public JdbcTemplate escrowJdbcTemplate(@Qualifier("escrowDataSource") DataSource ds) {
    return new JdbcTemplate(ds);
  }

  @Bean(name = "escrowTransactionManager")
  @Primary
  public PlatformTransactionManager escrowTransactionManager(@Qualifier("escrowDataSource") DataSource ds) {
    return new DataSourceTransactionManager(ds);
  }

  // each escrow command runs its conditional writes in one transaction
  @Bean
  public TransactionTemplate escrowTransactionTemplate(
      @Qualifier("escrowTransactionManager") PlatformTransactionManager txManager) {
    return new TransactionTemplate(txManager);
  }
}
